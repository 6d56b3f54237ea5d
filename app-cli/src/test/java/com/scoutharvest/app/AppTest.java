package com.scoutharvest.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AppTest {

    @TempDir
    static Path logs;

    private final ByteArrayOutputStream outBuf = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBuf = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(outBuf, true, StandardCharsets.UTF_8);
    private final PrintStream err = new PrintStream(errBuf, true, StandardCharsets.UTF_8);

    @BeforeAll
    static void quietLogs() {
        System.setProperty("sh.log.dir", logs.toString());
        System.setProperty("sh.log.console", "false");
    }

    @Test
    void helpPrintsUsage() {
        assertThat(App.run(new String[]{"--help"}, Map.of(), out, err)).isEqualTo(App.EXIT_OK);
        assertThat(outBuf.toString(StandardCharsets.UTF_8)).contains("Usage: scout-harvest");
    }

    @Test
    void unknownFlagIsUsageError() {
        assertThat(App.run(new String[]{"--frobnicate"}, Map.of(), out, err)).isEqualTo(App.EXIT_USAGE);
        assertThat(errBuf.toString(StandardCharsets.UTF_8)).contains("Unknown option").contains("Usage:");
    }

    @Test
    void missingConfigFileIsUsageError(@TempDir Path dir) {
        int code = App.run(new String[]{"-c", dir.resolve("absent.yml").toString()}, Map.of(), out, err);

        assertThat(code).isEqualTo(App.EXIT_USAGE);
        assertThat(errBuf.toString(StandardCharsets.UTF_8)).contains("Configuration error");
    }

    @Test
    void loadConfigLayersFileEnvAndFlags(@TempDir Path dir) throws Exception {
        Path yml = dir.resolve("scrape.yml");
        Files.writeString(yml, """
                maxRecords: 50
                proxy:
                  list: ["http://10.0.0.1:3128"]
                output:
                  format: csv
                """);
        CliOptions opts = CliOptions.parse(new String[]{"-c", yml.toString(), "-m", "5"});

        var cfg = App.loadConfig(opts, Map.of("HTTP_PROXIES", "http://10.0.0.2:3128"));

        assertThat(cfg.getMaxRecords()).isEqualTo(5);
        assertThat(cfg.getProxy().getList()).containsExactly("http://10.0.0.1:3128", "http://10.0.0.2:3128");
        assertThat(cfg.getOutput().getFormat().name()).isEqualTo("CSV");
    }

    @Test
    @DisplayName("로컬 서버 대상 전체 실행: 검색 1페이지 + 상세 2건 → JSON 파일")
    void endToEndAgainstLocalServer(@TempDir Path dir) throws Exception {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/lst", ex -> write(ex, 200,
                "<html><a href=\"/offers/golf-1\">Golf</a><a href=\"/offers/polo-2\">Polo</a></html>"));
        server.createContext("/offers/", ex -> {
            String id = ex.getRequestURI().getPath().substring("/offers/".length());
            write(ex, 200, "<html><h1 data-testid=\"heading\">VW " + id + "</h1>"
                    + "<div data-testid=\"price-label\">€ 12,345</div></html>");
        });
        server.start();
        try {
            String base = "http://127.0.0.1:" + server.getAddress().getPort();
            Path yml = dir.resolve("scrape.yml");
            Files.writeString(yml, "baseUrl: \"" + base + "\"\n"
                    + "concurrency: 2\n"
                    + "rate: {rps: 50, burst: 10}\n"
                    + "proxy: {useEnv: false}\n");
            Path outFile = dir.resolve("out/listings.json");

            int code = App.run(new String[]{"-c", yml.toString(), "-o", outFile.toString()}, Map.of(), out, err);

            assertThat(code).isEqualTo(App.EXIT_OK);
            JsonNode arr = new ObjectMapper().readTree(Files.readString(outFile));
            assertThat(arr).hasSize(2);
            assertThat(arr.findValuesAsText("id")).containsExactlyInAnyOrder("golf-1", "polo-2");
        } finally {
            server.stop(0);
        }
    }

    private static void write(HttpExchange ex, int code, String body) throws IOException {
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(code, b.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(b);
        }
    }
}
