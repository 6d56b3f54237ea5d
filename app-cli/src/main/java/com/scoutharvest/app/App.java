package com.scoutharvest.app;

import com.scoutharvest.app.logging.LogSetup;
import com.scoutharvest.core.api.RecordSink;
import com.scoutharvest.core.model.ScrapeConfig;
import com.scoutharvest.core.service.ScrapeAbortedException;
import com.scoutharvest.core.service.ScrapeResult;
import com.scoutharvest.core.service.ScrapeService;
import com.scoutharvest.core.service.export.DealerSummary;
import com.scoutharvest.core.service.export.RecordSinks;
import com.scoutharvest.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * CLI 진입점.
 * 종료 코드: 0 성공, 1 실행 중단(프록시 풀 불가/출력 실패), 2 사용법/설정 오류.
 */
public final class App {

    static final int EXIT_OK = 0;
    static final int EXIT_ABORTED = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    private App() {}

    public static void main(String[] args) {
        System.exit(run(args, System.getenv(), System.out, System.err));
    }

    static int run(String[] args, Map<String, String> env, PrintStream out, PrintStream err) {
        CliOptions opts;
        try {
            opts = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if (opts.help()) {
            out.println(CliOptions.USAGE);
            return EXIT_OK;
        }

        LogSetup.init(Path.of(System.getProperty("sh.log.dir", "logs")), LogSetup.verbosity(opts.verbosity()));

        ScrapeConfig cfg;
        try {
            cfg = loadConfig(opts, env);
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Configuration error: {}", e.getMessage());
            err.println("Configuration error: " + e.getMessage());
            return EXIT_USAGE;
        }

        AtomicBoolean cancel = new AtomicBoolean(false);
        Thread hook = new Thread(() -> cancel.set(true), "shutdown-cancel");
        Runtime.getRuntime().addShutdownHook(hook);

        DealerSummary dealers = new DealerSummary();
        Path outPath = cfg.getOutput().resolvePath();
        try (RecordSink sink = RecordSinks.tee(RecordSinks.open(cfg.getOutput()), dealers)) {

            ScrapeResult result = new ScrapeService(cfg).run(sink,
                    s -> LOG.warn("Skipped {} [{}]: {}", s.url(), s.reason(), s.detail()),
                    null, cancel);

            LOG.info("Wrote {} record(s) to {} (state={}, skipped={})",
                    result.stats().recordsEmitted, outPath, result.finalState(), result.stats().skipped);
            for (DealerSummary.Entry d : dealers.entries()) {
                LOG.info("Dealer {}: listings={}, location={}, ratings={}",
                        d.dealerName(), d.listingCount(), d.location(), d.ratings());
            }
            return EXIT_OK;
        } catch (ScrapeAbortedException e) {
            LOG.error("Scrape aborted: {}", e.getMessage());
            err.println("Scrape aborted: " + e.getMessage());
            return EXIT_ABORTED;
        } catch (IOException e) {
            LOG.error("Output failed for {}: {}", outPath, e.getMessage(), e);
            err.println("Output failed: " + e.getMessage());
            return EXIT_ABORTED;
        } finally {
            removeHook(hook);
        }
    }

    /** -c 파일 → ./scrape.yml(있으면) → 기본값, 이어서 환경변수 프록시, 플래그 순으로 덮어쓴다 */
    static ScrapeConfig loadConfig(CliOptions opts, Map<String, String> env) throws IOException {
        ScrapeConfig cfg;
        if (opts.config() != null) {
            cfg = YamlConfigLoader.load(opts.config());
        } else if (Files.exists(Path.of(YamlConfigLoader.DEFAULT_FILE))) {
            cfg = YamlConfigLoader.loadDefault();
        } else {
            cfg = ScrapeConfig.defaults();
        }
        YamlConfigLoader.applyEnvProxies(cfg, env);
        opts.applyTo(cfg);
        cfg.validate();
        return cfg;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // JVM 종료 중이면 제거 불가 → 그대로 둔다
            LOG.debug("Shutdown in progress; hook stays registered");
        }
    }
}
