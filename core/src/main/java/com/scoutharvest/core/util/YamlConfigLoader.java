package com.scoutharvest.core.util;

import com.scoutharvest.core.model.ScrapeConfig;
import com.scoutharvest.core.model.ScrapeConfig.OutputFormat;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * scrape.yml 을 읽어 ScrapeConfig 로 변환.
 *
 * 예상 YAML 키:
 * baseUrl: "https://www.autoscout24.com"
 * startUrls:
 *   - "https://www.autoscout24.com/lst/bmw?sort=age"
 * maxRecords: 300
 * concurrency: 8          # (별칭: parallelRequests)
 * timeoutMs: 15000        # (별칭: timeoutSeconds)
 * userAgent: "..."
 * followRedirects: true
 * blockSignatures: ["cf-chl-", "px-captcha"]
 *
 * retry:
 *   maxAttempts: 3
 *   baseDelayMs: 500
 *   maxDelayMs: 8000
 *   jitter: 0.1
 *
 * proxy:                  # (별칭: 최상위 proxies / proxyList)
 *   list: ["http://user:pw@10.0.0.1:3128"]
 *   maxLeasesPerHandle: 1
 *   quarantineThreshold: -3
 *   cooldownMs: 60000
 *   healthHalfLifeMs: 120000
 *   poolBackoffMs: 5000
 *   poolMaxWaitMs: 60000
 *   useEnv: true
 *
 * rate:
 *   rps: 2.0
 *   burst: 4
 *
 * output:
 *   dir: "out"
 *   file: "out/listings.json"
 *   format: json | csv
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "scrape.yml";

    private YamlConfigLoader() {}

    public static ScrapeConfig loadDefault() throws IOException {
        return load(Path.of(DEFAULT_FILE));
    }

    public static ScrapeConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scrape.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromRoot(newYaml().load(in));
        } catch (RuntimeException e) {
            throw new IOException("Invalid config " + yamlPath + ": " + e.getMessage(), e);
        }
    }

    /** 문자열 YAML 파싱 (테스트/임베디드 용) */
    public static ScrapeConfig parse(String yamlText) {
        return fromRoot(newYaml().load(yamlText == null ? "" : yamlText));
    }

    /**
     * HTTP_PROXIES / HTTPS_PROXIES (콤마 구분) 를 프록시 목록 뒤에 병합.
     * proxy.useEnv=false 면 무시.
     */
    public static ScrapeConfig applyEnvProxies(ScrapeConfig cfg, Map<String, String> env) {
        if (!cfg.getProxy().isUseEnv() || env == null) return cfg;
        LinkedHashSet<String> merged = new LinkedHashSet<>(cfg.getProxy().getList());
        for (String key : List.of("HTTP_PROXIES", "HTTPS_PROXIES")) {
            String raw = env.get(key);
            if (raw == null) continue;
            for (String p : raw.split(",")) {
                if (!p.isBlank()) merged.add(p.trim());
            }
        }
        cfg.getProxy().setList(new ArrayList<>(merged));
        return cfg;
    }

    private static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }

    private static ScrapeConfig fromRoot(Object root) {
        ScrapeConfig cfg = ScrapeConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setString(map, "baseUrl", cfg::setBaseUrl);
        setStringList(map, "startUrls", cfg::setStartUrls);
        if (cfg.getStartUrls().isEmpty()) setStringList(map, "urls", cfg::setStartUrls);
        setInt(map, "maxRecords", cfg::setMaxRecords);
        setInt(map, "parallelRequests", cfg::setConcurrency);
        setInt(map, "concurrency", cfg::setConcurrency);
        setSecondsAsDuration(map, "timeoutSeconds", cfg::setTimeout);
        setLong(map, "timeoutMs", ms -> { if (ms > 0) cfg.setTimeout(Duration.ofMillis(ms)); });
        setString(map, "userAgent", cfg::setUserAgent);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setStringList(map, "blockSignatures", cfg::setBlockSignatures);

        // 2) retry.*
        Map<String, Object> retry = getMap(map, "retry");
        if (retry != null) {
            var r = cfg.getRetry();
            setInt(retry, "maxAttempts", r::setMaxAttempts);
            setLong(retry, "baseDelayMs", r::setBaseDelayMs);
            setLong(retry, "maxDelayMs", r::setMaxDelayMs);
            setDouble(retry, "jitter", r::setJitter);
        }

        // 3) proxy.* (+ 최상위 별칭)
        setStringList(map, "proxyList", l -> cfg.getProxy().setList(l));
        setStringList(map, "proxies", l -> cfg.getProxy().setList(l));
        Map<String, Object> proxy = getMap(map, "proxy");
        if (proxy != null) {
            var p = cfg.getProxy();
            setStringList(proxy, "list", p::setList);
            setInt(proxy, "maxLeasesPerHandle", p::setMaxLeasesPerHandle);
            setDouble(proxy, "quarantineThreshold", p::setQuarantineThreshold);
            setLong(proxy, "cooldownMs", p::setCooldownMs);
            setLong(proxy, "healthHalfLifeMs", p::setHealthHalfLifeMs);
            setLong(proxy, "poolBackoffMs", p::setPoolBackoffMs);
            setLong(proxy, "poolMaxWaitMs", p::setPoolMaxWaitMs);
            setBoolean(proxy, "useEnv", p::setUseEnv);
        }

        // 4) rate.*
        Map<String, Object> rate = getMap(map, "rate");
        if (rate != null) {
            var r = cfg.getRate();
            setDouble(rate, "rps", r::setRps);
            setInt(rate, "burst", r::setBurst);
        }

        // 5) output.* (+ 원본 호환 outputFile / outputFormat)
        var out = cfg.getOutput();
        setString(map, "outputFile", out::setFile);
        setEnum(map, "outputFormat", OutputFormat.class, out::setFormat);
        Map<String, Object> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> out.setDir(Path.of(s)));
            setString(output, "file", out::setFile);
            setEnum(output, "format", OutputFormat.class, out::setFormat);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null && !String.valueOf(o).isBlank()) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).split("\\s*,\\s*")) if (!p.isBlank()) out.add(p.trim());
        }
        if (!out.isEmpty()) setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    private static void setSecondsAsDuration(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        double sec = (v instanceof Number n) ? n.doubleValue() : Double.parseDouble(String.valueOf(v).trim());
        if (sec > 0) setter.accept(Duration.ofMillis((long) (sec * 1000)));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException("Unsupported " + key + ": " + s);
    }
}
