package com.scoutharvest.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 스크랩 설정 (scrape.yml 매핑 대상): 순수 설정 보관용.
 * CLI/환경변수 오버라이드는 app 쪽에서 적용한 뒤 validate() 호출.
 */
public final class ScrapeConfig {

    /** 출력 형식. 직렬화는 service.export 의 RecordSink 구현이 담당 */
    public enum OutputFormat { JSON, CSV }

    /** YAML `retry:` 섹션 */
    public static final class RetryCfg {
        private int maxAttempts = 3;          // 첫 시도 포함 총 시도 횟수
        private long baseDelayMs = 500;       // base × 2^(attempt-1)
        private long maxDelayMs = 8_000;      // 백오프 상한
        private double jitter = 0.1;          // ±10%

        public int getMaxAttempts() { return maxAttempts; }
        public RetryCfg setMaxAttempts(int v) { this.maxAttempts = Math.max(1, v); return this; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public RetryCfg setBaseDelayMs(long v) { this.baseDelayMs = Math.max(1, v); return this; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public RetryCfg setMaxDelayMs(long v) { this.maxDelayMs = Math.max(1, v); return this; }

        public double getJitter() { return jitter; }
        public RetryCfg setJitter(double v) { this.jitter = Math.max(0.0, Math.min(0.5, v)); return this; }
    }

    /** YAML `proxy:` 섹션 */
    public static final class ProxyCfg {
        private List<String> list = List.of();
        private int maxLeasesPerHandle = 1;
        private double quarantineThreshold = -3.0;
        private long cooldownMs = 60_000;
        private long healthHalfLifeMs = 120_000;
        private long poolBackoffMs = 5_000;     // 전부 격리 시 풀 전체 재시도 간격
        private long poolMaxWaitMs = 60_000;    // 이 시간을 넘기면 치명적 실패
        private boolean useEnv = true;          // HTTP_PROXIES / HTTPS_PROXIES 병합

        public List<String> getList() { return list; }
        public ProxyCfg setList(List<String> v) { this.list = (v == null ? List.of() : List.copyOf(v)); return this; }

        public int getMaxLeasesPerHandle() { return maxLeasesPerHandle; }
        public ProxyCfg setMaxLeasesPerHandle(int v) { this.maxLeasesPerHandle = Math.max(1, v); return this; }

        public double getQuarantineThreshold() { return quarantineThreshold; }
        public ProxyCfg setQuarantineThreshold(double v) { this.quarantineThreshold = v; return this; }

        public long getCooldownMs() { return cooldownMs; }
        public ProxyCfg setCooldownMs(long v) { this.cooldownMs = Math.max(0, v); return this; }

        public long getHealthHalfLifeMs() { return healthHalfLifeMs; }
        public ProxyCfg setHealthHalfLifeMs(long v) { this.healthHalfLifeMs = Math.max(1, v); return this; }

        public long getPoolBackoffMs() { return poolBackoffMs; }
        public ProxyCfg setPoolBackoffMs(long v) { this.poolBackoffMs = Math.max(1, v); return this; }

        public long getPoolMaxWaitMs() { return poolMaxWaitMs; }
        public ProxyCfg setPoolMaxWaitMs(long v) { this.poolMaxWaitMs = Math.max(0, v); return this; }

        public boolean isUseEnv() { return useEnv; }
        public ProxyCfg setUseEnv(boolean v) { this.useEnv = v; return this; }
    }

    /** YAML `rate:` 섹션: 호스트별 토큰 버킷 */
    public static final class RateCfg {
        private double rps = 2.0;
        private int burst = 4;

        public double getRps() { return rps; }
        public RateCfg setRps(double v) { this.rps = v; return this; }

        public int getBurst() { return burst; }
        public RateCfg setBurst(int v) { this.burst = Math.max(1, v); return this; }
    }

    /** YAML `output:` 섹션 */
    public static final class OutputCfg {
        private Path dir = Path.of("out");
        private String file;                          // null이면 dir/listings.<ext>
        private OutputFormat format = OutputFormat.JSON;

        public Path getDir() { return dir; }
        public OutputCfg setDir(Path v) { this.dir = v; return this; }

        public String getFile() { return file; }
        public OutputCfg setFile(String v) { this.file = (v == null || v.isBlank()) ? null : v.trim(); return this; }

        public OutputFormat getFormat() { return format; }
        public OutputCfg setFormat(OutputFormat v) { this.format = (v != null ? v : OutputFormat.JSON); return this; }

        /** 최종 출력 경로 */
        public Path resolvePath() {
            if (file != null) return Path.of(file);
            return dir.resolve("listings." + format.name().toLowerCase(java.util.Locale.ROOT));
        }
    }

    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

    public static final List<String> DEFAULT_BLOCK_SIGNATURES = List.of(
            "<title>just a moment...</title>",
            "cf-chl-",
            "/cdn-cgi/challenge-platform",
            "px-captcha",
            "captcha-delivery.com",
            "incapsula incident",
            "<title>access denied</title>",
            "request unsuccessful"
    );

    // ---------- 기본 필드 ----------
    private String baseUrl = "https://www.autoscout24.com";
    private List<String> startUrls = new ArrayList<>();
    private int maxRecords = 300;
    private int concurrency = 8;
    private Duration timeout = Duration.ofSeconds(15);
    private String userAgent = DEFAULT_USER_AGENT;
    private boolean followRedirects = true;
    private List<String> blockSignatures = DEFAULT_BLOCK_SIGNATURES;

    private RetryCfg retry = new RetryCfg();
    private ProxyCfg proxy = new ProxyCfg();
    private RateCfg rate = new RateCfg();
    private OutputCfg output = new OutputCfg();

    // ---------- getters ----------
    public String getBaseUrl() { return baseUrl; }
    public List<String> getStartUrls() { return startUrls; }
    public int getMaxRecords() { return maxRecords; }
    public int getConcurrency() { return concurrency; }
    public Duration getTimeout() { return timeout; }
    public String getUserAgent() { return userAgent; }
    public boolean isFollowRedirects() { return followRedirects; }
    public List<String> getBlockSignatures() { return blockSignatures; }
    public RetryCfg getRetry() { return retry; }
    public ProxyCfg getProxy() { return proxy; }
    public RateCfg getRate() { return rate; }
    public OutputCfg getOutput() { return output; }

    // ---------- fluent setters ----------
    public ScrapeConfig setBaseUrl(String v) { this.baseUrl = v; return this; }
    public ScrapeConfig setStartUrls(List<String> v) {
        this.startUrls = new ArrayList<>();
        if (v != null) for (String s : v) if (s != null && !s.isBlank()) this.startUrls.add(s.trim());
        return this;
    }
    public ScrapeConfig addStartUrl(String v) {
        if (v != null && !v.isBlank()) this.startUrls.add(v.trim());
        return this;
    }
    public ScrapeConfig setMaxRecords(int v) { this.maxRecords = v; return this; }
    public ScrapeConfig setConcurrency(int v) { this.concurrency = Math.max(1, v); return this; }
    public ScrapeConfig setTimeout(Duration v) { this.timeout = v; return this; }
    public ScrapeConfig setUserAgent(String v) {
        this.userAgent = (v == null || v.isBlank()) ? DEFAULT_USER_AGENT : v.trim();
        return this;
    }
    public ScrapeConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ScrapeConfig setBlockSignatures(List<String> v) {
        if (v != null && !v.isEmpty()) this.blockSignatures = List.copyOf(v);
        return this;
    }
    public ScrapeConfig setRetry(RetryCfg v) { this.retry = (v != null ? v : new RetryCfg()); return this; }
    public ScrapeConfig setProxy(ProxyCfg v) { this.proxy = (v != null ? v : new ProxyCfg()); return this; }
    public ScrapeConfig setRate(RateCfg v) { this.rate = (v != null ? v : new RateCfg()); return this; }
    public ScrapeConfig setOutput(OutputCfg v) { this.output = (v != null ? v : new OutputCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (maxRecords < 1) throw new IllegalArgumentException("maxRecords must be >= 1");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(retry, "retry");
        if (retry.getMaxDelayMs() < retry.getBaseDelayMs())
            throw new IllegalArgumentException("retry.maxDelayMs must be >= retry.baseDelayMs");
        Objects.requireNonNull(rate, "rate");
        if (!(rate.getRps() > 0)) throw new IllegalArgumentException("rate.rps must be > 0");
        Objects.requireNonNull(proxy, "proxy");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(output.getDir(), "output.dir");
    }

    // ---------- helpers ----------
    public static ScrapeConfig defaults() { return new ScrapeConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    public ScrapeConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    /** 시작 URL이 비어 있으면 baseUrl 의 /lst 검색 페이지 */
    public List<String> effectiveStartUrls() {
        if (!startUrls.isEmpty()) return List.copyOf(startUrls);
        String b = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return List.of(b + "/lst");
    }
}
