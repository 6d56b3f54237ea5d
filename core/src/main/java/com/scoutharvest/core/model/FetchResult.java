package com.scoutharvest.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 단일 fetch 시도의 결과. 본문+상태코드 또는 분류된 실패.
 * statusCode 는 네트워크 예외일 때 -1.
 */
public final class FetchResult {
    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final FetchOutcome outcome;
    private final String failure;
    private final long elapsedMs;
    private final int attempts;
    private final boolean timedOut;

    private FetchResult(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.outcome = b.outcome;
        this.failure = b.failure;
        this.elapsedMs = b.elapsedMs;
        this.attempts = b.attempts;
        this.timedOut = b.timedOut;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public FetchOutcome getOutcome() { return outcome; }
    public String getFailure() { return failure; }
    public long getElapsedMs() { return elapsedMs; }
    public int getAttempts() { return attempts; }
    public boolean isTimedOut() { return timedOut; }

    public boolean isSuccess() { return outcome == FetchOutcome.SUCCESS; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    /** 분류/시도 횟수만 바꾼 사본 */
    public FetchResult withOutcome(FetchOutcome o, String why) {
        return toBuilder().outcome(o).failure(why).build();
    }

    public FetchResult withAttempts(int n) {
        return toBuilder().attempts(n).build();
    }

    public Builder toBuilder() {
        return builder().url(url).statusCode(statusCode).headers(headers).body(body)
                .outcome(outcome).failure(failure).elapsedMs(elapsedMs)
                .attempts(attempts).timedOut(timedOut);
    }

    @Override public String toString() {
        return "FetchResult{" + url + ", status=" + statusCode + ", outcome=" + outcome
                + (failure != null ? ", failure=" + failure : "") + ", attempts=" + attempts + "}";
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode = -1;
        private Map<String, List<String>> headers;
        private String body;
        private FetchOutcome outcome;
        private String failure;
        private long elapsedMs;
        private int attempts = 1;
        private boolean timedOut;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder outcome(FetchOutcome outcome) { this.outcome = outcome; return this; }
        public Builder failure(String failure) { this.failure = failure; return this; }
        public Builder elapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; return this; }
        public Builder attempts(int attempts) { this.attempts = attempts; return this; }
        public Builder timedOut(boolean timedOut) { this.timedOut = timedOut; return this; }

        public FetchResult build() {
            Objects.requireNonNull(url, "url");
            return new FetchResult(this);
        }
    }
}
