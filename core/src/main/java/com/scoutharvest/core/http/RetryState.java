package com.scoutharvest.core.http;

import com.scoutharvest.core.model.ErrorKind;
import com.scoutharvest.core.model.FetchOutcome;
import com.scoutharvest.core.model.FetchResult;

import java.time.Duration;
import java.util.Objects;

/**
 * 작업 1건의 재시도 상태 기계. 스레드와 무관(대기는 호출자가 한다).
 *
 * <pre>
 *   RUNNING --SUCCESS--------------------------> SUCCEEDED
 *   RUNNING --PERMANENT------------------------> FAILED(PERMANENT)
 *   RUNNING --TRANSIENT/BLOCKED, 여유 있음-----> RUNNING (nextDelay 설정)
 *   RUNNING --TRANSIENT/BLOCKED, 한도 도달-----> FAILED(RETRIES_EXHAUSTED)
 * </pre>
 */
public final class RetryState {

    /** Retry-After 상한 */
    static final Duration RETRY_AFTER_CAP = Duration.ofSeconds(30);

    private final RetryPolicy policy;
    private int attempt;                 // 끝난 시도 수
    private FetchOutcome lastOutcome;
    private FetchResult lastResult;
    private Duration nextDelay = Duration.ZERO;
    private boolean terminal;
    private ErrorKind failure;           // terminal && 실패일 때만

    public RetryState(RetryPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /** 분류가 끝난 시도 결과 반영 */
    public void onResult(FetchResult classified) {
        if (terminal) throw new IllegalStateException("retry state already terminal");
        Objects.requireNonNull(classified.getOutcome(), "outcome");
        attempt++;
        lastResult = classified;
        lastOutcome = classified.getOutcome();

        switch (lastOutcome) {
            case SUCCESS -> finish(null);
            case PERMANENT -> finish(ErrorKind.PERMANENT);
            case TRANSIENT, BLOCKED -> {
                if (policy.shouldRetry(lastOutcome, attempt)) {
                    nextDelay = retryAfterOr(policy.nextDelay(attempt), classified);
                } else {
                    finish(ErrorKind.RETRIES_EXHAUSTED);
                }
            }
        }
    }

    private void finish(ErrorKind kind) {
        terminal = true;
        failure = kind;
        nextDelay = Duration.ZERO;
    }

    public int attempt() { return attempt; }
    public FetchOutcome lastOutcome() { return lastOutcome; }
    public FetchResult lastResult() { return lastResult; }
    public Duration nextDelay() { return nextDelay; }
    public boolean isTerminal() { return terminal; }
    public boolean succeeded() { return terminal && failure == null; }
    public ErrorKind failure() { return failure; }

    /** 429 + 숫자형 Retry-After 는 계산된 지연을 덮어쓴다(상한 30s). HTTP-date 형태는 무시. */
    static Duration retryAfterOr(Duration fallback, FetchResult r) {
        if (r.getStatusCode() != 429) return fallback;
        String v = r.header("Retry-After");
        if (v == null || v.isBlank()) return fallback;
        try {
            long sec = Long.parseLong(v.trim());
            if (sec < 0) return fallback;
            Duration d = Duration.ofSeconds(sec);
            return d.compareTo(RETRY_AFTER_CAP) > 0 ? RETRY_AFTER_CAP : d;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
