package com.scoutharvest.core.http;

import com.scoutharvest.core.model.FetchOutcome;
import com.scoutharvest.core.model.FetchResult;
import com.scoutharvest.core.proxy.ProxyOutcome;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 원시 응답 → FetchOutcome.
 * - 2xx + 마크업 본문 → SUCCESS
 * - 403/429, 407(프록시 인증 거부), 또는 2xx 본문에 차단 페이지 시그니처 → BLOCKED
 * - 타임아웃/연결 실패, 또는 마크업 없는 2xx → TRANSIENT
 * - 그 밖의 비-2xx → PERMANENT
 */
public final class FetchClassifier {
    private final List<String> signatures;

    public FetchClassifier(List<String> blockSignatures) {
        Objects.requireNonNull(blockSignatures, "blockSignatures");
        this.signatures = blockSignatures.stream()
                .filter(s -> s != null && !s.isBlank())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .toList();
    }

    public FetchResult classify(FetchResult raw) {
        int sc = raw.getStatusCode();
        if (sc < 0) {
            return raw.withOutcome(FetchOutcome.TRANSIENT,
                    raw.getFailure() != null ? raw.getFailure() : (raw.isTimedOut() ? "timeout" : "transport error"));
        }
        if (sc == 407) return raw.withOutcome(FetchOutcome.BLOCKED, "HTTP 407: proxy authentication rejected");
        if (sc == 403 || sc == 429) return raw.withOutcome(FetchOutcome.BLOCKED, "HTTP " + sc);
        if (sc >= 200 && sc < 300) {
            String sig = matchedSignature(raw.getBody());
            if (sig != null) return raw.withOutcome(FetchOutcome.BLOCKED, "block page: " + sig);
            if (!hasMarkup(raw.getBody())) return raw.withOutcome(FetchOutcome.TRANSIENT, "empty or non-markup body");
            return raw.withOutcome(FetchOutcome.SUCCESS, null);
        }
        return raw.withOutcome(FetchOutcome.PERMANENT, "HTTP " + sc);
    }

    /** 분류된 결과 → 프록시 건강도 보고값 */
    public static ProxyOutcome proxyOutcome(FetchResult classified) {
        return switch (classified.getOutcome()) {
            case SUCCESS -> ProxyOutcome.SUCCESS;
            case BLOCKED -> ProxyOutcome.BLOCKED;
            case TRANSIENT -> classified.isTimedOut() ? ProxyOutcome.TIMEOUT
                    : (classified.getStatusCode() < 0 ? ProxyOutcome.TRANSPORT_ERROR : ProxyOutcome.NEUTRAL);
            case PERMANENT -> ProxyOutcome.NEUTRAL;
        };
    }

    String matchedSignature(String body) {
        if (body == null || body.isEmpty() || signatures.isEmpty()) return null;
        String low = body.toLowerCase(Locale.ROOT);
        for (String s : signatures) if (low.contains(s)) return s;
        return null;
    }

    private static boolean hasMarkup(String body) {
        return body != null && !body.isBlank() && body.indexOf('<') >= 0;
    }
}
