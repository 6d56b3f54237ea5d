package com.scoutharvest.core.util;

import java.time.Duration;

/**
 * admit(host) 결과: 즉시 허가 또는 "이만큼 기다렸다 다시 요청" 힌트.
 * 힌트는 비차단: 대기는 호출자가 한다.
 */
public record Admission(boolean granted, Duration waitHint) {

    private static final Admission GRANTED = new Admission(true, Duration.ZERO);

    public static Admission permit() { return GRANTED; }

    public static Admission waitFor(Duration d) {
        return new Admission(false, d.isNegative() ? Duration.ZERO : d);
    }
}
