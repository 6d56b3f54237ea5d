package com.scoutharvest.core.dedupe;

import java.util.Locale;
import java.util.Objects;

/**
 * 중복 억제용 키: 매물 식별자.
 * 대소문자만 다른 식별자는 같은 매물로 본다.
 */
public record DedupeKey(String listingId) {
    public DedupeKey {
        Objects.requireNonNull(listingId, "listingId");
        if (listingId.isBlank()) throw new IllegalArgumentException("blank listingId");
    }

    public static DedupeKey of(String listingId) {
        return new DedupeKey(listingId == null ? null : listingId.trim().toLowerCase(Locale.ROOT));
    }
}
