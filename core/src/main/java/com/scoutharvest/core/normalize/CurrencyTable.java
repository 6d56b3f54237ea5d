package com.scoutharvest.core.normalize;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 선언된 통화 표기 → ISO 코드. 환율 변환은 하지 않는다.
 * 위에서부터 먼저 맞는 항목이 이긴다(CHF 의 "Fr." 가 "$" 보다 앞).
 */
public final class CurrencyTable {
    private CurrencyTable(){}

    record Entry(String token, String code) {}

    static final List<Entry> ENTRIES = List.of(
            new Entry("€", "EUR"),
            new Entry("EUR", "EUR"),
            new Entry("CHF", "CHF"),
            new Entry("FR.", "CHF"),
            new Entry("£", "GBP"),
            new Entry("GBP", "GBP"),
            new Entry("USD", "USD"),
            new Entry("$", "USD"));

    public static Optional<String> detect(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String up = text.toUpperCase(Locale.ROOT);
        for (Entry e : ENTRIES) {
            if (up.contains(e.token())) return Optional.of(e.code());
        }
        return Optional.empty();
    }
}
