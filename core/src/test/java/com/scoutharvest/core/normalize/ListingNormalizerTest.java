package com.scoutharvest.core.normalize;

import com.scoutharvest.core.extract.JsoupFieldExtractor;
import com.scoutharvest.core.model.ListingRecord;
import com.scoutharvest.core.model.Mileage;
import com.scoutharvest.core.model.MonthYear;
import com.scoutharvest.core.model.Power;
import com.scoutharvest.core.model.Price;
import com.scoutharvest.core.model.RawFieldMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ListingNormalizerTest {

    private static final URI PAGE = URI.create("https://www.autoscout24.com/offers/bmw-x5-xdrive40d-m-sport-diesel-black-4b2a9c");

    private final ListingNormalizer normalizer = new ListingNormalizer();

    private static String fixture() throws Exception {
        try (InputStream in = ListingNormalizerTest.class.getResourceAsStream("/fixtures/detail-bmw-x5.html")) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void normalizesFixturePage() throws Exception {
        ListingRecord r = normalizer.normalize(new JsoupFieldExtractor().extract(fixture(), PAGE));

        assertThat(r.getId()).isEqualTo("bmw-x5-xdrive40d-m-sport-diesel-black-4b2a9c");
        assertThat(r.getTitle()).isEqualTo("BMW X5 xDrive40d M Sport");
        assertThat(r.getPrice()).isEqualTo(new Price("€ 31,980", 31980L, "EUR"));
        assertThat(r.getMileage()).isEqualTo(new Mileage("161,415 km", 161415L, "km"));
        assertThat(r.getPower()).isEqualTo(new Power("240 kW (326 hp)", 240, 326));
        assertThat(r.getFirstRegistration()).isEqualTo(new MonthYear("06/2019", 6, 2019));
        assertThat(r.getDealer().name()).isEqualTo("Autohaus Beispiel GmbH");
        assertThat(r.getDealer().ratingCount()).isEqualTo(1204);
        assertThat(r.getContact().phone()).isEqualTo("+49 89 1234567");
        assertThat(r.getSeats()).isEqualTo(5);
        assertThat(r.getEngineSizeCc()).isEqualTo(2993);
        assertThat(r.getGears()).isEqualTo(8);
        assertThat(r.getComfort()).containsExactly("Air conditioning", "Heated seats");
        assertThat(r.getMedia()).isEmpty();
        assertThat(r.getProductionDate()).isNull();
        assertThat(r.getImages()).hasSize(2);
    }

    @Test
    @DisplayName("같은 HTML 을 두 번 추출+정규화하면 같은 레코드")
    void extractAndNormalizeIsIdempotent() throws Exception {
        JsoupFieldExtractor ex = new JsoupFieldExtractor();
        ListingRecord a = normalizer.normalize(ex.extract(fixture(), PAGE));
        ListingRecord b = normalizer.normalize(ex.extract(fixture(), PAGE));

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
    }

    @Test
    void priceCurrencies() {
        assertThat(ListingNormalizer.price("CHF 45'500.–")).isEqualTo(new Price("CHF 45'500.–", 45500L, "CHF"));
        assertThat(ListingNormalizer.price("£12,499.50").currency()).isEqualTo("GBP");
        assertThat(ListingNormalizer.price("$ 18,200").currency()).isEqualTo("USD");
        assertThat(ListingNormalizer.price("Price on request")).isEqualTo(new Price("Price on request", null, null));
        assertThat(ListingNormalizer.price(null)).isNull();
    }

    @Test
    void mileageUnits() {
        assertThat(ListingNormalizer.mileage("52,000 mi").unit()).isEqualTo("mi");
        assertThat(ListingNormalizer.mileage("12.500 km").value()).isEqualTo(12500L);
        assertThat(ListingNormalizer.mileage("unknown")).isEqualTo(new Mileage("unknown", null, null));
    }

    @Test
    void powerVariants() {
        assertThat(ListingNormalizer.power("110 PS")).isEqualTo(new Power("110 PS", null, 110));
        assertThat(ListingNormalizer.power("85 kW")).isEqualTo(new Power("85 kW", 85, null));
        assertThat(ListingNormalizer.power("n/a")).isEqualTo(new Power("n/a", null, null));
    }

    @Test
    @DisplayName("날짜: DD.MM.YYYY, MM/YYYY, YYYY, 범위 밖이면 표시만 보존")
    void monthYearFormats() {
        assertThat(ListingNormalizer.monthYear("15.03.2018")).isEqualTo(new MonthYear("15.03.2018", 3, 2018));
        assertThat(ListingNormalizer.monthYear("06/2019")).isEqualTo(new MonthYear("06/2019", 6, 2019));
        assertThat(ListingNormalizer.monthYear("2017")).isEqualTo(new MonthYear("2017", null, 2017));
        assertThat(ListingNormalizer.monthYear("13/2019")).isEqualTo(new MonthYear("13/2019", null, null));
        assertThat(ListingNormalizer.monthYear("n/a")).isEqualTo(new MonthYear("n/a", null, null));
    }

    @Test
    void featuresFromSingleStringAreSplit() {
        RawFieldMap raw = new RawFieldMap()
                .put("title", "VW Golf")
                .put("url", "https://ex.com/offers/vw-golf-1")
                .put("safety", "ABS; ESP, Isofix, ABS");

        ListingRecord r = normalizer.normalize(raw);

        assertThat(r.getSafety()).containsExactly("ABS", "ESP", "Isofix");
        assertThat(r.getPrice()).isNull();
        assertThat(r.getDealer()).isNull();
    }

    @Test
    void identifierFallsBackToLastSegmentThenUrl() {
        assertThat(ListingNormalizer.identifier("https://ex.com/cars/12345")).isEqualTo("12345");
        assertThat(ListingNormalizer.identifier("https://ex.com/")).isEqualTo("https://ex.com/");
    }

    @Test
    void missingTitleOrUrlIsRejected() {
        assertThatThrownBy(() -> normalizer.normalize(new RawFieldMap().put("url", "https://ex.com/offers/x")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> normalizer.normalize(new RawFieldMap().put("title", "x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void textCleanerCollapsesWhitespace() {
        assertThat(TextCleaner.clean("  a   b\n\tc ")).isEqualTo("a b c");
        assertThat(TextCleaner.clean("   ")).isNull();
        assertThat(TextCleaner.cleanDistinct(List.of(" x", "x ", "", "y"))).containsExactly("x", "y");
    }
}
