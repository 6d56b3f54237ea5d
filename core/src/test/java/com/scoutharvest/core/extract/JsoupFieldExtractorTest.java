package com.scoutharvest.core.extract;

import com.scoutharvest.core.model.RawFieldMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsoupFieldExtractorTest {

    static final URI PAGE = URI.create("https://www.autoscout24.com/offers/bmw-x5-xdrive40d-m-sport-diesel-black-4b2a9c");

    private final JsoupFieldExtractor extractor = new JsoupFieldExtractor();

    static String fixture(String name) throws IOException {
        try (InputStream in = JsoupFieldExtractorTest.class.getResourceAsStream("/fixtures/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void extractsCurrentMarkup() throws Exception {
        RawFieldMap raw = extractor.extract(fixture("detail-bmw-x5.html"), PAGE);

        assertThat(raw.get("title")).isEqualTo("BMW X5 xDrive40d M Sport");
        assertThat(raw.get("url")).isEqualTo(PAGE.toString());
        assertThat(raw.get("price")).isEqualTo("€ 31,980");
        assertThat(raw.get("dealerName")).isEqualTo("Autohaus Beispiel GmbH");
        assertThat(raw.get("contactPhone")).isEqualTo("+49 89 1234567");
        assertThat(raw.get("power")).isEqualTo("240 kW (326 hp)");
        assertThat(raw.getList("comfort")).containsExactly("Air conditioning", "Heated seats");
        assertThat(raw.getList("images")).containsExactly(
                "https://www.autoscout24.com/images/bmw-x5/1.jpg",
                "https://cdn.example.com/bmw-x5/2.jpg");
        assertThat(raw.has("media")).isFalse();
        assertThat(raw.has("productionDate")).isFalse();
    }

    @Test
    @DisplayName("구형 마크업은 클래스 셀렉터로 폴백, canonical 없으면 페이지 URL")
    void fallsBackToLegacySelectorsAndPageUrl() throws Exception {
        String html = """
                <html><body>
                  <h1>Audi A4 Avant</h1>
                  <div class="price-block"><span>CHF 45'500.–</span></div>
                  <span class="mileage">52,000 mi</span>
                  <ul class="comfort-features"><li>Cruise control</li></ul>
                </body></html>
                """;
        URI page = URI.create("https://www.autoscout24.ch/angebote/audi-a4-77");

        RawFieldMap raw = extractor.extract(html, page);

        assertThat(raw.get("title")).isEqualTo("Audi A4 Avant");
        assertThat(raw.get("url")).isEqualTo(page.toString());
        assertThat(raw.get("price")).isEqualTo("CHF 45'500.–");
        assertThat(raw.get("mileage")).isEqualTo("52,000 mi");
        assertThat(raw.getList("comfort")).containsExactly("Cruise control");
    }

    @Test
    void missingTitleFails() {
        String html = "<html><div data-testid=price-label>€ 9,990</div></html>";

        assertThatThrownBy(() -> extractor.extract(html, PAGE))
                .isInstanceOf(ExtractionFailedException.class)
                .satisfies(e -> assertThat(((ExtractionFailedException) e).getMissing()).containsExactly("title"));
    }

    @Test
    @DisplayName("가격이 없어도 상세 식별자가 있으면 통과, 둘 다 없으면 실패")
    void priceOrDetailIdAnchor() throws Exception {
        String html = "<html><h1>Opel Corsa</h1></html>";

        assertThat(extractor.extract(html, PAGE).get("title")).isEqualTo("Opel Corsa");

        assertThatThrownBy(() -> extractor.extract(html, URI.create("https://ex.com/lst/opel")))
                .isInstanceOf(ExtractionFailedException.class)
                .satisfies(e -> assertThat(((ExtractionFailedException) e).getMissing()).containsExactly("price|url"));
    }

    @Test
    void customRuleTable() throws Exception {
        FieldRuleTable table = new FieldRuleTable(List.of(
                FieldRule.text(FieldRuleTable.TITLE, "h3.name"),
                FieldRule.text(FieldRuleTable.PRICE, "b.cost")));
        RawFieldMap raw = new JsoupFieldExtractor(table)
                .extract("<h3 class=name>Fiat 500</h3><b class=cost>€ 7.450</b>", PAGE);

        assertThat(raw.get("price")).isEqualTo("€ 7.450");
        assertThat(raw.singles()).containsOnlyKeys("title", "price", "url");
    }

    @Test
    void duplicateRuleIsRejected() {
        assertThatThrownBy(() -> new FieldRuleTable(List.of(
                FieldRule.text("title", "h1"), FieldRule.text("title", "h2"))))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
