package com.scoutharvest.core.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 상세 페이지 선언적 셀렉터 표. data-testid 셀렉터 우선, 구형 마크업은 클래스/마이크로데이터로 폴백.
 * 필드명은 RawFieldMap 키이자 ListingNormalizer 입력.
 */
public final class FieldRuleTable {

    public static final String TITLE = "title";
    public static final String URL = "url";
    public static final String PRICE = "price";
    public static final String IMAGES = "images";

    private final Map<String, FieldRule> rules;

    public FieldRuleTable(List<FieldRule> rules) {
        Map<String, FieldRule> m = new LinkedHashMap<>();
        for (FieldRule r : rules) {
            if (m.put(r.field(), r) != null) throw new IllegalArgumentException("duplicate rule: " + r.field());
        }
        this.rules = Collections.unmodifiableMap(m);
    }

    public List<FieldRule> rules() { return new ArrayList<>(rules.values()); }

    public Optional<FieldRule> rule(String field) { return Optional.ofNullable(rules.get(field)); }

    public static FieldRuleTable defaults() {
        return new FieldRuleTable(List.of(
                FieldRule.text(TITLE, "h1[data-testid=heading]", "h1", "h2[data-item-name=car-title]"),
                new FieldRule(URL, List.of("link[rel=canonical]", "meta[property=og:url]"),
                        Cardinality.ONE, List.of("href", "content"), true),
                FieldRule.text(PRICE, "[data-testid=price-label]", "div.price-block span", "span[data-item-name=price]"),
                FieldRule.text("location", "[data-testid=seller-address]", "div.seller-address", "span[itemprop=address]"),
                FieldRule.text("dealerName", "[data-testid=seller-name]", "div.dealer-info h2", ".cldt-vendor-contact-box h2"),
                FieldRule.text("dealerRatings", "[data-testid=rating-count]", "span.dealer-rating-count"),
                FieldRule.text("mark", "[data-testid=makeLabel]", "span[itemprop=brand]"),
                FieldRule.text("model", "[data-testid=modelLabel]", "span[itemprop=model]"),
                FieldRule.text("modelVersion", "[data-testid=versionLabel]", "span.model-version"),
                FieldRule.text("mileage", "[data-testid=mileage-label]", "span.mileage",
                        "dl[data-item-name=vehicle-details] dd:nth-of-type(1)"),
                FieldRule.text("gearbox", "[data-testid=transmission-label]", "span.gearbox"),
                FieldRule.text("firstRegistration", "[data-testid=first-registration-label]", "span.first-registration"),
                FieldRule.text("fuelType", "[data-testid=fuel-label]", "span.fuel"),
                FieldRule.text("power", "[data-testid=power-label]", "span.power"),
                FieldRule.text("seller", "[data-testid=seller-type-label]", "span.seller-type"),
                FieldRule.text("contactName", "[data-testid=seller-contact-name]", ".cldt-vendor-contact-box span"),
                FieldRule.text("contactPhone", "[data-testid=seller-phone]", "a[href^='tel:']"),
                FieldRule.text("bodyType", "[data-testid=body-type-label]", "span.body-type"),
                FieldRule.text("drivetrain", "[data-testid=drive-type-label]", "span.drivetrain"),
                FieldRule.text("seats", "[data-testid=num-seats-label]", "span.seats"),
                FieldRule.text("engineSize", "[data-testid=cubic-capacity-label]", "span.engine-size"),
                FieldRule.text("gears", "[data-testid=gears-label]", "span.gears"),
                FieldRule.text("emissionClass", "[data-testid=emission-class-label]", "span.emission-class"),
                FieldRule.text("colour", "[data-testid=exterior-color-label]", "span.exterior-color"),
                FieldRule.text("manufacturerColour", "[data-testid=manufacturer-color-label]", "span.manufacturer-color"),
                FieldRule.text("productionDate", "[data-testid=production-date-label]", "span.production-date"),
                FieldRule.texts("comfort", "[data-testid=comfort-features] li", "ul.comfort-features li"),
                FieldRule.texts("media", "[data-testid=media-features] li", "ul.media-features li"),
                FieldRule.texts("safety", "[data-testid=safety-features] li", "ul.safety-features li"),
                FieldRule.texts("extras", "[data-testid=other-features] li", "ul.extra-features li"),
                new FieldRule(IMAGES, List.of("figure img", "[data-testid=gallery] img", ".image-gallery img"),
                        Cardinality.MANY, List.of("src", "data-src"), true)
        ));
    }
}
