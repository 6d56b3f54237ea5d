package com.scoutharvest.core.normalize;

import com.scoutharvest.core.model.Contact;
import com.scoutharvest.core.model.DealerInfo;
import com.scoutharvest.core.model.ListingRecord;
import com.scoutharvest.core.model.Mileage;
import com.scoutharvest.core.model.MonthYear;
import com.scoutharvest.core.model.Power;
import com.scoutharvest.core.model.Price;
import com.scoutharvest.core.model.RawFieldMap;
import com.scoutharvest.core.util.UrlUtils;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * RawFieldMap → ListingRecord. 부수효과 없는 순수 변환(같은 입력 → 같은 레코드).
 * 파싱 불가 숫자는 null, 표시 문자열은 정리만 해서 보존.
 * url/title 이 없으면 IllegalArgumentException.
 */
public final class ListingNormalizer {

    private static final Pattern KW = Pattern.compile("(\\d+)\\s*kW", Pattern.CASE_INSENSITIVE);
    private static final Pattern HP = Pattern.compile("(\\d+)\\s*(?:hp|PS|CV)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern MILES = Pattern.compile("\\b(?:mi|miles)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern KM = Pattern.compile("\\bkm\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern DAY_MONTH_YEAR = Pattern.compile("\\b(\\d{1,2})[./-](\\d{1,2})[./-](\\d{4})\\b");
    private static final Pattern MONTH_YEAR = Pattern.compile("\\b(\\d{1,2})[./-](\\d{4})\\b");
    private static final Pattern YEAR = Pattern.compile("\\b(\\d{4})\\b");

    public ListingRecord normalize(RawFieldMap raw) {
        Objects.requireNonNull(raw, "raw");
        String url = clean(raw, "url");
        String title = clean(raw, "title");
        if (title == null) throw new IllegalArgumentException("listing has no title");

        return ListingRecord.builder()
                .id(identifier(url))
                .title(title)
                .url(url)
                .mark(clean(raw, "mark"))
                .model(clean(raw, "model"))
                .modelVersion(clean(raw, "modelVersion"))
                .location(clean(raw, "location"))
                .dealer(dealer(clean(raw, "dealerName"), clean(raw, "dealerRatings")))
                .price(price(clean(raw, "price")))
                .mileage(mileage(clean(raw, "mileage")))
                .gearbox(clean(raw, "gearbox"))
                .firstRegistration(monthYear(clean(raw, "firstRegistration")))
                .fuelType(clean(raw, "fuelType"))
                .power(power(clean(raw, "power")))
                .seller(clean(raw, "seller"))
                .contact(contact(clean(raw, "contactName"), clean(raw, "contactPhone")))
                .bodyType(clean(raw, "bodyType"))
                .drivetrain(clean(raw, "drivetrain"))
                .seats(NumberParsing.firstInteger(clean(raw, "seats")))
                .engineSize(clean(raw, "engineSize"))
                .engineSizeCc(NumberParsing.engineSizeCc(clean(raw, "engineSize")))
                .gears(NumberParsing.firstInteger(clean(raw, "gears")))
                .emissionClass(clean(raw, "emissionClass"))
                .comfort(features(raw, "comfort"))
                .media(features(raw, "media"))
                .safety(features(raw, "safety"))
                .extras(features(raw, "extras"))
                .colour(clean(raw, "colour"))
                .manufacturerColour(clean(raw, "manufacturerColour"))
                .productionDate(monthYear(clean(raw, "productionDate")))
                .images(images(raw))
                .build();
    }

    // ---------------- 필드별 규칙 ----------------

    /** 상세 경로 식별자 → 마지막 경로 세그먼트 → URL 자체 순으로 */
    static String identifier(String url) {
        if (url == null) throw new IllegalArgumentException("listing has no url");
        return UrlUtils.listingId(url)
                .or(() -> UrlUtils.lastPathSegment(url))
                .orElse(url);
    }

    static Price price(String display) {
        if (display == null) return null;
        return new Price(display, NumberParsing.parseAmount(display), CurrencyTable.detect(display).orElse(null));
    }

    static Mileage mileage(String display) {
        if (display == null) return null;
        String unit = MILES.matcher(display).find() ? "mi" : (KM.matcher(display).find() ? "km" : null);
        return new Mileage(display, NumberParsing.parseAmount(display), unit);
    }

    static Power power(String display) {
        if (display == null) return null;
        return new Power(display, group(KW, display), group(HP, display));
    }

    /** MM/YYYY, DD/MM/YYYY (. - 구분자 포함), 연도만 */
    static MonthYear monthYear(String display) {
        if (display == null) return null;
        Integer month = null, year = null;
        Matcher m;
        if ((m = DAY_MONTH_YEAR.matcher(display)).find()) {
            month = Integer.valueOf(m.group(2));
            year = Integer.valueOf(m.group(3));
        } else if ((m = MONTH_YEAR.matcher(display)).find()) {
            month = Integer.valueOf(m.group(1));
            year = Integer.valueOf(m.group(2));
        } else if ((m = YEAR.matcher(display)).find()) {
            year = Integer.valueOf(m.group(1));
        }
        if (year == null || year < 1900 || year > 2100 || (month != null && (month < 1 || month > 12))) {
            return new MonthYear(display, null, null);
        }
        return new MonthYear(display, month, year);
    }

    static DealerInfo dealer(String name, String ratings) {
        if (name == null && ratings == null) return null;
        return new DealerInfo(name, ratings, NumberParsing.firstInteger(ratings));
    }

    static Contact contact(String name, String phone) {
        if (name == null && phone == null) return null;
        return new Contact(name, phone);
    }

    /** MANY 추출 목록 우선, 없으면 단일 문자열을 ; , 로 분할 */
    static List<String> features(RawFieldMap raw, String field) {
        List<String> list = raw.getList(field);
        if (!list.isEmpty()) return TextCleaner.cleanDistinct(list);
        return TextCleaner.splitList(raw.get(field));
    }

    static List<String> images(RawFieldMap raw) {
        List<String> list = raw.getList("images");
        if (list.isEmpty() && raw.get("images") != null) list = List.of(raw.get("images"));
        return TextCleaner.cleanDistinct(list);
    }

    private static String clean(RawFieldMap raw, String field) {
        return TextCleaner.clean(raw.get(field));
    }

    private static Integer group(Pattern p, String s) {
        Matcher m = p.matcher(s);
        if (!m.find()) return null;
        try {
            return Integer.valueOf(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
