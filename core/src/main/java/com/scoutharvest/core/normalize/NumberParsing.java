package com.scoutharvest.core.normalize;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 로케일 구분자를 고려한 숫자 파싱.
 * - 구분자(. , ' 공백) 뒤 숫자 3개 → 천 단위 그룹
 * - 마지막 . 또는 , 뒤 숫자 1~2개 → 소수부, 정수로 반올림(half-up)
 * 파싱 불가면 null (0 아님).
 */
public final class NumberParsing {
    private NumberParsing(){}

    private static final Pattern NUMBER =
            Pattern.compile("\\d+(?:[.,'\\u00A0\\u202F ]\\d+)*");
    private static final Pattern GROUPED_INT =
            Pattern.compile("\\d{1,3}(?:[.,'\\u00A0\\u202F ]\\d{3})+(?!\\d)|\\d+");
    private static final Pattern CC_UNIT =
            Pattern.compile("(?i)(?<![a-z])(?:ccm|cc|cm³|cm3)(?![a-z])");

    /** 금액/거리: "€ 31,980" → 31980, "1.234,56" → 1235 */
    public static Long parseAmount(String text) {
        if (text == null) return null;
        Matcher m = NUMBER.matcher(text);
        if (!m.find()) return null;
        String token = m.group();

        int lastSep = Math.max(token.lastIndexOf('.'), token.lastIndexOf(','));
        String intPart = token;
        String fracPart = "";
        if (lastSep >= 0) {
            String tail = token.substring(lastSep + 1);
            if (tail.length() <= 2 && tail.chars().allMatch(Character::isDigit)) {
                intPart = token.substring(0, lastSep);
                fracPart = tail;
            }
        }
        String digits = intPart.replaceAll("\\D", "");
        if (digits.isEmpty() || digits.length() > 18) return null;
        long value = Long.parseLong(digits);
        if (!fracPart.isEmpty() && roundsUp(fracPart)) value++;
        return value;
    }

    /** 첫 정수 그룹(천 단위 구분 포함): "1,598 cm³" → 1598, "(123 reviews)" → 123 */
    public static Integer firstInteger(String text) {
        if (text == null) return null;
        Matcher m = GROUPED_INT.matcher(text);
        if (!m.find()) return null;
        String digits = m.group().replaceAll("\\D", "");
        if (digits.isEmpty() || digits.length() > 9) return null;
        return Integer.parseInt(digits);
    }

    /**
     * 배기량(cc). cc/ccm/cm³ 단위가 있거나 3자리 이상 정수일 때만 값으로 본다.
     * "1.6 l" 같은 리터 표기는 null.
     */
    public static Integer engineSizeCc(String text) {
        Integer v = firstInteger(text);
        if (v == null) return null;
        if (CC_UNIT.matcher(text).find() || v >= 100) return v;
        return null;
    }

    private static boolean roundsUp(String frac) {
        // 0.5 이상: 첫 자리 5 이상
        return frac.charAt(0) >= '5';
    }
}
