package com.scoutharvest.core.normalize;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/** 공백 정리 유틸: trim + 연속 공백(NBSP 포함) 1칸으로. 빈 값은 null. */
public final class TextCleaner {
    private TextCleaner(){}

    private static final Pattern WS = Pattern.compile("[\\s\\u00A0\\u2007\\u202F]+");
    private static final Pattern LIST_SEP = Pattern.compile("[;,]");

    public static String clean(String value) {
        if (value == null) return null;
        String t = WS.matcher(value).replaceAll(" ").trim();
        return t.isEmpty() ? null : t;
    }

    /** 정리 후 빈 값 제거, 순서 유지 중복 제거 */
    public static List<String> cleanDistinct(List<String> values) {
        Set<String> out = new LinkedHashSet<>();
        if (values != null) {
            for (String v : values) {
                String c = clean(v);
                if (c != null) out.add(c);
            }
        }
        return new ArrayList<>(out);
    }

    /** "ABS; ESP, Isofix" → [ABS, ESP, Isofix] */
    public static List<String> splitList(String value) {
        if (value == null) return List.of();
        return cleanDistinct(List.of(LIST_SEP.split(value)));
    }
}
