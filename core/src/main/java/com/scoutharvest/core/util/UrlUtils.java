package com.scoutharvest.core.util;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** URL 정규화 + 매물 식별자/검색 페이지 시그니처 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** 상세 페이지 경로 마커 (영문/독일어 사이트) */
    private static final List<String> DETAIL_MARKERS = List.of("/offers/", "/angebote/");

    /** 페이지 번호로 쓰이는 쿼리 키 */
    public static final String PAGE_PARAM = "page";

    /**
     * 정규화 규칙:
     * - fragment 제거
     * - host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈 경로를 "/"로, 중복 슬래시 축소
     * - 퍼센트 인코딩은 보존
     */
    public static URI normalize(URI u) {
        if (u == null) return null;

        String scheme = (u.getScheme() == null ? "http" : u.getScheme()).toLowerCase(Locale.ROOT);
        String host = u.getHost() != null ? u.getHost() : u.getAuthority();
        if (host == null) host = "";
        host = host.toLowerCase(Locale.ROOT);

        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = (u.getRawPath() == null || u.getRawPath().isEmpty()) ? "/" : u.getRawPath();
        path = path.replaceAll("/{2,}", "/");

        // 인코딩된 경로/쿼리(%26, %2B, %2F ...)는 raw 그대로 둔다
        StringBuilder sb = new StringBuilder(scheme).append("://").append(host);
        if (port >= 0) sb.append(':').append(port);
        sb.append(path);
        if (u.getRawQuery() != null) sb.append('?').append(u.getRawQuery());
        try {
            return URI.create(sb.toString());
        } catch (IllegalArgumentException e) {
            return u;
        }
    }

    /** base 기준 상대 href 를 절대 URI 로. http(s) 아니거나 깨진 값이면 empty. */
    public static Optional<URI> resolve(URI base, String href) {
        if (href == null || href.isBlank()) return Optional.empty();
        try {
            URI u = (base == null) ? URI.create(href.trim()) : base.resolve(href.trim());
            String s = u.getScheme();
            if (s == null) return Optional.empty();
            if (!s.equalsIgnoreCase("http") && !s.equalsIgnoreCase("https")) return Optional.empty();
            return Optional.of(normalize(u));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** /offers/ 또는 /angebote/ 경로면 상세 페이지 */
    public static boolean isDetailUrl(URI u) {
        if (u == null || u.getPath() == null) return false;
        String p = u.getPath().toLowerCase(Locale.ROOT);
        for (String m : DETAIL_MARKERS) if (p.contains(m)) return true;
        return false;
    }

    /**
     * 매물 식별자 = 상세 경로 마커 뒤 마지막 비어있지 않은 경로 세그먼트.
     * 예) /offers/bmw-x5-xdrive40d-diesel-black-5c1f...-4b2a → "bmw-x5-xdrive40d-diesel-black-5c1f...-4b2a"
     */
    public static Optional<String> listingId(URI u) {
        if (!isDetailUrl(u)) return Optional.empty();
        String[] segs = u.getPath().split("/");
        for (int i = segs.length - 1; i >= 0; i--) {
            String s = segs[i].trim();
            if (s.isEmpty()) continue;
            String low = s.toLowerCase(Locale.ROOT);
            if (low.equals("offers") || low.equals("angebote")) return Optional.empty();
            return Optional.of(s);
        }
        return Optional.empty();
    }

    public static Optional<String> listingId(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        try {
            return listingId(URI.create(url.trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** 경로의 마지막 비어있지 않은 세그먼트(상세 마커 무관). */
    public static Optional<String> lastPathSegment(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        try {
            String path = URI.create(url.trim()).getPath();
            if (path == null) return Optional.empty();
            String[] segs = path.split("/");
            for (int i = segs.length - 1; i >= 0; i--) {
                if (!segs[i].isBlank()) return Optional.of(segs[i].trim());
            }
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /** 쿼리의 page 값. 없거나 숫자가 아니면 -1 */
    public static int pageParam(URI u) {
        for (String[] kv : queryPairs(u)) {
            if (kv[0].equalsIgnoreCase(PAGE_PARAM)) {
                try { return Integer.parseInt(kv[1].trim()); }
                catch (NumberFormatException e) { return -1; }
            }
        }
        return -1;
    }

    /**
     * 검색 쿼리 시그니처: host + path + (page 제외) 정렬된 쿼리 쌍.
     * 정렬 순서가 달라도 같은 검색이면 같은 시그니처.
     */
    public static String querySignature(URI u) {
        URI n = normalize(u);
        List<String> pairs = new ArrayList<>();
        for (String[] kv : queryPairs(n)) {
            if (kv[0].equalsIgnoreCase(PAGE_PARAM)) continue;
            pairs.add(kv[0] + "=" + kv[1]);
        }
        pairs.sort(String::compareTo);
        return n.getHost() + n.getRawPath() + "?" + String.join("&", pairs);
    }

    private static List<String[]> queryPairs(URI u) {
        List<String[]> out = new ArrayList<>();
        if (u == null) return out;
        String q = u.getRawQuery();
        if (q == null || q.isBlank()) return out;
        for (String pair : q.split("&")) {
            if (pair.isEmpty()) continue;
            String[] kv = pair.split("=", 2);
            out.add(new String[]{kv[0], kv.length > 1 ? kv[1] : ""});
        }
        return out;
    }
}
