package dev;

import com.sun.net.httpserver.*;

import java.io.*;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 로컬 가짜 매물 사이트 (수동 end-to-end 스모크용).
 *  /lst?page=N           검색 결과 (PAGES 장, 장당 PER_PAGE 건, 마지막 장은 next 없음)
 *  /offers/{id}          상세 페이지
 *  /offers/flaky-{n}     첫 요청 429 + Retry-After: 1, 이후 정상
 *  /offers/captcha-{n}   항상 차단 페이지(200 + 챌린지 마크업)
 *  /offers/broken-{n}    제목 없는 페이지(추출 실패)
 * 실행: java dev.SmokeTarget [port]  →  scout-harvest -u http://localhost:8080/lst
 */
public class SmokeTarget {

  static final int PAGES = 3;
  static final int PER_PAGE = 4;
  static final Map<String, AtomicInteger> HITS = new ConcurrentHashMap<>();

  static void add(HttpServer s, String path, HttpHandler h) { s.createContext(path, h); }

  public static void main(String[] args) throws Exception {
    int port = args.length > 0 ? Integer.parseInt(args[0]) : 8080;
    HttpServer http = HttpServer.create(new InetSocketAddress(port), 0);
    wireEndpoints(http);
    http.setExecutor(Executors.newFixedThreadPool(8));
    http.start();
    System.out.println("[SH] smoke listing site on http://localhost:" + port + "/lst");
  }

  static void wireEndpoints(HttpServer s) {
    add(s, "/lst", ex -> {
      var q = query(ex.getRequestURI());
      int page = parseInt(q.get("page"), 1);
      if (page < 1 || page > PAGES) { resp(ex, 200, "text/html", "<html><body><p>No results</p></body></html>"); return; }
      resp(ex, 200, "text/html", searchPage(page));
    });

    add(s, "/offers/", ex -> {
      String path = ex.getRequestURI().getPath();
      String id = path.substring(path.lastIndexOf('/') + 1);
      int hit = HITS.computeIfAbsent(id, k -> new AtomicInteger()).incrementAndGet();

      if (id.startsWith("flaky-") && hit == 1) {
        ex.getResponseHeaders().set("Retry-After", "1");
        resp(ex, 429, "text/html", "<html><body>Too many requests</body></html>");
        return;
      }
      if (id.startsWith("captcha-")) {
        resp(ex, 200, "text/html",
            "<html><head><title>Just a moment...</title></head><body><div id=\"cf-chl-widget\"></div></body></html>");
        return;
      }
      if (id.startsWith("broken-")) {
        resp(ex, 200, "text/html", "<html><body><p>listing removed</p></body></html>");
        return;
      }
      resp(ex, 200, "text/html", detailPage(id));
    });
  }

  static String searchPage(int page) {
    StringBuilder sb = new StringBuilder("<html><body><h1>Results page ").append(page).append("</h1><ul>");
    for (int i = 1; i <= PER_PAGE; i++) {
      int n = (page - 1) * PER_PAGE + i;
      String id = switch (n) {
        case 3 -> "flaky-" + n;
        case 6 -> "captcha-" + n;
        case 9 -> "broken-" + n;
        default -> "car-" + n;
      };
      sb.append("<li><a data-item-name=\"detail-page-link\" href=\"/offers/").append(id).append("\">Car ")
        .append(n).append("</a></li>");
    }
    // 같은 매물 링크 중복(페이지 내 중복 제거 확인용)
    sb.append("<li><a href=\"/offers/car-").append((page - 1) * PER_PAGE + 1).append("?ref=dup\">dup</a></li>");
    sb.append("</ul>");
    if (page < PAGES) sb.append("<a rel=\"next\" href=\"/lst?page=").append(page + 1).append("\">Next</a>");
    return sb.append("</body></html>").toString();
  }

  static String detailPage(String id) {
    int n = parseInt(id.replaceAll("\\D", ""), 1);
    return "<html><head><link rel=\"canonical\" href=\"/offers/" + id + "\"></head><body>" +
        "<h1 data-testid=\"heading\">Smoke Car " + n + "</h1>" +
        "<span data-testid=\"price-label\">€ " + (20 + n) + ",990</span>" +
        "<span data-testid=\"mileage-label\">" + (n * 12) + ",500 km</span>" +
        "<span data-testid=\"power-label\">" + (100 + n) + " kW (" + Math.round((100 + n) * 1.36) + " hp)</span>" +
        "<span data-testid=\"first-registration-label\">0" + (1 + n % 9) + "/2019</span>" +
        "<span data-testid=\"seller-name\">" + (n % 2 == 0 ? "Autohaus Nord" : "") + "</span>" +
        "<span data-testid=\"seller-address\">Hamburg</span>" +
        "<ul data-testid=\"comfort-features\"><li>Air conditioning</li><li>Heated seats</li></ul>" +
        "<figure><img src=\"/img/" + id + "-1.jpg\"></figure>" +
        "</body></html>";
  }

  // ===== 공용 유틸 =====
  static int parseInt(String s, int def) {
    try { return s == null ? def : Integer.parseInt(s.trim()); } catch (NumberFormatException e) { return def; }
  }
  static Map<String,String> query(URI u){
    Map<String,String> m = new LinkedHashMap<>();
    String q = u.getRawQuery(); if (q==null) return m;
    for (String p: q.split("&")) {
      int i = p.indexOf('=');
      String k = i<0? p : p.substring(0,i);
      String v = i<0? "" : p.substring(i+1);
      m.put(urlDecode(k), urlDecode(v));
    }
    return m;
  }
  static String urlDecode(String s){
    return URLDecoder.decode(s, StandardCharsets.UTF_8);
  }
  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", ct+"; charset=utf-8");
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
