package com.scoutharvest.core.http;

import com.scoutharvest.core.api.IPageFetcher;
import com.scoutharvest.core.model.FetchResult;
import com.scoutharvest.core.model.ScrapeConfig;
import com.scoutharvest.core.proxy.ProxyAddress;
import com.scoutharvest.core.proxy.ProxyHandle;

import java.net.Authenticator;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * JDK HttpClient 기반 GET. 프록시 주소마다 클라이언트 1개를 캐시해서 재사용.
 * 예외는 statusCode -1 결과로 매핑(타임아웃이면 timedOut=true).
 */
public class HttpPageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req, ProxyHandle proxy) throws Exception;
    }

    private final ScrapeConfig config;
    private final HttpSender sender;   // null 이면 HttpClient 경로
    private final Map<ProxyAddress, HttpClient> clients = new ConcurrentHashMap<>();

    public HttpPageFetcher(ScrapeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(ScrapeConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResult fetchOnce(URI url, ProxyHandle proxy) throws InterruptedException {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        try {
            HttpRequest.Builder rb = HttpRequest.newBuilder(url)
                    .timeout(config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "en-US,en;q=0.9,de;q=0.8");
            String proxyAuth = proxyAuthorization(proxy);
            if (proxyAuth != null) rb.header("Proxy-Authorization", proxyAuth);
            HttpRequest req = rb.GET().build();

            HttpResponse<String> resp = (sender != null)
                    ? sender.send(req, proxy)
                    : clientFor(proxy).send(req, HttpResponse.BodyHandlers.ofString());

            return FetchResult.builder()
                    .url(url)
                    .statusCode(resp.statusCode())
                    .headers(resp.headers().map())
                    .body(resp.body() == null ? "" : resp.body())
                    .elapsedMs(elapsedMs(start))
                    .build();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw ie;
        } catch (HttpTimeoutException te) {
            return failed(url, start, "timeout: " + te.getMessage(), true);
        } catch (Exception e) {
            return failed(url, start, e.getClass().getSimpleName() + ": " + e.getMessage(), false);
        }
    }

    /**
     * 자격증명이 있는 프록시면 Basic 헤더를 선제 전송.
     * HTTPS 터널(CONNECT)에서는 JDK 가 Basic 인증을 기본 비활성화해 Authenticator 가 불리지 않는다.
     * HttpClient 는 이 헤더를 CONNECT 요청에 옮겨 싣고 원 서버로는 보내지 않는다.
     */
    static String proxyAuthorization(ProxyHandle proxy) {
        if (proxy == null) return null;
        ProxyAddress addr = proxy.getAddress();
        if (addr.isDirect() || !addr.hasCredentials()) return null;
        String token = addr.username() + ":" + (addr.password() == null ? "" : addr.password());
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    HttpClient clientFor(ProxyHandle proxy) {
        ProxyAddress addr = (proxy == null) ? ProxyAddress.DIRECT : proxy.getAddress();
        return clients.computeIfAbsent(addr, this::newClient);
    }

    private HttpClient newClient(ProxyAddress addr) {
        HttpClient.Builder b = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout());
        if (!addr.isDirect()) {
            b.proxy(ProxySelector.of(addr.socketAddress()));
            if (addr.hasCredentials()) {
                b.authenticator(new Authenticator() {
                    @Override protected PasswordAuthentication getPasswordAuthentication() {
                        if (getRequestorType() != RequestorType.PROXY) return null;
                        return new PasswordAuthentication(addr.username(), addr.password().toCharArray());
                    }
                });
            }
        }
        return b.build();
    }

    private static FetchResult failed(URI url, long start, String why, boolean timedOut) {
        return FetchResult.builder()
                .url(url)
                .statusCode(-1)
                .headers(Map.of())
                .body("")
                .failure(why)
                .timedOut(timedOut)
                .elapsedMs(elapsedMs(start))
                .build();
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
