package com.scoutharvest.core.proxy;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.Locale;
import java.util.Objects;

/**
 * 프록시 주소: scheme://[user:pass@]host:port 또는 host:port.
 * DIRECT 는 프록시 없이 직접 연결.
 */
public record ProxyAddress(String scheme, String host, int port, String username, String password) {

    public static final ProxyAddress DIRECT = new ProxyAddress("direct", "", -1, null, null);

    public static ProxyAddress parse(String raw) {
        Objects.requireNonNull(raw, "raw");
        String s = raw.trim();
        if (s.isEmpty()) throw new IllegalArgumentException("empty proxy entry");
        if (!s.contains("://")) s = "http://" + s;
        URI u;
        try {
            u = URI.create(s);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed proxy: " + raw, e);
        }
        if (u.getHost() == null || u.getPort() < 0) {
            throw new IllegalArgumentException("Proxy needs host:port: " + raw);
        }
        String user = null, pass = null;
        String info = u.getUserInfo();
        if (info != null && !info.isEmpty()) {
            int i = info.indexOf(':');
            user = (i < 0) ? info : info.substring(0, i);
            pass = (i < 0) ? "" : info.substring(i + 1);
        }
        return new ProxyAddress(u.getScheme().toLowerCase(Locale.ROOT), u.getHost(), u.getPort(), user, pass);
    }

    public boolean isDirect() { return this == DIRECT || "direct".equals(scheme); }

    public boolean hasCredentials() { return username != null && !username.isEmpty(); }

    public InetSocketAddress socketAddress() {
        return InetSocketAddress.createUnresolved(host, port);
    }

    /** 로그용: 자격증명 제외 */
    public String label() {
        return isDirect() ? "DIRECT" : scheme + "://" + host + ":" + port;
    }

    @Override public String toString() { return label(); }
}
