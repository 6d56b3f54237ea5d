package com.scoutharvest.core.proxy;

/** release 시 보고하는 결과와 건강도 증감치 */
public enum ProxyOutcome {
    SUCCESS(+1.0),
    BLOCKED(-2.0),
    TIMEOUT(-1.0),
    TRANSPORT_ERROR(-1.0),
    /** 404 등 프록시 탓이 아닌 결과 */
    NEUTRAL(0.0);

    private final double delta;

    ProxyOutcome(double delta) { this.delta = delta; }

    public double delta() { return delta; }
}
