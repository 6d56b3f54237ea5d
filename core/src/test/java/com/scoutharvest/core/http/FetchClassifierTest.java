package com.scoutharvest.core.http;

import com.scoutharvest.core.model.FetchOutcome;
import com.scoutharvest.core.model.FetchResult;
import com.scoutharvest.core.model.ScrapeConfig;
import com.scoutharvest.core.proxy.ProxyOutcome;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;

class FetchClassifierTest {

    private static final URI URL = URI.create("https://ex.com/offers/a-1");

    private final FetchClassifier classifier = new FetchClassifier(ScrapeConfig.DEFAULT_BLOCK_SIGNATURES);

    @Test
    void successRequiresMarkup() {
        FetchResult ok = classifier.classify(raw(200, "<html><h1>BMW</h1></html>"));
        assertThat(ok.getOutcome()).isEqualTo(FetchOutcome.SUCCESS);
        assertThat(FetchClassifier.proxyOutcome(ok)).isEqualTo(ProxyOutcome.SUCCESS);

        FetchResult empty = classifier.classify(raw(200, "   "));
        assertThat(empty.getOutcome()).isEqualTo(FetchOutcome.TRANSIENT);
        assertThat(FetchClassifier.proxyOutcome(empty)).isEqualTo(ProxyOutcome.NEUTRAL);
    }

    @Test
    void blockStatusesAndSignatures() {
        assertThat(classifier.classify(raw(403, "")).getOutcome()).isEqualTo(FetchOutcome.BLOCKED);
        assertThat(classifier.classify(raw(429, "")).getOutcome()).isEqualTo(FetchOutcome.BLOCKED);

        FetchResult challenge = classifier.classify(
                raw(200, "<html><head><TITLE>Just a moment...</TITLE></head><div id=cf-chl-widget></div></html>"));
        assertThat(challenge.getOutcome()).isEqualTo(FetchOutcome.BLOCKED);
        assertThat(challenge.getFailure()).startsWith("block page:");
        assertThat(FetchClassifier.proxyOutcome(challenge)).isEqualTo(ProxyOutcome.BLOCKED);
    }

    @Test
    void proxyAuthRejectionRotatesProxy() {
        FetchResult r = classifier.classify(raw(407, ""));
        assertThat(r.getOutcome()).isEqualTo(FetchOutcome.BLOCKED);
        assertThat(r.getFailure()).contains("407");
        assertThat(FetchClassifier.proxyOutcome(r)).isEqualTo(ProxyOutcome.BLOCKED);
    }

    @Test
    void transportFailures() {
        FetchResult timeout = classifier.classify(FetchResult.builder().url(URL).timedOut(true).failure("timeout").build());
        assertThat(timeout.getOutcome()).isEqualTo(FetchOutcome.TRANSIENT);
        assertThat(FetchClassifier.proxyOutcome(timeout)).isEqualTo(ProxyOutcome.TIMEOUT);

        FetchResult refused = classifier.classify(FetchResult.builder().url(URL).failure("ConnectException").build());
        assertThat(FetchClassifier.proxyOutcome(refused)).isEqualTo(ProxyOutcome.TRANSPORT_ERROR);
    }

    @Test
    void otherStatusesArePermanentAndNeutralForProxy() {
        for (int sc : new int[]{301, 404, 410, 500, 503}) {
            FetchResult r = classifier.classify(raw(sc, "<html></html>"));
            assertThat(r.getOutcome()).as("HTTP %d", sc).isEqualTo(FetchOutcome.PERMANENT);
            assertThat(FetchClassifier.proxyOutcome(r)).isEqualTo(ProxyOutcome.NEUTRAL);
        }
    }

    private static FetchResult raw(int status, String body) {
        return FetchResult.builder().url(URL).statusCode(status).body(body).build();
    }
}
