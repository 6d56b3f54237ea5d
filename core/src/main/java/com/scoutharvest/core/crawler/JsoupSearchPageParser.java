package com.scoutharvest.core.crawler;

import com.scoutharvest.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** 기본 JSoup 기반 검색 페이지 파서 */
public class JsoupSearchPageParser implements SearchPageParser {

    static final String LISTING_LINKS =
            "a[href*=\"/angebote/\"], a[href*=\"/offers/\"], a[data-item-name=detail-page-link]";

    static final List<String> NEXT_LINKS = List.of(
            "a[rel=next]",
            "a[aria-label*=Next]",
            "a[aria-label*=Weiter]");

    @Override
    public DiscoveryPage parse(String html, URI pageUrl) {
        if (html == null || html.isBlank()) return new DiscoveryPage(List.of(), null);
        Document doc = Jsoup.parse(html, pageUrl == null ? "" : pageUrl.toString());

        Set<URI> links = new LinkedHashSet<>();
        for (Element a : doc.select(LISTING_LINKS)) {
            UrlUtils.resolve(pageUrl, a.attr("href")).ifPresent(links::add);
        }

        URI next = null;
        for (String sel : NEXT_LINKS) {
            Element a = doc.selectFirst(sel);
            if (a == null) continue;
            Optional<URI> u = UrlUtils.resolve(pageUrl, a.attr("href"));
            if (u.isPresent()) { next = u.get(); break; }
        }
        return new DiscoveryPage(new ArrayList<>(links), next);
    }
}
