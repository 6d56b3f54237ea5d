package com.scoutharvest.core.extract;

import com.scoutharvest.core.api.IFieldExtractor;
import com.scoutharvest.core.model.RawFieldMap;
import com.scoutharvest.core.normalize.TextCleaner;
import com.scoutharvest.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * FieldRuleTable 을 jsoup Document 에 적용.
 * 필수 앵커: title AND (price OR url 이 식별자 있는 상세 경로).
 */
public class JsoupFieldExtractor implements IFieldExtractor {

    private final FieldRuleTable table;

    public JsoupFieldExtractor() { this(FieldRuleTable.defaults()); }

    public JsoupFieldExtractor(FieldRuleTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    @Override
    public RawFieldMap extract(String html, URI pageUrl) throws ExtractionFailedException {
        Document doc = Jsoup.parse(html == null ? "" : html, pageUrl == null ? "" : pageUrl.toString());
        RawFieldMap out = new RawFieldMap();

        for (FieldRule rule : table.rules()) {
            if (rule.cardinality() == Cardinality.ONE) {
                out.put(rule.field(), first(doc, rule));
            } else {
                out.putAll(rule.field(), all(doc, rule));
            }
        }
        if (!out.has(FieldRuleTable.URL) && pageUrl != null) {
            out.put(FieldRuleTable.URL, pageUrl.toString());
        }

        List<String> missing = new ArrayList<>();
        if (!out.has(FieldRuleTable.TITLE)) missing.add(FieldRuleTable.TITLE);
        if (!out.has(FieldRuleTable.PRICE) && UrlUtils.listingId(out.get(FieldRuleTable.URL)).isEmpty()) {
            missing.add(FieldRuleTable.PRICE + "|" + FieldRuleTable.URL);
        }
        if (!missing.isEmpty()) throw new ExtractionFailedException(pageUrl, missing);
        return out;
    }

    private static String first(Document doc, FieldRule rule) {
        for (String sel : rule.selectors()) {
            for (Element el : doc.select(sel)) {
                String v = valueOf(el, rule);
                if (v != null) return v;
            }
        }
        return null;
    }

    private static List<String> all(Document doc, FieldRule rule) {
        Set<String> values = new LinkedHashSet<>();
        for (String sel : rule.selectors()) {
            for (Element el : doc.select(sel)) {
                String v = valueOf(el, rule);
                if (v != null) values.add(v);
            }
        }
        return new ArrayList<>(values);
    }

    private static String valueOf(Element el, FieldRule rule) {
        if (rule.fromText()) return TextCleaner.clean(el.text());
        for (String attr : rule.attributes()) {
            if (!el.hasAttr(attr)) continue;
            String v = rule.absolute() ? el.absUrl(attr) : el.attr(attr);
            if (v.isEmpty()) v = el.attr(attr);    // base 없는 상대값은 그대로
            v = TextCleaner.clean(v);
            if (v != null) return v;
        }
        return null;
    }
}
