package com.sitepulse.core.dom;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** jsoup Document 기반 PageDom */
public final class JsoupPageDom implements PageDom {
    private final Document doc;

    private JsoupPageDom(Document doc) {
        this.doc = doc;
    }

    public static PageDom parse(String html, String baseUri) {
        Objects.requireNonNull(baseUri, "baseUri");
        return new JsoupPageDom(Jsoup.parse(html == null ? "" : html, baseUri));
    }

    @Override public String baseUri() { return doc.location(); }

    @Override public String title() { return doc.title(); }

    @Override public PageElement root() { return new JsoupPageElement(doc); }

    @Override public Optional<PageElement> body() {
        Element b = doc.body();
        return b == null ? Optional.empty() : Optional.of(new JsoupPageElement(b));
    }

    @Override public List<PageElement> select(String cssQuery) {
        return JsoupPageElement.wrap(doc.select(cssQuery));
    }

    @Override public Optional<String> metaContent(String key) {
        for (Element meta : doc.select("meta")) {
            if (key.equals(meta.attr("property")) || key.equals(meta.attr("name"))) {
                String c = meta.attr("content");
                if (!c.isEmpty()) return Optional.of(c);
            }
        }
        return Optional.empty();
    }

    @Override public PageDom copy() { return new JsoupPageDom(doc.clone()); }

    @Override public String visibleText() {
        Document c = doc.clone();
        c.select("script, style").remove();
        return c.text().replaceAll("[\\s\\u00A0]+", " ").trim();
    }
}
