package com.sitepulse.core.dom;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayList;
import java.util.List;

final class JsoupPageElement implements PageElement {
    private final Element el;

    JsoupPageElement(Element el) {
        this.el = el;
    }

    static List<PageElement> wrap(Elements els) {
        List<PageElement> out = new ArrayList<>(els.size());
        for (Element e : els) out.add(new JsoupPageElement(e));
        return out;
    }

    @Override public String tagName() { return el.tagName(); }
    @Override public String attr(String name) { return el.attr(name); }
    @Override public boolean hasAttr(String name) { return el.hasAttr(name); }
    @Override public String text() { return el.text(); }

    @Override public List<String> textNodes() {
        List<String> out = new ArrayList<>();
        NodeTraversor.traverse((node, depth) -> {
            if (node instanceof TextNode) {
                String t = ((TextNode) node).getWholeText().strip();
                if (!t.isEmpty()) out.add(t);
            }
        }, el);
        return out;
    }

    @Override public List<PageElement> select(String cssQuery) { return wrap(el.select(cssQuery)); }

    @Override public void remove() {
        if (el.parent() != null) el.remove();
    }
}
