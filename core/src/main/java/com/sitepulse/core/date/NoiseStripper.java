package com.sitepulse.core.date;

import com.sitepulse.core.dom.PageDom;
import com.sitepulse.core.dom.PageElement;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 날짜 스캔 전 머리말/메뉴/푸터 같은 공통 영역 제거.
 * 원본 문서는 건드리지 않고 복사본을 돌려준다.
 */
public final class NoiseStripper {

    static final List<String> NOISE_TAGS = List.of("header", "nav", "aside", "footer");

    /** class 속성(소문자)에 부분 문자열로 포함되면 제거 */
    static final List<String> NOISE_CLASS_PATTERNS = List.of(
            "base-footer", "site-footer", "footer-container", "footer-wrapper",
            "footer-bottom", "site-info", "colophon", "copyright", "update-time",
            "visit-count", "nav", "navigation", "navbar", "nav-menu", "main-nav",
            "site-nav", "breadcrumb", "sidebar", "menu", "top-menu");

    public PageDom strip(PageDom dom) {
        PageDom cleaned = dom.copy();

        for (String tag : NOISE_TAGS) {
            for (PageElement e : cleaned.select(tag)) e.remove();
        }

        // 먼저 모으고 한 번에 제거 (조상이 먼저 빠져도 remove()는 안전)
        List<PageElement> noisy = new ArrayList<>();
        for (PageElement e : cleaned.select("[class]")) {
            String cls = e.attr("class").toLowerCase(Locale.ROOT);
            for (String p : NOISE_CLASS_PATTERNS) {
                if (cls.contains(p)) {
                    noisy.add(e);
                    break;
                }
            }
        }
        for (PageElement e : noisy) e.remove();
        return cleaned;
    }
}
