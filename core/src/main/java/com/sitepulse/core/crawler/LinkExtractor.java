package com.sitepulse.core.crawler;

import com.sitepulse.core.dom.PageDom;
import com.sitepulse.core.dom.PageElement;
import com.sitepulse.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * a[href] → 절대 URL 수집 (fragment 제거).
 * 빈 href, '#', javascript:, mailto:, tel: 는 무시 (앞뒤 공백, 대소문자 무관).
 * http/https 가 아닌 스킴(line:, sms: ...)은 링크 오류가 아니라 수집 대상 밖으로 버린다.
 * 내부 링크 = 기준 URL 과 host[:port] 가 같은 링크.
 */
public final class LinkExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(LinkExtractor.class);

    private static final String[] IGNORED_PREFIXES = {"#", "javascript:", "mailto:", "tel:"};

    /** 문서 전체에서 내부/외부/해석 실패 링크 분류 */
    public LinkHarvest harvest(PageDom dom, String pageUrl) {
        Set<String> internal = new LinkedHashSet<>();
        Set<String> external = new LinkedHashSet<>();
        List<LinkHarvest.MalformedLink> malformed = new ArrayList<>();

        for (PageElement a : dom.select("a[href]")) {
            String href = a.attr("href");
            if (isIgnored(href)) continue;
            if (!UrlUtils.isWebReference(href)) {
                LOG.debug("skip non-web link {} on {}", href, pageUrl);
                continue;
            }
            String abs;
            try {
                abs = UrlUtils.resolve(pageUrl, href);
            } catch (MalformedURLException | IllegalArgumentException e) {
                malformed.add(new LinkHarvest.MalformedLink(href,
                        e.getClass().getSimpleName() + ": " + e.getMessage()));
                continue;
            }
            if (UrlUtils.sameSite(abs, pageUrl)) internal.add(abs);
            else external.add(abs);
        }
        return new LinkHarvest(Collections.unmodifiableSet(internal),
                Collections.unmodifiableSet(external), malformed);
    }

    /** 특정 영역(사이트맵 본문 등) 안의 내부 링크만. 해석 실패는 조용히 제외 */
    public Set<String> internalLinks(Collection<PageElement> anchors, String baseUrl) {
        Set<String> out = new LinkedHashSet<>();
        for (PageElement a : anchors) {
            String href = a.attr("href");
            if (isIgnored(href) || !UrlUtils.isWebReference(href)) continue;
            try {
                String abs = UrlUtils.resolve(baseUrl, href);
                if (UrlUtils.sameSite(abs, baseUrl)) out.add(abs);
            } catch (MalformedURLException | IllegalArgumentException e) {
                LOG.debug("skip unresolvable href {} on {}: {}", href, baseUrl, e.getMessage());
            }
        }
        return out;
    }

    static boolean isIgnored(String href) {
        if (href == null) return true;
        String h = href.trim().toLowerCase(Locale.ROOT);
        if (h.isEmpty()) return true;
        for (String p : IGNORED_PREFIXES) {
            if (h.startsWith(p)) return true;
        }
        return false;
    }
}
