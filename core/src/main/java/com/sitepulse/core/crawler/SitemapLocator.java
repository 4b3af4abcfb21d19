package com.sitepulse.core.crawler;

import com.sitepulse.core.dom.PageDom;
import com.sitepulse.core.dom.PageElement;
import com.sitepulse.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 홈페이지에서 사이트맵(網站導覽/網頁導覽/webmap) 링크 찾기 + 사이트맵 본문 영역의 링크 추출.
 */
public final class SitemapLocator {
    private static final Logger LOG = LoggerFactory.getLogger(SitemapLocator.class);

    /** 우선순위 순서: 시맨틱 랜드마크 → 흔한 id/class → CMS 패턴 → 부분 일치 */
    static final List<String> MAIN_CONTENT_SELECTORS = List.of(
            "main", "[role=\"main\"]",
            "#main", "#content", "#main-content", "#index_main",
            ".main", ".content", ".main-content", ".main_content", ".article",
            "#CCMS_Content", ".group.page-content",
            "[id*=\"main\"]", "[id*=\"content\"]", "[id*=\"index\"]",
            "[class*=\"main\"]", "[class*=\"content\"]", "[class*=\"article\"]");

    private final LinkExtractor links;

    public SitemapLocator(LinkExtractor links) {
        this.links = Objects.requireNonNull(links, "links");
    }

    /** 첫 번째로 걸리는 사이트맵 링크(절대 URL, fragment 제거) */
    public Optional<String> findSitemapLink(PageDom dom, String pageUrl) {
        for (PageElement a : dom.select("a[href]")) {
            String rawHref = a.attr("href");
            String href = rawHref.toLowerCase(Locale.ROOT);
            if (href.startsWith("#")) continue;
            String title = a.attr("title").toLowerCase(Locale.ROOT);
            String text = a.text().trim().toLowerCase(Locale.ROOT);
            if (!looksLikeSitemap(href, title, text)) continue;
            try {
                String url = UrlUtils.resolve(pageUrl, rawHref);
                LOG.info("sitemap link found: {}", url);
                return Optional.of(url);
            } catch (MalformedURLException | IllegalArgumentException e) {
                LOG.debug("sitemap-like href not resolvable: {} ({})", rawHref, e.getMessage());
            }
        }
        return Optional.empty();
    }

    static boolean looksLikeSitemap(String href, String title, String text) {
        return href.contains("sitemap") || title.contains("sitemap") || text.contains("sitemap")
                || title.contains("網站導覽") || text.contains("網站導覽")
                || title.contains("網頁導覽") || text.contains("網頁導覽")
                || href.contains("webmap") || title.contains("webmap") || text.contains("webmap");
    }

    /**
     * 본문 영역(a[href]가 1개 이상인 첫 셀렉터의 첫 요소) 안의 동일 사이트 링크.
     * 영역이 없거나 링크가 0개면 빈 집합 → 호출자가 폴백.
     */
    public Set<String> extractMainContentLinks(PageDom sitemapDom, String sitemapUrl) {
        for (String selector : MAIN_CONTENT_SELECTORS) {
            List<PageElement> found = sitemapDom.select(selector);
            if (found.isEmpty()) continue;
            List<PageElement> anchors = found.get(0).select("a[href]");
            if (anchors.isEmpty()) continue;

            Set<String> out = links.internalLinks(anchors, sitemapUrl);
            LOG.info("sitemap main content via '{}': {} anchors, {} internal links",
                    selector, anchors.size(), out.size());
            return out;
        }
        LOG.info("sitemap main content not found on {}", sitemapUrl);
        return Set.of();
    }
}
