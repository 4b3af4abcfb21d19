package com.sitepulse.core.crawler;

import com.sitepulse.core.api.ILinkVerifier;
import com.sitepulse.core.api.IPageRenderer;
import com.sitepulse.core.api.IPageStore;
import com.sitepulse.core.api.ISiteCrawler;
import com.sitepulse.core.date.DateExtractor;
import com.sitepulse.core.dom.JsoupPageDom;
import com.sitepulse.core.model.BodyMarker;
import com.sitepulse.core.model.CrawlResult;
import com.sitepulse.core.model.CrawlStats;
import com.sitepulse.core.model.DateSentinels;
import com.sitepulse.core.model.ExternalLinkRecord;
import com.sitepulse.core.model.FrontierEntry;
import com.sitepulse.core.model.PageOutcome;
import com.sitepulse.core.model.PageRecord;
import com.sitepulse.core.store.DirectoryLayout;
import com.sitepulse.core.util.NamedThreadFactory;
import com.sitepulse.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * 사이트 1건 BFS 크롤러.
 *  - 진입 페이지(depth 0) → 사이트맵 있으면 사이트맵(depth 0)의 본문 링크로 depth 1 시드
 *  - FIFO 처리, 방문 집합 + maxDepth 로 종료 보장
 *  - 페이지 처리 결과(PageOutcome)에 따라 기록/큐잉
 * 한 사이트 안에서는 순차. 병렬은 페이지별 외부 링크 검사뿐.
 */
public final class SiteCrawler implements ISiteCrawler {
    private static final Logger LOG = LoggerFactory.getLogger(SiteCrawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(SiteCrawler.class);

    private final IPageRenderer renderer;
    private final ILinkVerifier verifier;
    private final IPageStore store;
    private final Path siteRoot;
    private final CrawlOptions options;

    private final LinkExtractor links = new LinkExtractor();
    private final SitemapLocator sitemap;
    private final DuplicateClassifier classifier;
    private final DateExtractor dates;
    private final RenderModeDetector detector;

    private CrawlContext last; // 마지막 crawlSite 결과

    public SiteCrawler(IPageRenderer renderer, ILinkVerifier verifier, IPageStore store,
                       Path siteRoot, CrawlOptions options, Clock clock) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.store = Objects.requireNonNull(store, "store");
        this.siteRoot = Objects.requireNonNull(siteRoot, "siteRoot");
        this.options = Objects.requireNonNull(options, "options");
        this.sitemap = new SitemapLocator(links);
        this.classifier = new DuplicateClassifier(options.duplicatePolicy(), store);
        this.dates = new DateExtractor(Objects.requireNonNull(clock, "clock"));
        this.detector = new RenderModeDetector(options.spaSettleTimeout());
    }

    @Override
    public List<Integer> crawlSite(String entryUrl, int maxDepth) {
        Objects.requireNonNull(entryUrl, "entryUrl");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");

        CrawlContext ctx = new CrawlContext(new DirectoryLayout(siteRoot, store.isPersistent()), new CrawlStats());
        this.last = ctx;

        ExecutorService linkPool = Executors.newFixedThreadPool(
                options.linkCheckConcurrency(), new NamedThreadFactory("link-check"));
        try {
            PageVisitor visitor = new PageVisitor(renderer, verifier, linkPool, store, classifier, dates,
                    detector, links, options.navigationTimeout());
            Deque<FrontierEntry> frontier = new ArrayDeque<>();

            // ---- 1) 진입 페이지 + 사이트맵 ----
            LOG.info("processing homepage and checking for sitemap: {}", entryUrl);
            CrawlResult home = handle(visitor, new FrontierEntry(entryUrl, null, 0), ctx);
            seed(visitor, home, entryUrl, ctx, frontier);

            // ---- 2) BFS ----
            while (!frontier.isEmpty()) {
                FrontierEntry e = frontier.pollFirst();
                if (ctx.isVisited(e.url()) || e.depth() > maxDepth) continue;

                CrawlResult r = handle(visitor, e, ctx);
                switch (r.getOutcome()) {
                    case ACCEPTED:
                        if (e.depth() < maxDepth) enqueue(frontier, r.getLinks(), e.url(), e.depth() + 1, ctx);
                        break;
                    case PAGINATION_VARIANT:
                        // 목록의 다음 페이지: 원래 부모 밑 같은 층으로
                        if (e.depth() < maxDepth) enqueue(frontier, r.getLinks(), e.parentUrl(), e.depth(), ctx);
                        break;
                    case FRAMESET:
                        // 프레임셋은 투명한 컨테이너
                        enqueue(frontier, r.getLinks(), e.parentUrl(), e.depth(), ctx);
                        break;
                    default:
                        break;
                }
            }
        } finally {
            linkPool.shutdownNow();
            try {
                linkPool.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        CrawlStats.Snapshot s = ctx.stats().snapshot();
        LOG.info("crawl done: {} statuses, {} pages recorded, {} external links, {} duplicates, {} failures",
                ctx.statuses().size(), ctx.pages().size(), ctx.externalLinks().size(),
                s.duplicatesSkipped, s.failures);
        return List.copyOf(ctx.statuses());
    }

    /** 방문 + 결과 종류별 기록. 큐잉은 호출자 */
    private CrawlResult handle(PageVisitor visitor, FrontierEntry e, CrawlContext ctx) {
        ctx.markVisited(e.url());
        CrawlResult r = visitor.visit(e, ctx);
        if (!r.getActualUrl().equals(e.url())) ctx.markVisited(r.getActualUrl());

        switch (r.getOutcome()) {
            case ACCEPTED:
                ctx.recordPage(r.getActualUrl(), new PageRecord(r.getTitle(), r.getLastUpdated(), r.getSavedPath(),
                        r.getStatus(), e.depth(), ctx.sourcePageFor(e.parentUrl())));
                ctx.rememberTitle(e.url(), r.getTitle());
                ctx.appendStatus(r.getStatus());
                break;
            case SKIPPED_FILE:
                ctx.recordPage(r.getActualUrl(), new PageRecord(r.getTitle(), DateSentinels.NO_DATE,
                        BodyMarker.SKIPPED_FILE.text(), r.getStatus(), e.depth(), ctx.sourcePageFor(e.parentUrl())));
                ctx.rememberTitle(e.url(), r.getTitle());
                ctx.appendStatus(r.getStatus());
                break;
            case FAILED:
                ctx.recordPage(r.getActualUrl(), PageRecord.failed(r.getStatus(), e.depth(), ctx.sourcePageFor(e.parentUrl())));
                ctx.appendStatus(r.getStatus());
                break;
            default:
                // DUPLICATE / PAGINATION_VARIANT / FRAMESET: 기록 없음
                break;
        }

        SLOG.info("page-visited", "url", e.url(), "actual", r.getActualUrl(), "depth", e.depth(),
                "outcome", r.getOutcome().name(), "status", r.getStatus(), "lastUpdated", r.getLastUpdated());
        return r;
    }

    /** 진입 페이지 결과로 depth 1 시드 결정 */
    private void seed(PageVisitor visitor, CrawlResult home, String entryUrl,
                      CrawlContext ctx, Deque<FrontierEntry> frontier) {
        if (home.getOutcome() == PageOutcome.FRAMESET) {
            // 프레임셋 진입 페이지: 프레임들이 곧 최상위 페이지
            enqueue(frontier, home.getLinks(), null, 0, ctx);
            return;
        }
        if (home.getOutcome() != PageOutcome.ACCEPTED) {
            LOG.info("homepage not usable ({}), nothing to seed", home.getOutcome());
            return;
        }

        Optional<String> sitemapUrl = sitemap.findSitemapLink(
                JsoupPageDom.parse(home.getBody(), home.getActualUrl()), home.getActualUrl());
        if (sitemapUrl.isEmpty() || ctx.isVisited(sitemapUrl.get())) {
            LOG.info(sitemapUrl.isEmpty() ? "no sitemap found, continuing with homepage links"
                    : "sitemap is the homepage or already visited, continuing with homepage links");
            enqueue(frontier, home.getLinks(), entryUrl, 1, ctx);
            return;
        }

        // ---- 사이트맵 페이지도 depth 0 최상위 페이지로 기록 ----
        CrawlResult sm = handle(visitor, new FrontierEntry(sitemapUrl.get(), null, 0), ctx);
        Collection<String> sitemapLinks = Set.of();
        if (sm.getOutcome() == PageOutcome.ACCEPTED) {
            sitemapLinks = sitemap.extractMainContentLinks(
                    JsoupPageDom.parse(sm.getBody(), sm.getActualUrl()), sm.getActualUrl());
            if (sitemapLinks.isEmpty()) {
                LOG.info("sitemap main content yielded no links, using all sitemap page links");
                sitemapLinks = sm.getLinks();
            }
        }

        int added = enqueue(frontier, sitemapLinks, entryUrl, 1, ctx);
        if (added > 0) {
            LOG.info("added {} links from sitemap to crawl queue", added);
        } else {
            added = enqueue(frontier, home.getLinks(), entryUrl, 1, ctx);
            LOG.info("no usable sitemap links, added {} homepage links instead", added);
        }
    }

    private static int enqueue(Deque<FrontierEntry> frontier, Collection<String> urls,
                               String parentUrl, int depth, CrawlContext ctx) {
        int n = 0;
        for (String u : urls) {
            if (ctx.isVisited(u)) continue;
            frontier.addLast(new FrontierEntry(u, parentUrl, depth));
            n++;
        }
        return n;
    }

    // ---- 결과 조회 (마지막 crawlSite 기준) ----

    /** 실제 URL → PageRecord (기록 순서) */
    public Map<String, PageRecord> getPageSummary() {
        return last == null ? Map.of() : new LinkedHashMap<>(last.pages());
    }

    public Map<String, ExternalLinkRecord> getExternalLinks() {
        return last == null ? Map.of() : new LinkedHashMap<>(last.externalLinks());
    }

    public CrawlStats.Snapshot getStats() {
        return last == null ? new CrawlStats().snapshot() : last.stats().snapshot();
    }
}
