package com.sitepulse.core.crawler;

import com.sitepulse.core.api.ILinkVerifier;
import com.sitepulse.core.api.IPageRenderer;
import com.sitepulse.core.api.IPageStore;
import com.sitepulse.core.api.NavigationException;
import com.sitepulse.core.api.RenderedPage;
import com.sitepulse.core.date.DateExtractor;
import com.sitepulse.core.dom.JsoupPageDom;
import com.sitepulse.core.dom.PageDom;
import com.sitepulse.core.http.LinkVerificationGroup;
import com.sitepulse.core.model.BodyMarker;
import com.sitepulse.core.model.CrawlResult;
import com.sitepulse.core.model.DateSentinels;
import com.sitepulse.core.model.FrontierEntry;
import com.sitepulse.core.model.PageOutcome;
import com.sitepulse.core.model.PageRecord;
import com.sitepulse.core.model.RenderMode;
import com.sitepulse.core.model.SourcePage;
import com.sitepulse.core.util.StructuredLog;
import com.sitepulse.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * 페이지 1건 방문: 건너뛰기 판정 → 이동 → 렌더 모드 → 분류 → 저장/날짜/링크.
 * 기록(PageRecord)과 큐잉은 SiteCrawler 몫이고, 여기서는 해석 실패 링크와 외부 링크 기록만 직접 남긴다.
 */
final class PageVisitor {
    private static final Logger LOG = LoggerFactory.getLogger(PageVisitor.class);
    private static final StructuredLog SLOG = StructuredLog.get(PageVisitor.class);

    static final String FRAMESET_TITLE = "Frameset Container";

    private final IPageRenderer renderer;
    private final ILinkVerifier verifier;
    private final ExecutorService linkPool;
    private final IPageStore store;
    private final DuplicateClassifier classifier;
    private final DateExtractor dates;
    private final RenderModeDetector detector;
    private final LinkExtractor links;
    private final Duration navigationTimeout;

    PageVisitor(IPageRenderer renderer, ILinkVerifier verifier, ExecutorService linkPool, IPageStore store,
                DuplicateClassifier classifier, DateExtractor dates, RenderModeDetector detector,
                LinkExtractor links, Duration navigationTimeout) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.linkPool = Objects.requireNonNull(linkPool, "linkPool");
        this.store = Objects.requireNonNull(store, "store");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.dates = Objects.requireNonNull(dates, "dates");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.links = Objects.requireNonNull(links, "links");
        this.navigationTimeout = Objects.requireNonNull(navigationTimeout, "navigationTimeout");
    }

    CrawlResult visit(FrontierEntry entry, CrawlContext ctx) {
        String url = entry.url();

        // ---- 1) 비 HTML 리소스 ----
        if (SkipRules.isSkippable(url)) {
            String name = SkipRules.displayName(url);
            LOG.info("skipping file (depth {}): {}", entry.depth(), url);
            ctx.stats().fileSkipped();
            return CrawlResult.builder(url, PageOutcome.SKIPPED_FILE)
                    .status(200).marker(BodyMarker.SKIPPED_FILE).title(name).build();
        }

        Path dir = ctx.layout().directoryFor(url, entry.parentUrl(), ctx::titleOf);
        LOG.info("crawling (depth {}): {}", entry.depth(), url);
        ctx.stats().pageVisited();

        // ---- 2) 이동 + http→https 재시도 ----
        NavigationAttempt attempt = attempt(url, entry, dir, ctx);
        if (attempt.isSuccess()) return attempt.result();

        int lastStatus = attempt.status();
        String reason = attempt.reason();
        Optional<String> https = UrlUtils.upgradeToHttps(url);
        if (https.isPresent()) {
            LOG.info("http failed for {} ({}), trying {}", url, reason, https.get());
            NavigationAttempt retry = attempt(https.get(), entry, dir, ctx);
            if (retry.isSuccess()) {
                LOG.info("https connection successful: {}", https.get());
                return retry.result();
            }
            if (retry.status() != 0) lastStatus = retry.status();
            reason = retry.reason();
        }

        ctx.stats().failure();
        LOG.warn("crawl failed (depth {}): {} status={} reason={}", entry.depth(), url, lastStatus, reason);
        SLOG.warn("page-failed", "url", url, "depth", entry.depth(), "status", lastStatus, "reason", reason);
        return CrawlResult.builder(url, PageOutcome.FAILED)
                .status(lastStatus)
                .marker(BodyMarker.CRAWL_FAILED)
                .lastUpdated(DateSentinels.CRAWL_FAILED)
                .build();
    }

    private NavigationAttempt attempt(String url, FrontierEntry entry, Path dir, CrawlContext ctx) {
        int status = 0;
        try (RenderedPage page = renderer.navigate(url, navigationTimeout)) {
            status = page.statusCode();
            if (status >= 400) {
                return NavigationAttempt.failure(status, "page returned status " + status);
            }
            String actual = page.finalUrl();
            if (!actual.equals(url)) LOG.info("  -> redirected to: {}", actual);

            // ---- 렌더 모드 ----
            RenderMode mode = detector.detect(page);
            if (mode.kind() == RenderMode.Kind.FRAMESET) {
                ctx.stats().framesetSeen();
                return NavigationAttempt.success(CrawlResult.builder(url, PageOutcome.FRAMESET)
                        .actualUrl(actual).status(status).marker(BodyMarker.FRAMESET_CONTAINER)
                        .title(FRAMESET_TITLE).links(mode.frameLinks()).build());
            }

            String html = page.content();
            PageDom dom = JsoupPageDom.parse(html, actual);
            String title = titleOf(dom, url);

            // ---- 분류 ----
            Verdict verdict = classifier.classify(actual, title, html, ctx.pages());
            switch (verdict.kind()) {
                case EXACT_DUPLICATE:
                    LOG.info("  ! {} ({}): {} ~ {}", verdict.marker(), verdict.reason(), actual, verdict.matchedUrl());
                    ctx.stats().duplicateSkipped();
                    return NavigationAttempt.success(CrawlResult.builder(url, PageOutcome.DUPLICATE)
                            .actualUrl(actual).status(status).marker(verdict.marker()).title(title).build());
                case PAGINATION_VARIANT:
                    Set<String> pageLinks = links.harvest(dom, actual).internal();
                    LOG.info("  ! list pagination of {}: {} links, page not saved", verdict.matchedUrl(), pageLinks.size());
                    ctx.stats().paginationHarvested();
                    return NavigationAttempt.success(CrawlResult.builder(url, PageOutcome.PAGINATION_VARIANT)
                            .actualUrl(actual).status(status).marker(BodyMarker.LIST_PAGINATION)
                            .title(title).links(new ArrayList<>(pageLinks)).build());
                default:
                    if (verdict.kind() == Classification.DISTINCT) {
                        LOG.debug("  same title as {} but treated as separate page ({})", verdict.matchedUrl(), verdict.reason());
                    }
            }

            // ---- 저장 + 날짜 + 링크 ----
            String saved = store.save(html, title, dir);
            String lastUpdated = dates.extractLastUpdated(dom);
            LinkHarvest harvest = links.harvest(dom, actual);
            recordLinkErrors(harvest, entry, url, title, ctx);
            Map<String, Integer> external = verifyExternal(harvest.external(), new SourcePage(title, url), entry, ctx);

            return NavigationAttempt.success(CrawlResult.builder(url, PageOutcome.ACCEPTED)
                    .actualUrl(actual)
                    .status(status)
                    .body(html)
                    .title(title)
                    .lastUpdated(lastUpdated)
                    .savedPath(saved)
                    .links(new ArrayList<>(harvest.internal()))
                    .externalStatuses(external)
                    .build());

        } catch (NavigationException e) {
            return NavigationAttempt.failure(e.status() != 0 ? e.status() : status, e.getMessage());
        } catch (IOException e) {
            LOG.warn("cannot save {}: {}", url, e.getMessage());
            return NavigationAttempt.failure(status, "save failed: " + e.getMessage());
        } catch (RuntimeException e) {
            // 렌더러 내부 오류도 페이지 단위 실패로
            LOG.warn("unexpected error on {}: {}", url, e.toString());
            return NavigationAttempt.failure(status, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /** <title> 이 비면 URL 마지막 조각, 그것도 없으면 index */
    static String titleOf(PageDom dom, String url) {
        String t = dom.title();
        if (t != null && !t.isEmpty()) return t;
        String last = UrlUtils.lastSegment(url);
        return last.isEmpty() ? "index" : last;
    }

    private void recordLinkErrors(LinkHarvest harvest, FrontierEntry entry, String url, String title, CrawlContext ctx) {
        for (LinkHarvest.MalformedLink bad : harvest.malformed()) {
            String info = "[LINK_ERROR] " + bad.href() + " - " + bad.error();
            LOG.warn("  ! link parsing error on {}: {}", url, info);
            ctx.recordPage(bad.href(), new PageRecord(info, DateSentinels.CRAWL_FAILED, "", 0,
                    entry.depth() + 1, new SourcePage(title, url)));
        }
    }

    /** 처음 보는 외부 링크만 병렬 검사, 페이지의 전체 외부 링크 상태를 돌려준다 */
    private Map<String, Integer> verifyExternal(Set<String> external, SourcePage source,
                                                FrontierEntry entry, CrawlContext ctx) {
        List<String> fresh = new ArrayList<>();
        for (String u : external) {
            if (ctx.claimExternal(u, source)) fresh.add(u);
        }

        if (!fresh.isEmpty()) {
            LOG.info("  -> checking {} external links (total external: {})", fresh.size(), external.size());
            LinkVerificationGroup group = new LinkVerificationGroup(verifier, linkPool);
            Map<String, Integer> checked = group.verifyAll(fresh);
            int failed = 0;
            for (Map.Entry<String, Integer> e : checked.entrySet()) {
                ctx.updateExternal(e.getKey(), e.getValue());
                ctx.stats().externalChecked();
                if (e.getValue() == 0 || e.getValue() >= 400) failed++;
                LOG.debug("    [link] {} -> {}", e.getKey(), e.getValue());
            }
            SLOG.info("links-verified", "page", source.url(), "depth", entry.depth(),
                    "checked", checked.size(), "failed", failed);
        } else if (!external.isEmpty()) {
            LOG.debug("  -> {} external links, all already checked", external.size());
        }

        Map<String, Integer> out = new LinkedHashMap<>();
        for (String u : external) out.put(u, ctx.externalStatus(u));
        return out;
    }
}
