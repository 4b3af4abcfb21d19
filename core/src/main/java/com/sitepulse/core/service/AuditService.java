package com.sitepulse.core.service;

import com.sitepulse.core.api.ILinkVerifier;
import com.sitepulse.core.api.IPageRenderer;
import com.sitepulse.core.api.IPageStore;
import com.sitepulse.core.crawler.CrawlOptions;
import com.sitepulse.core.crawler.SiteCrawler;
import com.sitepulse.core.http.ExternalLinkVerifier;
import com.sitepulse.core.model.AuditConfig;
import com.sitepulse.core.model.CrawlStats;
import com.sitepulse.core.model.SiteAuditResult;
import com.sitepulse.core.model.SiteStats;
import com.sitepulse.core.model.SiteTarget;
import com.sitepulse.core.render.PlaywrightPageRenderer;
import com.sitepulse.core.service.export.AuditNaming;
import com.sitepulse.core.service.export.AuditSummaryExporter;
import com.sitepulse.core.service.export.PageSummaryExporter;
import com.sitepulse.core.service.export.ProblemLinkExporter;
import com.sitepulse.core.store.DiscardingPageStore;
import com.sitepulse.core.store.FileSystemPageStore;
import com.sitepulse.core.util.NamedThreadFactory;
import com.sitepulse.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 다중 사이트 감사 오케스트레이션.
 *  - 사이트마다 독립된 렌더러/검사기/크롤러 (상태 공유 없음)
 *  - 고정 스레드풀(concurrentSites)로 사이트 병렬
 *  - 사이트 1건 실패는 SiteAuditResult.failure 로 격리, 나머지 사이트는 계속
 *  - 사이트별 page_summary.json + 문제 링크 CSV, 전체 audit_summary.json
 */
public final class AuditService {

    private static final Logger LOG = LoggerFactory.getLogger(AuditService.class);
    private static final StructuredLog SLOG = StructuredLog.get(AuditService.class);

    /** 사이트마다 새 렌더러 (Playwright 인스턴스는 스레드 간 공유 불가) */
    @FunctionalInterface
    public interface RendererFactory {
        IPageRenderer open(AuditConfig cfg) throws Exception;
    }

    @FunctionalInterface
    public interface VerifierFactory {
        ILinkVerifier open(AuditConfig cfg) throws Exception;
    }

    private final AuditConfig config;
    private final Clock clock;
    private final RendererFactory renderers;
    private final VerifierFactory verifiers;

    private final PageSummaryExporter summaryExporter = new PageSummaryExporter();
    private final ProblemLinkExporter problemExporter = new ProblemLinkExporter();
    private final AuditSummaryExporter runExporter = new AuditSummaryExporter();

    /** 기본 구현: Chromium 렌더러 + HttpClient 링크 검사 */
    public AuditService(AuditConfig config) {
        this(config, Clock.systemDefaultZone(),
                c -> new PlaywrightPageRenderer(c.renderer(), c.linkCheck().getUserAgent()),
                c -> new ExternalLinkVerifier(c.linkCheck()));
    }

    /** DI/테스트용 */
    public AuditService(AuditConfig config, Clock clock, RendererFactory renderers, VerifierFactory verifiers) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.renderers = Objects.requireNonNull(renderers, "renderers");
        this.verifiers = Objects.requireNonNull(verifiers, "verifiers");
    }

    public List<SiteAuditResult> runAll() {
        return runAll(AuditProgressListener.NONE);
    }

    /** 설정된 모든 사이트를 감사하고 audit_summary.json 을 남긴다. 결과는 설정 순서. */
    public List<SiteAuditResult> runAll(AuditProgressListener listener) {
        final AuditProgressListener pl = (listener != null) ? listener : AuditProgressListener.NONE;
        final List<SiteTarget> sites = config.getSites();
        final int total = sites.size();
        final int cc = Math.max(1, Math.min(config.getConcurrentSites(), Math.max(1, total)));

        LOG.info("Audit start: sites={}, concurrentSites={}, maxDepth={}", total, cc, config.getMaxDepth());
        SLOG.info("audit-start", "sites", total, "cc", cc, "maxDepth", config.getMaxDepth());

        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("site-audit"));

        final AtomicInteger done = new AtomicInteger(0);
        final List<Future<SiteAuditResult>> futures = new ArrayList<>(total);
        for (SiteTarget site : sites) {
            futures.add(exec.submit(() -> {
                SiteAuditResult r = auditSite(site);
                int n = done.incrementAndGet();
                pl.onSiteDone(r, n, total);
                return r;
            }));
        }

        List<SiteAuditResult> results = new ArrayList<>(total);
        try {
            for (int i = 0; i < futures.size(); i++) {
                SiteTarget site = sites.get(i);
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    LOG.warn("Site task failed: {} ({})", site.getUrl(), cause.toString());
                    results.add(SiteAuditResult.failure(AuditNaming.siteDirName(site), site.getUrl(),
                            clock.instant(), cause.toString()));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while waiting for site audits");
                }
            }
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }

        pl.onAllSitesDone(List.copyOf(results));
        try {
            Path summary = runExporter.export(config.getOutputDir(), results, clock.instant());
            LOG.info("Audit summary written: {}", summary);
        } catch (IOException e) {
            LOG.warn("Failed to write audit summary: {}", e.toString());
            SLOG.error("audit-summary-failed", e, "outputDir", String.valueOf(config.getOutputDir()));
        }

        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        LOG.info("Audit done. sites={}, failed={}", results.size(), failed);
        SLOG.info("audit-done", "sites", results.size(), "failed", failed);
        return results;
    }

    /**
     * 사이트 1건: 크롤 → page_summary.json → 문제 링크 CSV → 통계.
     * 어떤 예외도 밖으로 던지지 않고 실패 결과로 바꾼다.
     */
    public SiteAuditResult auditSite(SiteTarget site) {
        try (StructuredLog.SiteScope scope = StructuredLog.siteScope(AuditNaming.siteDirName(site))) {
            return audit(site);
        }
    }

    private SiteAuditResult audit(SiteTarget site) {
        final String name = AuditNaming.siteDirName(site);
        final Path siteDir = AuditNaming.siteDir(config.getOutputDir(), site);
        final int depth = site.depthOr(config.getMaxDepth());
        final boolean saveHtml = site.saveHtmlOr(config.isSaveHtml());
        final Instant startedAt = clock.instant();

        LOG.info("Site start: {} ({}) depth={}, saveHtml={}", name, site.getUrl(), depth, saveHtml);
        SLOG.info("site-start", "site", name, "url", site.getUrl(), "depth", depth, "saveHtml", saveHtml);

        try (IPageRenderer renderer = renderers.open(config);
             ILinkVerifier verifier = verifiers.open(config)) {

            IPageStore store = saveHtml ? new FileSystemPageStore() : new DiscardingPageStore();
            SiteCrawler crawler = new SiteCrawler(renderer, verifier, store, siteDir,
                    CrawlOptions.of(config, site), clock);

            List<Integer> statuses = crawler.crawlSite(site.getUrl(), depth);
            Duration took = Duration.between(startedAt, clock.instant());

            Path summary = summaryExporter.export(siteDir, crawler.getPageSummary(), crawler.getExternalLinks());
            problemExporter.export(summary);

            SiteStats stats = SiteStats.compute(statuses, crawler.getPageSummary().values(),
                    crawler.getExternalLinks().values(), took, clock);
            CrawlStats.Snapshot cs = crawler.getStats();

            LOG.info("Site done: {} pages={}, outdated={}%, failedPages={}, failedExternal={}/{}",
                    name, stats.totalPages(), stats.outdatedPercentage(), stats.failedPages(),
                    stats.failedExternalLinks(), stats.totalExternalLinks());
            SLOG.info("site-done",
                    "site", name,
                    "pages", stats.totalPages(),
                    "withDate", stats.pagesWithDate(),
                    "outdated", stats.outdatedPages(),
                    "failedPages", stats.failedPages(),
                    "externalLinks", stats.totalExternalLinks(),
                    "duplicates", cs.duplicatesSkipped,
                    "seconds", stats.crawlDurationSeconds());
            return SiteAuditResult.success(name, site.getUrl(), startedAt, stats, summary);

        } catch (Exception e) {
            LOG.warn("Site failed: {} ({})", name, e.toString());
            SLOG.error("site-failed", e, "site", name, "url", site.getUrl());
            return SiteAuditResult.failure(name, site.getUrl(), startedAt, e.toString());
        }
    }

    public AuditConfig getConfig() { return config; }
}
