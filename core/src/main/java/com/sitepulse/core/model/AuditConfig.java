package com.sitepulse.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 감사 설정 (audit.yml 매핑 대상).
 * 사이트별 오버라이드는 SiteTarget 쪽에, 나머지는 여기 전역값.
 */
public final class AuditConfig {

    /** 외부 링크 검사 하위 설정: YAML `linkCheck:` */
    public static final class LinkCheckCfg {
        private int concurrency = 20;
        private Duration timeout = Duration.ofSeconds(15);
        private String userAgent =
                "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) SitePulse/0.3";

        public int getConcurrency() { return concurrency; }
        public Duration getTimeout() { return timeout; }
        public String getUserAgent() { return userAgent; }

        public LinkCheckCfg setConcurrency(int v) { this.concurrency = v; return this; }
        public LinkCheckCfg setTimeout(Duration v) { this.timeout = v; return this; }
        public LinkCheckCfg setUserAgent(String v) { if (v != null && !v.isBlank()) this.userAgent = v; return this; }
    }

    /** 렌더러 하위 설정: YAML `renderer:` */
    public static final class RendererCfg {
        private boolean headless = true;

        public boolean isHeadless() { return headless; }
        public RendererCfg setHeadless(boolean v) { this.headless = v; return this; }
    }

    // ---------- 기본 필드 ----------
    private Path outputDir = Path.of("assets");
    private int maxDepth = 2;
    private int concurrentSites = 2;
    private Duration navigationTimeout = Duration.ofSeconds(15);
    private Duration spaSettleTimeout = Duration.ofSeconds(5);
    private boolean saveHtml = true;
    private boolean pagination = true;

    private final LinkCheckCfg linkCheck = new LinkCheckCfg();
    private final RendererCfg renderer = new RendererCfg();
    private final List<SiteTarget> sites = new ArrayList<>();

    // ---------- getters ----------
    public Path getOutputDir() { return outputDir; }
    public int getMaxDepth() { return maxDepth; }
    public int getConcurrentSites() { return concurrentSites; }
    public Duration getNavigationTimeout() { return navigationTimeout; }
    public Duration getSpaSettleTimeout() { return spaSettleTimeout; }
    public boolean isSaveHtml() { return saveHtml; }
    public boolean isPagination() { return pagination; }
    public LinkCheckCfg linkCheck() { return linkCheck; }
    public RendererCfg renderer() { return renderer; }
    public List<SiteTarget> getSites() { return List.copyOf(sites); }

    // ---------- fluent setters ----------
    public AuditConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public AuditConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public AuditConfig setConcurrentSites(int n) { this.concurrentSites = n; return this; }
    public AuditConfig setNavigationTimeout(Duration d) { this.navigationTimeout = d; return this; }
    public AuditConfig setSpaSettleTimeout(Duration d) { this.spaSettleTimeout = d; return this; }
    public AuditConfig setSaveHtml(boolean v) { this.saveHtml = v; return this; }
    public AuditConfig setPagination(boolean v) { this.pagination = v; return this; }
    public AuditConfig addSite(SiteTarget site) { this.sites.add(Objects.requireNonNull(site, "site")); return this; }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(outputDir, "outputDir");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (concurrentSites < 1) throw new IllegalArgumentException("concurrentSites must be >= 1");
        requirePositive(navigationTimeout, "timeoutMs");
        requirePositive(spaSettleTimeout, "spaSettleTimeoutMs");
        if (linkCheck.getConcurrency() < 1)
            throw new IllegalArgumentException("linkCheck.concurrency must be >= 1");
        requirePositive(linkCheck.getTimeout(), "linkCheck.timeoutMs");
        for (SiteTarget s : sites) {
            if (s.getUrl().isEmpty()) throw new IllegalArgumentException("site url must not be blank");
            if (!s.getUrl().startsWith("http://") && !s.getUrl().startsWith("https://"))
                throw new IllegalArgumentException("site url must be http(s): " + s.getUrl());
        }
    }

    private static void requirePositive(Duration d, String key) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(key + " must be > 0");
    }

    public static AuditConfig defaults() { return new AuditConfig(); }
}
