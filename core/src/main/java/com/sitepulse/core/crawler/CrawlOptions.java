package com.sitepulse.core.crawler;

import com.sitepulse.core.model.AuditConfig;
import com.sitepulse.core.model.SiteTarget;

import java.time.Duration;
import java.util.Objects;

/** 사이트 1건 크롤에 필요한 조정값 묶음 */
public record CrawlOptions(Duration navigationTimeout,
                           Duration spaSettleTimeout,
                           DuplicatePolicy duplicatePolicy,
                           int linkCheckConcurrency) {

    public CrawlOptions {
        Objects.requireNonNull(navigationTimeout, "navigationTimeout");
        Objects.requireNonNull(spaSettleTimeout, "spaSettleTimeout");
        Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
        if (linkCheckConcurrency < 1) throw new IllegalArgumentException("linkCheckConcurrency must be >= 1");
    }

    /** 전역 설정 + 사이트별 pagination 오버라이드 */
    public static CrawlOptions of(AuditConfig cfg, SiteTarget site) {
        return new CrawlOptions(
                cfg.getNavigationTimeout(),
                cfg.getSpaSettleTimeout(),
                DuplicatePolicy.defaults(site.paginationOr(cfg.isPagination())),
                cfg.linkCheck().getConcurrency());
    }
}
