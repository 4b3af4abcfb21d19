package com.sitepulse.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;

/**
 * 사이트 1건 요약 통계 (보고 계층 입력).
 * outdated: 오늘 기준 365일 이상 지난 날짜.
 * latestUpdate: 과거(오늘 포함) 최댓값, 없으면 가장 이른 미래 날짜, 둘 다 없으면 "none".
 */
public record SiteStats(
        @JsonProperty("total_pages") int totalPages,
        @JsonProperty("pages_with_date") int pagesWithDate,
        @JsonProperty("no_date_pages") int noDatePages,
        @JsonProperty("latest_update") String latestUpdate,
        @JsonProperty("outdated_pages") int outdatedPages,
        @JsonProperty("outdated_percentage") double outdatedPercentage,
        @JsonProperty("failed_pages") int failedPages,
        @JsonProperty("failed_external_links") int failedExternalLinks,
        @JsonProperty("total_external_links") int totalExternalLinks,
        @JsonProperty("crawl_duration_seconds") long crawlDurationSeconds) {

    public static final String NO_VALID_DATE = "none";
    static final int OUTDATED_DAYS = 365;

    public static SiteStats compute(List<Integer> statuses,
                                    Collection<PageRecord> pages,
                                    Collection<ExternalLinkRecord> externals,
                                    Duration crawlDuration,
                                    Clock clock) {
        LocalDate today = LocalDate.now(clock);
        LocalDate outdatedCutoff = today.minusDays(OUTDATED_DAYS);

        int failedPages = 0;
        for (int s : statuses) if (s >= 400 || s == 0) failedPages++;

        int failedExternal = 0;
        for (ExternalLinkRecord e : externals) if (e.status() >= 400 || e.status() == 0) failedExternal++;

        int noDate = 0, outdated = 0, dated = 0;
        LocalDate latestPast = null, earliestFuture = null;
        for (PageRecord p : pages) {
            String v = p.lastUpdated();
            if (v == null || v.isEmpty() || DateSentinels.isSentinel(v)) { noDate++; continue; }
            LocalDate d;
            try {
                d = LocalDate.parse(v);
            } catch (DateTimeParseException e) {
                noDate++;
                continue;
            }
            dated++;
            if (!d.isAfter(today)) {
                if (latestPast == null || d.isAfter(latestPast)) latestPast = d;
                if (!d.isAfter(outdatedCutoff)) outdated++;
            } else if (earliestFuture == null || d.isBefore(earliestFuture)) {
                earliestFuture = d;
            }
        }

        String latest = latestPast != null ? latestPast.toString()
                : earliestFuture != null ? earliestFuture.toString()
                : NO_VALID_DATE;
        double pct = dated == 0 ? 0.0
                : BigDecimal.valueOf(outdated * 100.0 / dated).setScale(2, RoundingMode.HALF_UP).doubleValue();

        return new SiteStats(statuses.size(), dated, noDate, latest, outdated, pct,
                failedPages, failedExternal, externals.size(),
                crawlDuration == null ? 0 : crawlDuration.toSeconds());
    }
}
