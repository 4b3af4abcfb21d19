package com.sitepulse.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/** 다중 사이트 실행에서 사이트 1건의 성공/실패 결과 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SiteAuditResult {
    private final String name;
    private final String url;
    private final Instant startedAt;
    private final SiteStats stats;     // 실패 시 null
    private final Path summaryPath;    // 실패 시 null
    private final String error;        // 성공 시 null

    private SiteAuditResult(String name, String url, Instant startedAt, SiteStats stats, Path summaryPath, String error) {
        this.name = Objects.requireNonNull(name, "name");
        this.url = Objects.requireNonNull(url, "url");
        this.startedAt = startedAt;
        this.stats = stats;
        this.summaryPath = summaryPath;
        this.error = error;
    }

    public static SiteAuditResult success(String name, String url, Instant startedAt, SiteStats stats, Path summaryPath) {
        return new SiteAuditResult(name, url, startedAt, Objects.requireNonNull(stats, "stats"), summaryPath, null);
    }

    public static SiteAuditResult failure(String name, String url, Instant startedAt, String error) {
        return new SiteAuditResult(name, url, startedAt, null, null, error == null ? "unknown error" : error);
    }

    @JsonProperty("site_name") public String getName() { return name; }
    @JsonProperty("site_url") public String getUrl() { return url; }
    @JsonProperty("started_at") public Instant getStartedAt() { return startedAt; }
    @JsonProperty("stats") public SiteStats getStats() { return stats; }
    @JsonProperty("summary_path") public String getSummaryPathText() { return summaryPath == null ? null : summaryPath.toString(); }
    @JsonProperty("error") public String getError() { return error; }

    public Path summaryPath() { return summaryPath; }
    @JsonIgnore public boolean isSuccess() { return error == null; }

    @Override public String toString() {
        return "SiteAuditResult{" + name + ", " + (isSuccess() ? "ok" : "failed: " + error) + "}";
    }
}
