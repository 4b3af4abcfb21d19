package com.sitepulse.core.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 페이지 1회 방문의 일시적 결과 묶음.
 * body 는 HTML 본문 또는 BodyMarker 텍스트.
 * links 는 outcome 에 따라 자식(ACCEPTED), 같은 depth 형제(PAGINATION_VARIANT/FRAMESET) 로 쓰인다.
 */
public final class CrawlResult {
    private final String requestedUrl;
    private final String actualUrl;
    private final int status;
    private final String body;
    private final String lastUpdated;
    private final List<String> links;
    private final Map<String, Integer> externalStatuses;
    private final String title;
    private final String savedPath;
    private final PageOutcome outcome;

    private CrawlResult(Builder b) {
        this.requestedUrl = Objects.requireNonNull(b.requestedUrl, "requestedUrl");
        this.actualUrl = b.actualUrl != null ? b.actualUrl : b.requestedUrl;
        this.status = b.status;
        this.body = b.body == null ? "" : b.body;
        this.lastUpdated = b.lastUpdated == null ? DateSentinels.NO_DATE : b.lastUpdated;
        this.links = List.copyOf(b.links);
        this.externalStatuses = Map.copyOf(b.externalStatuses);
        this.title = b.title == null ? "" : b.title;
        this.savedPath = b.savedPath == null ? "" : b.savedPath;
        this.outcome = Objects.requireNonNull(b.outcome, "outcome");
    }

    public String getRequestedUrl() { return requestedUrl; }
    public String getActualUrl() { return actualUrl; }
    public int getStatus() { return status; }
    public String getBody() { return body; }
    public String getLastUpdated() { return lastUpdated; }
    public List<String> getLinks() { return links; }
    public Map<String, Integer> getExternalStatuses() { return externalStatuses; }
    public String getTitle() { return title; }
    public String getSavedPath() { return savedPath; }
    public PageOutcome getOutcome() { return outcome; }

    public static Builder builder(String requestedUrl, PageOutcome outcome) {
        return new Builder(requestedUrl, outcome);
    }

    public static final class Builder {
        private final String requestedUrl;
        private final PageOutcome outcome;
        private String actualUrl;
        private int status = 200;
        private String body;
        private String lastUpdated;
        private List<String> links = List.of();
        private Map<String, Integer> externalStatuses = Map.of();
        private String title;
        private String savedPath;

        private Builder(String requestedUrl, PageOutcome outcome) {
            this.requestedUrl = requestedUrl;
            this.outcome = outcome;
        }

        public Builder actualUrl(String v) { this.actualUrl = v; return this; }
        public Builder status(int v) { this.status = v; return this; }
        public Builder body(String v) { this.body = v; return this; }
        public Builder marker(BodyMarker m) { this.body = m.text(); return this; }
        public Builder lastUpdated(String v) { this.lastUpdated = v; return this; }
        public Builder links(List<String> v) { this.links = v == null ? List.of() : v; return this; }
        public Builder externalStatuses(Map<String, Integer> v) { this.externalStatuses = v == null ? Map.of() : v; return this; }
        public Builder title(String v) { this.title = v; return this; }
        public Builder savedPath(String v) { this.savedPath = v; return this; }

        public CrawlResult build() { return new CrawlResult(this); }
    }

    @Override public String toString() {
        return "CrawlResult{" + outcome + ", " + actualUrl + ", status=" + status + "}";
    }
}
