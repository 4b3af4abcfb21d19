package com.sitepulse.core.model;

import java.util.Objects;

/**
 * 감사 대상 사이트 1건 (audit.yml `sites:` 항목).
 * depth/saveHtml/pagination 은 선택값: null 이면 AuditConfig 전역값을 따른다.
 * depth 는 전역값보다 작을 때만 적용된다(전역 maxDepth 가 상한).
 */
public final class SiteTarget {
    private final String url;
    private String name;
    private Integer depth;
    private Boolean saveHtml;
    private Boolean pagination;

    public SiteTarget(String url) {
        this.url = Objects.requireNonNull(url, "url").trim();
    }

    public String getUrl() { return url; }
    public String getName() { return name; }
    public Integer getDepth() { return depth; }
    public Boolean getSaveHtml() { return saveHtml; }
    public Boolean getPagination() { return pagination; }

    public SiteTarget setName(String name) { this.name = name; return this; }
    public SiteTarget setDepth(Integer depth) { this.depth = depth; return this; }
    public SiteTarget setSaveHtml(Boolean saveHtml) { this.saveHtml = saveHtml; return this; }
    public SiteTarget setPagination(Boolean pagination) { this.pagination = pagination; return this; }

    // ---- 전역값 폴백 ----
    public int depthOr(int fallback) { return depth != null && depth >= 0 ? Math.min(depth, fallback) : fallback; }
    public boolean saveHtmlOr(boolean fallback) { return saveHtml != null ? saveHtml : fallback; }
    public boolean paginationOr(boolean fallback) { return pagination != null ? pagination : fallback; }

    @Override public String toString() {
        return "SiteTarget{" + url + (name != null ? ", name=" + name : "") + "}";
    }
}
