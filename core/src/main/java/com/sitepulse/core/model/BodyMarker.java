package com.sitepulse.core.model;

/** 본문 대신 CrawlResult에 실리는 표식 */
public enum BodyMarker {
    SKIPPED_FILE("[SKIPPED_FILE]"),
    FRAMESET_CONTAINER("[FRAMESET_CONTAINER]"),
    SKIPPED_DUPLICATE("[SKIPPED_DUPLICATE]"),
    SKIPPED_PAGINATION("[SKIPPED_PAGINATION]"),
    LIST_PAGINATION("[LIST_PAGINATION]"),
    CRAWL_FAILED("[CRAWL_FAILED]");

    private final String text;
    BodyMarker(String text) { this.text = text; }

    public String text() { return text; }

    @Override public String toString() { return text; }
}
