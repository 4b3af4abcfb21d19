package com.sitepulse.core.crawler;

/** 방문한 페이지가 기존 기록과 어떤 관계인지 */
public enum Classification {
    /** 제목이 같은 기록 없음 */
    NEW,
    EXACT_DUPLICATE,
    PAGINATION_VARIANT,
    /** 제목은 같지만 다른 페이지로 판정 */
    DISTINCT;

    public boolean isRecordable() { return this == NEW || this == DISTINCT; }
}
