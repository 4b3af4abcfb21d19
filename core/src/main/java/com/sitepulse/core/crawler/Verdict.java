package com.sitepulse.core.crawler;

import com.sitepulse.core.model.BodyMarker;

/**
 * 분류 결과 + 근거.
 * matchedUrl: 판정 기준이 된 기존 기록 키(없으면 null), marker: 기록하지 않을 때 쓸 표식.
 */
public record Verdict(Classification kind, String matchedUrl, BodyMarker marker, String reason) {

    static Verdict fresh() {
        return new Verdict(Classification.NEW, null, null, "no record with the same title");
    }

    static Verdict distinct(String matchedUrl, String reason) {
        return new Verdict(Classification.DISTINCT, matchedUrl, null, reason);
    }

    static Verdict duplicate(String matchedUrl, String reason) {
        return new Verdict(Classification.EXACT_DUPLICATE, matchedUrl, BodyMarker.SKIPPED_DUPLICATE, reason);
    }

    static Verdict paginationSkipped(String matchedUrl) {
        return new Verdict(Classification.EXACT_DUPLICATE, matchedUrl, BodyMarker.SKIPPED_PAGINATION,
                "pagination variant while pagination is disabled");
    }

    static Verdict pagination(String matchedUrl) {
        return new Verdict(Classification.PAGINATION_VARIANT, matchedUrl, BodyMarker.LIST_PAGINATION,
                "pagination query parameters");
    }
}
