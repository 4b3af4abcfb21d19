package com.sitepulse.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 내부 페이지 1건의 감사 결과 (키: 리다이렉트 이후 실제 URL). 불변.
 * JSON 필드명은 page_summary.json 포맷을 따른다.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record PageRecord(
        @JsonProperty("title") String title,
        @JsonProperty("last_updated") String lastUpdated,
        @JsonProperty("filepath") String savedPath,
        @JsonProperty("status") int status,
        @JsonProperty("depth") int depth,
        @JsonProperty("source_page") SourcePage sourcePage) {

    /** 이동 실패 기록: 제목 없음 + [crawl failed] */
    public static PageRecord failed(int status, int depth, SourcePage source) {
        return new PageRecord("", DateSentinels.CRAWL_FAILED, "", status, depth, source);
    }
}
