package com.sitepulse.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** 외부 링크 1건. sourcePage 는 처음 참조한 페이지. status 0 = 도달 불가 */
public record ExternalLinkRecord(
        @JsonProperty("status") int status,
        @JsonProperty("source_page") SourcePage sourcePage) {

    public ExternalLinkRecord withStatus(int newStatus) {
        return new ExternalLinkRecord(newStatus, sourcePage);
    }
}
