package com.sitepulse.core.crawler;

import java.util.List;
import java.util.Set;

/**
 * 페이지 1건에서 거둔 링크.
 * internal/external 은 발견 순서를 유지하는 중복 없는 집합, malformed 는 해석 실패한 원본 href.
 */
public record LinkHarvest(Set<String> internal, Set<String> external, List<MalformedLink> malformed) {

    public LinkHarvest {
        malformed = List.copyOf(malformed);
    }

    /** 해석 실패한 href + 예외 요약 */
    public record MalformedLink(String href, String error) {}
}
