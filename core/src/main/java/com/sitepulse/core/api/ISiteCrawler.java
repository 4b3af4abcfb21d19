package com.sitepulse.core.api;

import java.util.List;

/** 사이트 크롤러 최소 계약: 진입 URL에서 maxDepth까지 돌고 상태 목록을 돌려준다. */
public interface ISiteCrawler extends AutoCloseable {
    List<Integer> crawlSite(String entryUrl, int maxDepth);
    @Override default void close() throws Exception {}
}
