package com.sitepulse.core.api;

import java.time.Duration;

/** 렌더러 최소 계약: URL로 이동해 렌더링된 페이지 핸들을 돌려준다. */
public interface IPageRenderer extends AutoCloseable {
    /**
     * @throws NavigationException 연결 실패/타임아웃 등 이동 자체가 실패한 경우
     */
    RenderedPage navigate(String url, Duration timeout) throws NavigationException;

    @Override default void close() throws Exception {}
}
