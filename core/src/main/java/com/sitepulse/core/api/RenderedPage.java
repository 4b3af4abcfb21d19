package com.sitepulse.core.api;

import java.time.Duration;

/**
 * navigate() 결과 핸들. 닫기 전까지 evaluate/waitForNetworkIdle 가능.
 * content()는 호출 시점의 DOM 직렬화 결과.
 */
public interface RenderedPage extends AutoCloseable {
    /** 리다이렉트 이후 최종 URL */
    String finalUrl();

    /** HTTP 상태. 응답 객체가 없으면 200으로 간주 */
    int statusCode();

    String content();

    /** 스크립트 평가 결과. 지원하지 않으면 null */
    Object evaluate(String script);

    void waitForNetworkIdle(Duration timeout) throws RenderWaitTimeoutException;

    @Override default void close() {}
}
