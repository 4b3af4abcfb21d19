package com.sitepulse.core.api;

/** 외부 링크 검사 최소 계약: URL을 받아 HTTP 상태(도달 불가 시 0)를 돌려준다. */
public interface ILinkVerifier extends AutoCloseable {
    int checkLink(String url);
    @Override default void close() throws Exception {}
}
