package com.sitepulse.core.model;

import java.util.Objects;

/** BFS 대기열 항목. parentUrl 은 최상위(진입/사이트맵 시드 부모 없음)일 때 null. */
public record FrontierEntry(String url, String parentUrl, int depth) {
    public FrontierEntry {
        Objects.requireNonNull(url, "url");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }
}
