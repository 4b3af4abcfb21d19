package com.sitepulse.core.crawler;

import com.sitepulse.core.model.CrawlResult;

import java.util.Objects;

/** 이동 1회 결과: 성공(CrawlResult) 또는 실패(마지막 상태 + 사유). http→https 재시도 판단용 */
final class NavigationAttempt {
    private final CrawlResult result;
    private final int status;
    private final String reason;

    private NavigationAttempt(CrawlResult result, int status, String reason) {
        this.result = result;
        this.status = status;
        this.reason = reason;
    }

    static NavigationAttempt success(CrawlResult result) {
        return new NavigationAttempt(Objects.requireNonNull(result, "result"), result.getStatus(), null);
    }

    static NavigationAttempt failure(int status, String reason) {
        return new NavigationAttempt(null, status, reason);
    }

    boolean isSuccess() { return result != null; }
    CrawlResult result() { return result; }
    int status() { return status; }
    String reason() { return reason; }
}
