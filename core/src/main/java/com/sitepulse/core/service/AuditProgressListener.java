package com.sitepulse.core.service;

import com.sitepulse.core.model.SiteAuditResult;

import java.util.List;

/**
 * 사이트 감사 진행 알림.
 * 사이트 작업 스레드에서 불리므로 구현은 스레드 세이프해야 한다.
 */
@FunctionalInterface
public interface AuditProgressListener {

    /**
     * 사이트 1건 완료 (성공/실패 모두).
     * @param completed 완료 순서 기준 누계 (1부터)
     * @param total     설정된 전체 사이트 수
     */
    void onSiteDone(SiteAuditResult result, int completed, int total);

    /** 모든 사이트가 끝나고 audit_summary.json 을 쓰기 직전. 결과는 설정 순서 */
    default void onAllSitesDone(List<SiteAuditResult> results) {}

    AuditProgressListener NONE = (r, completed, total) -> {};
}
