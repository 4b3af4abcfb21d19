package com.sitepulse.core.model;

/** 페이지 방문 결과 분류. 컨트롤러는 이 값으로 기록/자식 큐잉을 결정한다. */
public enum PageOutcome {
    /** 정상 수집: PageRecord 기록 + 상태 추가 + 자식 depth+1 */
    ACCEPTED,
    /** 완전 중복(또는 페이지네이션 비활성 시 변형): 아무것도 기록하지 않음 */
    DUPLICATE,
    /** 페이지네이션 변형: 기록 없이 자식을 같은 depth로 */
    PAGINATION_VARIANT,
    /** 비 HTML 리소스: 표식 기록 + 상태 추가, 자식 없음 */
    SKIPPED_FILE,
    /** 프레임셋 컨테이너: 프레임 링크를 같은 depth로, 기록 없음 */
    FRAMESET,
    /** 이동 실패: 실패 기록 + 상태 추가 */
    FAILED
}
