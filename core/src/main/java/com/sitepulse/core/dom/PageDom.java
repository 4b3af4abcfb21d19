package com.sitepulse.core.dom;

import java.util.List;
import java.util.Optional;

/**
 * 파싱된 문서에 대한 좁은 조회/변형 인터페이스.
 * 날짜 추출, 사이트맵 탐색, 중복 판정은 이 인터페이스만 사용한다.
 */
public interface PageDom {

    /** 문서 기준 URL (상대 링크 해석용) */
    String baseUri();

    /** <title> 텍스트(양끝 공백 제거). 없으면 빈 문자열 */
    String title();

    /** 문서 루트 요소 */
    PageElement root();

    /** <body>. 없으면 empty */
    Optional<PageElement> body();

    /** CSS 셀렉터로 문서 전체 조회 */
    List<PageElement> select(String cssQuery);

    /** meta[property=key] 또는 meta[name=key]의 content. 비어있으면 empty */
    Optional<String> metaContent(String key);

    /** 독립 복사본 (원본에 영향 없이 요소 제거용) */
    PageDom copy();

    /** script/style 제거 + 공백 정규화된 전체 텍스트 */
    String visibleText();
}
