package com.sitepulse.core.dom;

import java.util.List;

/** PageDom 안의 요소 1개 */
public interface PageElement {
    String tagName();

    /** 속성값. 없으면 빈 문자열 */
    String attr(String name);

    boolean hasAttr(String name);

    /** 하위 텍스트(공백 정규화) */
    String text();

    /** 하위 모든 텍스트 노드 원문(양끝 공백 제거, 빈 것 제외), 문서 순서 */
    List<String> textNodes();

    /** 이 요소 범위 안에서 CSS 조회 */
    List<PageElement> select(String cssQuery);

    /** 문서에서 제거 */
    void remove();
}
