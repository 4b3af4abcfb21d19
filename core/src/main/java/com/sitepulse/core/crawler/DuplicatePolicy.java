package com.sitepulse.core.crawler;

/**
 * 중복/페이지네이션 판정 정책.
 * assumeDuplicateWhenUncomparable: 저장본이 없어 본문 비교를 못 할 때 중복으로 볼지 여부.
 */
public final class DuplicatePolicy {
    public static final int DEFAULT_SNIPPET_LENGTH = 500;

    private final boolean paginationEnabled;
    private final boolean assumeDuplicateWhenUncomparable;
    private final int snippetLength;

    public DuplicatePolicy(boolean paginationEnabled, boolean assumeDuplicateWhenUncomparable, int snippetLength) {
        if (snippetLength < 1) throw new IllegalArgumentException("snippetLength must be >= 1");
        this.paginationEnabled = paginationEnabled;
        this.assumeDuplicateWhenUncomparable = assumeDuplicateWhenUncomparable;
        this.snippetLength = snippetLength;
    }

    public static DuplicatePolicy defaults(boolean paginationEnabled) {
        return new DuplicatePolicy(paginationEnabled, true, DEFAULT_SNIPPET_LENGTH);
    }

    public boolean isPaginationEnabled() { return paginationEnabled; }
    public boolean isAssumeDuplicateWhenUncomparable() { return assumeDuplicateWhenUncomparable; }
    public int getSnippetLength() { return snippetLength; }
}
