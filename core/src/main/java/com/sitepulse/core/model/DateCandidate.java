package com.sitepulse.core.model;

/**
 * 본문/메타에서 찾은 날짜 후보.
 * normalized: YYYY-MM-DD (연/월만 있으면 YYYY-MM-01)
 */
public record DateCandidate(String raw, String normalized, Tier tier) {
    public enum Tier { KEYWORD, GENERIC, META }
}
