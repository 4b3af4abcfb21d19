package com.sitepulse.core.model;

/** last_updated 필드의 특수값 */
public final class DateSentinels {
    private DateSentinels() {}

    public static final String NO_DATE = "[no date]";
    public static final String CRAWL_FAILED = "[crawl failed]";

    public static boolean isSentinel(String v) {
        return NO_DATE.equals(v) || CRAWL_FAILED.equals(v);
    }
}
