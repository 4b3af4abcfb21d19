package com.sitepulse.core.date;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 날짜 정규식 2단계.
 * KEYWORD: "更新日期: 113/03/15", "2024年3月15日更新" 처럼 라벨이 붙은 날짜.
 * GENERIC: 라벨 없는 y-m-d / y-m / d-m-yyyy / m-yyyy. 전화번호·수식·버전 문자열 오탐을 막기 위해 앞뒤 문자 제한.
 */
final class DatePatterns {
    private DatePatterns() {}

    private static final String KW =
            "(?:更新日期|發布日期|修改日期|上版日期|上架日期|發佈日期|建檔日期|最後更新|資料更新|內容更新|資料檢視|Data update|Review Date)";
    private static final String SUFFIX_KW = "(?:更新|發布|修改|發佈)";
    private static final String SEP = "(?:年|[/\\-.])";
    private static final String MONTH_SEP = "(?:月|[/\\-.])";
    private static final String DAY_END = "(?:[日號])?";

    // \d, \s 는 유니코드 기준 (전각 숫자 포함)
    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    static final List<Pattern> KEYWORD = List.of(
            Pattern.compile(KW + "[:：\\s]*(\\d{2,4})" + SEP + "(\\d{1,2})" + MONTH_SEP + "(\\d{1,2})" + DAY_END, FLAGS),
            Pattern.compile(KW + "[:：\\s]*(\\d{2,4})" + SEP + "(\\d{1,2})月?(?![/\\-.]\\d)(?!\\d)", FLAGS),
            Pattern.compile("(\\d{2,4})" + SEP + "(\\d{1,2})" + MONTH_SEP + "(\\d{1,2})" + DAY_END + "\\s*" + SUFFIX_KW, FLAGS),
            Pattern.compile("(\\d{2,4})" + SEP + "(\\d{1,2})月?(?![/\\-.])\\s*" + SUFFIX_KW, FLAGS));

    private static final String GUARD = "(?<![\\d+*/=.:;@#$%^&|\\\\])";
    private static final String GUARD_YM = "(?<![\\d~\\-+*/=.:;@#$%^&|\\\\])";

    static final List<Pattern> GENERIC = List.of(
            Pattern.compile(GUARD + "(\\d{2,4})" + SEP + "(\\d{1,2})" + MONTH_SEP + "(\\d{1,2})" + DAY_END + "(?!\\d)", FLAGS),
            Pattern.compile(GUARD_YM + "(\\d{2,4})" + SEP + "(0[1-9]|1[0-2]|[1-9])(?![/.月]\\d)(?!\\d|°)", FLAGS),
            Pattern.compile(GUARD + "(\\d{1,2})[/\\-.](\\d{1,2})[/\\-.](\\d{4})", FLAGS),
            Pattern.compile(GUARD + "(\\d{1,2})[/\\-.]((?:19|20)\\d{2})(?!\\d)", FLAGS));
}
