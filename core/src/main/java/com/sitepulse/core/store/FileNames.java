package com.sitepulse.core.store;

import java.util.regex.Pattern;

/** 페이지 제목 → 파일/디렉터리 이름 */
public final class FileNames {
    private FileNames() {}

    static final int MAX_LENGTH = 150;
    static final String DIR_SUFFIX = "_links";
    static final String HTML_EXT = ".html";

    private static final Pattern ILLEGAL = Pattern.compile("[<>:\"/\\\\|?*]");
    private static final Pattern RUNS = Pattern.compile("[_\\-\\s]+", Pattern.UNICODE_CHARACTER_CLASS);

    /** 금지 문자 → '_', '_ - 공백' 연속 → '_', 양끝 ' _' 제거, 150자 제한 */
    public static String sanitize(String name) {
        String s = name == null ? "" : name;
        s = ILLEGAL.matcher(s).replaceAll("_");
        s = RUNS.matcher(s).replaceAll("_");
        s = strip(s);
        if (s.length() > MAX_LENGTH) s = s.substring(0, MAX_LENGTH);
        return s.isEmpty() || s.chars().allMatch(c -> c == '.') ? "index" : s;
    }

    /** 파일명: 이미 '.' 이 있으면 그대로, 없으면 .html */
    public static String fileName(String title) {
        String s = sanitize(title);
        return s.indexOf('.') >= 0 ? s : s + HTML_EXT;
    }

    /** 자식 페이지 디렉터리: <부모제목>_links */
    public static String directoryName(String parentTitle) {
        return sanitize(parentTitle) + DIR_SUFFIX;
    }

    /** 충돌 회피 이름: a.html → a_1.html */
    static String withCounter(String fileName, int counter) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) return fileName + "_" + counter;
        return fileName.substring(0, dot) + "_" + counter + fileName.substring(dot);
    }

    private static String strip(String s) {
        int b = 0, e = s.length();
        while (b < e && (s.charAt(b) == ' ' || s.charAt(b) == '_')) b++;
        while (e > b && (s.charAt(e - 1) == ' ' || s.charAt(e - 1) == '_')) e--;
        return s.substring(b, e);
    }
}
