package com.sitepulse.core.crawler;

import com.sitepulse.core.util.UrlUtils;

import java.util.List;
import java.util.Locale;

/** 렌더링하지 않을 비 HTML 리소스(문서/압축/이미지/영상/음성/데이터 파일) 판정 */
public final class SkipRules {
    private SkipRules() {}

    static final List<String> SKIP_EXTENSIONS = List.of(
            // 문서
            ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ods", ".odt", ".ppt", ".pptx",
            // 압축
            ".zip", ".rar", ".7z", ".tar", ".gz",
            // 이미지
            ".jpg", ".jpeg", ".png", ".gif", ".bmp", ".svg", ".webp", ".ico",
            // 영상
            ".mp4", ".avi", ".mov", ".wmv", ".flv", ".webm", ".mkv",
            // 음성
            ".mp3", ".wav", ".flac", ".aac", ".ogg",
            // 데이터
            ".txt", ".csv", ".json", ".xml");

    /** 경로가 확장자로 끝나거나, 쿼리 어디에든 확장자가 들어있으면 true (download.php?file=a.pdf 등) */
    public static boolean isSkippable(String url) {
        String path = UrlUtils.pathOf(url).toLowerCase(Locale.ROOT);
        String query = UrlUtils.queryOf(url).toLowerCase(Locale.ROOT);
        for (String ext : SKIP_EXTENSIONS) {
            if (path.endsWith(ext) || query.contains(ext)) return true;
        }
        return false;
    }

    /** 건너뛴 파일의 표시 이름: 마지막 경로 조각, 없으면 skipped_file */
    public static String displayName(String url) {
        String last = UrlUtils.lastSegment(url);
        return last.isEmpty() ? "skipped_file" : last;
    }
}
