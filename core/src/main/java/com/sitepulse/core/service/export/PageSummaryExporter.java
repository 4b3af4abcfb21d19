package com.sitepulse.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepulse.core.model.DateSentinels;
import com.sitepulse.core.model.ExternalLinkRecord;
import com.sitepulse.core.model.PageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * page_summary.json 작성기.
 * <pre>
 * { "page_summary": { url: PageRecord, ... },
 *   "external_links": { url: {status, source_page}, ... } }   // 외부 링크 없으면 생략
 * </pre>
 * 페이지 순서: 날짜 있는 것(최신순) → 파싱 불가 → [no date] → [crawl failed].
 * 외부 링크 순서: 2xx → 3xx → 4xx → 5xx → 0, 같은 그룹 안에서는 URL 사전순.
 */
public final class PageSummaryExporter {
    private static final Logger LOG = LoggerFactory.getLogger(PageSummaryExporter.class);

    private final ObjectMapper om = AuditJson.mapper();

    public Path export(Path siteDir,
                       Map<String, PageRecord> pages,
                       Map<String, ExternalLinkRecord> externals) throws IOException {
        Files.createDirectories(siteDir);
        Path out = AuditNaming.pageSummaryPath(siteDir);

        Map<String, Object> root = new LinkedHashMap<>();
        root.put("page_summary", orderPages(pages));
        if (externals != null && !externals.isEmpty()) {
            root.put("external_links", orderExternalLinks(externals));
        }

        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            om.writeValue(w, root);
        }
        LOG.info("page summary written: {} ({} pages, {} external links)",
                out, pages.size(), externals == null ? 0 : externals.size());
        return out;
    }

    static Map<String, PageRecord> orderPages(Map<String, PageRecord> pages) {
        List<Map.Entry<String, PageRecord>> dated = new ArrayList<>();
        List<Map.Entry<String, PageRecord>> unparsable = new ArrayList<>();
        List<Map.Entry<String, PageRecord>> noDate = new ArrayList<>();
        List<Map.Entry<String, PageRecord>> failed = new ArrayList<>();

        for (Map.Entry<String, PageRecord> e : pages.entrySet()) {
            String d = e.getValue().lastUpdated();
            if (DateSentinels.CRAWL_FAILED.equals(d)) failed.add(e);
            else if (DateSentinels.NO_DATE.equals(d)) noDate.add(e);
            else if (isIsoDate(d)) dated.add(e);
            else unparsable.add(e);
        }
        // 안정 정렬: 같은 날짜는 기록 순서 유지
        dated.sort(Comparator.comparing((Map.Entry<String, PageRecord> e) -> e.getValue().lastUpdated()).reversed());

        Map<String, PageRecord> out = new LinkedHashMap<>();
        for (List<Map.Entry<String, PageRecord>> group : List.of(dated, unparsable, noDate, failed)) {
            for (Map.Entry<String, PageRecord> e : group) out.put(e.getKey(), e.getValue());
        }
        return out;
    }

    static Map<String, ExternalLinkRecord> orderExternalLinks(Map<String, ExternalLinkRecord> externals) {
        List<Map.Entry<String, ExternalLinkRecord>> entries = new ArrayList<>(externals.entrySet());
        entries.sort(Comparator
                .comparingInt((Map.Entry<String, ExternalLinkRecord> e) -> statusClass(e.getValue().status()))
                .thenComparing(Map.Entry::getKey));
        Map<String, ExternalLinkRecord> out = new LinkedHashMap<>();
        for (Map.Entry<String, ExternalLinkRecord> e : entries) out.put(e.getKey(), e.getValue());
        return out;
    }

    static int statusClass(int status) {
        if (status >= 200 && status < 300) return 0;
        if (status >= 300 && status < 400) return 1;
        if (status >= 400 && status < 500) return 2;
        if (status >= 500) return 3;
        return 4;
    }

    private static boolean isIsoDate(String s) {
        if (s == null || s.isEmpty()) return false;
        try {
            LocalDate.parse(s);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
