package com.sitepulse.core.service.export;

import com.sitepulse.core.model.SiteTarget;
import com.sitepulse.core.store.FileNames;
import com.sitepulse.core.util.UrlUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

/** 출력 경로 규칙: <outputDir>/<site>/page_summary.json, <outputDir>/audit_summary.json */
public final class AuditNaming {

    public static final String PAGE_SUMMARY = "page_summary.json";
    public static final String ERROR_PAGES = "error_pages.csv";
    public static final String ERROR_EXTERNAL_LINKS = "error_external_links.csv";
    public static final String AUDIT_SUMMARY = "audit_summary.json";

    private AuditNaming() {}

    /** 사이트 폴더명: name 우선, 없으면 host 의 '.' → '_' */
    public static String siteDirName(SiteTarget site) {
        String name = site.getName();
        if (name != null && !name.isBlank()) return FileNames.sanitize(name);
        String host = UrlUtils.authority(site.getUrl());
        if (host.isEmpty()) return "unknown-site";
        return FileNames.sanitize(host.replace('.', '_').replace(':', '_'));
    }

    public static Path siteDir(Path outputDir, SiteTarget site) {
        return base(outputDir).resolve(siteDirName(site));
    }

    public static Path pageSummaryPath(Path siteDir) { return siteDir.resolve(PAGE_SUMMARY); }
    public static Path auditSummaryPath(Path outputDir) { return base(outputDir).resolve(AUDIT_SUMMARY); }

    private static Path base(Path outputDir) {
        return outputDir == null ? Paths.get("assets") : outputDir;
    }
}
