package com.sitepulse.core.service.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepulse.core.model.SiteAuditResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/** 다중 사이트 실행 요약: <outputDir>/audit_summary.json */
public final class AuditSummaryExporter {

    private final ObjectMapper om = AuditJson.mapper();

    public record RunSummary(
            @JsonProperty("generated_at") Instant generatedAt,
            @JsonProperty("total_sites") int totalSites,
            @JsonProperty("failed_sites") long failedSites,
            @JsonProperty("sites") List<SiteAuditResult> sites) {}

    public Path export(Path outputDir, List<SiteAuditResult> results, Instant generatedAt) throws IOException {
        Path out = AuditNaming.auditSummaryPath(outputDir);
        Files.createDirectories(out.toAbsolutePath().getParent());
        long failed = results.stream().filter(r -> !r.isSuccess()).count();
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            om.writeValue(w, new RunSummary(generatedAt, results.size(), failed, List.copyOf(results)));
        }
        return out;
    }
}
