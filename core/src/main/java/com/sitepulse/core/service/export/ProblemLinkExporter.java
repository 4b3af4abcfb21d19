package com.sitepulse.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * page_summary.json 에서 status != 200 항목을 골라 CSV 두 개로 내보낸다.
 *  - error_pages.csv          : page_summary 쪽
 *  - error_external_links.csv : external_links 쪽
 * 해당 항목이 없으면 파일을 만들지 않는다.
 */
public final class ProblemLinkExporter {
    private static final Logger LOG = LoggerFactory.getLogger(ProblemLinkExporter.class);

    static final String HEADER = "problematic_url,status,parent_url";
    private static final String EOL = "\r\n";

    private final ObjectMapper om = AuditJson.mapper();

    /** CSV 1행 */
    public record ProblemLink(String url, int status, String parentUrl) {}

    /** @return 실제로 작성된 CSV 경로들 (0~2개) */
    public List<Path> export(Path pageSummaryJson) throws IOException {
        if (!Files.isRegularFile(pageSummaryJson)) {
            throw new IOException("page summary not found: " + pageSummaryJson);
        }
        JsonNode root = om.readTree(pageSummaryJson.toFile());
        Path dir = pageSummaryJson.toAbsolutePath().getParent();

        List<ProblemLink> pages = collect(root.path("page_summary"));
        List<ProblemLink> externals = collect(root.path("external_links"));

        List<Path> written = new ArrayList<>(2);
        if (!pages.isEmpty()) written.add(write(dir.resolve(AuditNaming.ERROR_PAGES), pages));
        if (!externals.isEmpty()) written.add(write(dir.resolve(AuditNaming.ERROR_EXTERNAL_LINKS), externals));

        if (written.isEmpty()) LOG.info("no problematic links in {}", pageSummaryJson);
        else LOG.info("problem links: {} pages, {} external -> {}", pages.size(), externals.size(), dir);
        return written;
    }

    static List<ProblemLink> collect(JsonNode section) {
        List<ProblemLink> out = new ArrayList<>();
        if (section == null || !section.isObject()) return out;
        Iterator<Map.Entry<String, JsonNode>> it = section.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode info = e.getValue();
            int status = info.path("status").asInt(200);
            if (status == 200) continue;
            JsonNode src = info.path("source_page");
            String parent = src.isObject() ? src.path("url").asText("") : "";
            out.add(new ProblemLink(e.getKey(), status, parent));
        }
        return out;
    }

    private static Path write(Path file, List<ProblemLink> rows) throws IOException {
        try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            w.write(HEADER);
            w.write(EOL);
            for (ProblemLink r : rows) {
                w.write(csv(r.url()));
                w.write(',');
                w.write(Integer.toString(r.status()));
                w.write(',');
                w.write(csv(r.parentUrl()));
                w.write(EOL);
            }
        }
        return file;
    }

    /** 쉼표/따옴표/개행이 있으면 따옴표로 감싸고 내부 따옴표는 두 번 */
    static String csv(String v) {
        if (v == null) return "";
        boolean quote = v.indexOf(',') >= 0 || v.indexOf('"') >= 0 || v.indexOf('\n') >= 0 || v.indexOf('\r') >= 0;
        return quote ? '"' + v.replace("\"", "\"\"") + '"' : v;
    }
}
