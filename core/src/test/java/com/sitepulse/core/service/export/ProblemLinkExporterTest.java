package com.sitepulse.core.service.export;

import com.sitepulse.core.model.ExternalLinkRecord;
import com.sitepulse.core.model.PageRecord;
import com.sitepulse.core.model.SourcePage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProblemLinkExporterTest {

    private static final SourcePage HOME = new SourcePage("Home", "https://s.example/");

    @TempDir Path tmp;

    @Test
    void writesBothCsvsWithNon200Rows() throws Exception {
        Map<String, PageRecord> pages = new LinkedHashMap<>();
        pages.put("https://s.example/", new PageRecord("Home", "2024-01-01", "", 200, 0, null));
        pages.put("https://s.example/gone", new PageRecord("", "[crawl failed]", "", 404, 1, HOME));
        pages.put("https://s.example/moved", new PageRecord("M", "[no date]", "", 301, 1, HOME));
        Map<String, ExternalLinkRecord> ext = new LinkedHashMap<>();
        ext.put("https://ok.example/", new ExternalLinkRecord(200, HOME));
        ext.put("https://down.example/a,b", new ExternalLinkRecord(0, HOME));

        Path json = new PageSummaryExporter().export(tmp, pages, ext);
        List<Path> written = new ProblemLinkExporter().export(json);

        assertThat(written).containsExactly(
                tmp.resolve(AuditNaming.ERROR_PAGES), tmp.resolve(AuditNaming.ERROR_EXTERNAL_LINKS));

        // 날짜 순서상 [no date] 가 [crawl failed] 앞
        String pagesCsv = Files.readString(written.get(0), StandardCharsets.UTF_8);
        assertEquals(ProblemLinkExporter.HEADER + "\r\n"
                + "https://s.example/moved,301,https://s.example/\r\n"
                + "https://s.example/gone,404,https://s.example/\r\n", pagesCsv);

        String extCsv = Files.readString(written.get(1), StandardCharsets.UTF_8);
        assertEquals(ProblemLinkExporter.HEADER + "\r\n"
                + "\"https://down.example/a,b\",0,https://s.example/\r\n", extCsv);
    }

    @Test
    void nothingProblematic_writesNoFiles() throws Exception {
        Path json = new PageSummaryExporter().export(tmp,
                Map.of("https://s.example/", new PageRecord("Home", "2024-01-01", "", 200, 0, null)), Map.of());

        assertThat(new ProblemLinkExporter().export(json)).isEmpty();
        assertTrue(Files.notExists(tmp.resolve(AuditNaming.ERROR_PAGES)));
        assertTrue(Files.notExists(tmp.resolve(AuditNaming.ERROR_EXTERNAL_LINKS)));
    }

    @Test
    void missingStatusDefaultsTo200_andMissingParentIsBlank() throws Exception {
        Path json = tmp.resolve("page_summary.json");
        Files.writeString(json, "{\"page_summary\":{"
                + "\"https://s.example/a\":{\"title\":\"A\"},"
                + "\"https://s.example/b\":{\"status\":500}}}");

        List<Path> written = new ProblemLinkExporter().export(json);
        assertThat(written).hasSize(1);
        assertEquals(ProblemLinkExporter.HEADER + "\r\nhttps://s.example/b,500,\r\n", Files.readString(written.get(0)));
    }

    @Test
    void missingInput_throws() {
        assertThrows(IOException.class, () -> new ProblemLinkExporter().export(tmp.resolve("nope.json")));
    }

    @Test
    void csvQuoting() {
        assertEquals("plain", ProblemLinkExporter.csv("plain"));
        assertEquals("\"a,b\"", ProblemLinkExporter.csv("a,b"));
        assertEquals("\"say \"\"hi\"\"\"", ProblemLinkExporter.csv("say \"hi\""));
        assertEquals("", ProblemLinkExporter.csv(null));
    }
}
