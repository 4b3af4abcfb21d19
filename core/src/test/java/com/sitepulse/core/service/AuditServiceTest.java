package com.sitepulse.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitepulse.core.api.ILinkVerifier;
import com.sitepulse.core.api.IPageRenderer;
import com.sitepulse.core.api.NavigationException;
import com.sitepulse.core.api.RenderedPage;
import com.sitepulse.core.model.AuditConfig;
import com.sitepulse.core.model.SiteAuditResult;
import com.sitepulse.core.model.SiteTarget;
import com.sitepulse.core.service.export.AuditNaming;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AuditService: 사이트별 격리 + 산출물")
class AuditServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-06-01T00:00:00Z"), ZoneOffset.UTC);

    private static final Map<String, String> PAGES = Map.of(
            "https://a.example/", "<html><head><title>Home</title></head><body>"
                    + "<p>2024-05-01</p><a href=\"/about\">About</a>"
                    + "<a href=\"https://ext.example/x\">Ext</a></body></html>",
            "https://a.example/about", "<html><head><title>About</title></head><body>"
                    + "<p>2020-01-01</p></body></html>",
            "https://b.example/", "<html><head><title>B</title></head><body><p>b</p></body></html>");

    @TempDir Path tmp;

    /** 메모리 렌더러: 등록 안 된 URL 은 연결 실패 */
    static final class MapRenderer implements IPageRenderer {
        final List<String> navigations = new CopyOnWriteArrayList<>();
        boolean closed;

        @Override
        public RenderedPage navigate(String url, Duration timeout) throws NavigationException {
            navigations.add(url);
            String html = PAGES.get(url);
            if (html == null) throw new NavigationException("net::ERR_NAME_NOT_RESOLVED at " + url, 0);
            return new RenderedPage() {
                @Override public String finalUrl() { return url; }
                @Override public int statusCode() { return 200; }
                @Override public String content() { return html; }
                @Override public Object evaluate(String script) { return null; }
                @Override public void waitForNetworkIdle(Duration t) {}
            };
        }

        @Override public void close() { closed = true; }
    }

    private AuditConfig config(SiteTarget... sites) {
        AuditConfig cfg = new AuditConfig().setOutputDir(tmp.resolve("out")).setMaxDepth(2).setConcurrentSites(2);
        for (SiteTarget s : sites) cfg.addSite(s);
        return cfg;
    }

    @Test
    @DisplayName("한 사이트 실패가 다른 사이트에 영향 없음, audit_summary.json 작성")
    void failingSiteIsIsolated() throws Exception {
        AuditConfig cfg = config(
                new SiteTarget("https://a.example/").setName("alpha").setSaveHtml(false),
                new SiteTarget("https://b.example/").setName("blocked").setSaveHtml(false));
        // 사이트 폴더 자리에 파일이 있으면 page_summary.json 을 쓸 수 없다
        Files.createDirectories(tmp.resolve("out"));
        Files.writeString(tmp.resolve("out").resolve("blocked"), "not a directory");

        List<MapRenderer> opened = new CopyOnWriteArrayList<>();
        AuditService service = new AuditService(cfg, CLOCK,
                c -> { MapRenderer r = new MapRenderer(); opened.add(r); return r; },
                c -> url -> url.contains("ext.example") ? 404 : 200);

        List<SiteAuditResult> results = service.runAll();

        assertEquals(2, results.size());
        SiteAuditResult alpha = results.get(0);
        SiteAuditResult blocked = results.get(1);
        assertEquals("alpha", alpha.getName());
        assertTrue(alpha.isSuccess());
        assertEquals("blocked", blocked.getName());
        assertFalse(blocked.isSuccess());
        assertNull(blocked.getStats());
        assertThat(blocked.getError()).isNotBlank();

        assertEquals(2, alpha.getStats().totalPages());
        assertEquals(1, alpha.getStats().outdatedPages());
        assertEquals(50.0, alpha.getStats().outdatedPercentage());
        assertEquals("2024-05-01", alpha.getStats().latestUpdate());
        assertEquals(1, alpha.getStats().failedExternalLinks());

        Path siteDir = tmp.resolve("out").resolve("alpha");
        assertEquals(siteDir.resolve(AuditNaming.PAGE_SUMMARY), alpha.summaryPath());
        assertTrue(Files.isRegularFile(siteDir.resolve(AuditNaming.ERROR_EXTERNAL_LINKS)));
        assertFalse(Files.exists(siteDir.resolve(AuditNaming.ERROR_PAGES)));

        // 사이트마다 새 렌더러, 끝나면 닫힘
        assertEquals(2, opened.size());
        assertThat(opened).allMatch(r -> r.closed);

        JsonNode summary = new ObjectMapper().readTree(tmp.resolve("out").resolve(AuditNaming.AUDIT_SUMMARY).toFile());
        assertEquals(2, summary.path("total_sites").asInt());
        assertEquals(1, summary.path("failed_sites").asInt());
        assertEquals("alpha", summary.path("sites").get(0).path("site_name").asText());
        assertEquals(2, summary.path("sites").get(0).path("stats").path("total_pages").asInt());
        assertFalse(summary.path("sites").get(0).has("error"));
        assertTrue(summary.path("sites").get(1).has("error"));
        assertEquals("2024-06-01T00:00:00Z", summary.path("generated_at").asText());
    }

    @Test
    @DisplayName("진행 알림: 사이트마다 결과와 누계, 마지막에 설정 순서 전체 결과")
    void progressListener_receivesSiteResults() {
        AuditConfig cfg = config(
                new SiteTarget("https://a.example/").setName("alpha").setSaveHtml(false),
                new SiteTarget("https://down.example/").setName("down").setSaveHtml(false));
        AuditService service = new AuditService(cfg, CLOCK, c -> new MapRenderer(), c -> url -> 200);

        List<String> done = new CopyOnWriteArrayList<>();
        List<Integer> counts = new CopyOnWriteArrayList<>();
        List<List<SiteAuditResult>> finished = new CopyOnWriteArrayList<>();
        List<SiteAuditResult> results = service.runAll(new AuditProgressListener() {
            @Override
            public void onSiteDone(SiteAuditResult result, int completed, int total) {
                done.add(result.getName());
                counts.add(completed);
                assertEquals(2, total);
            }

            @Override
            public void onAllSitesDone(List<SiteAuditResult> all) {
                finished.add(all);
            }
        });

        assertThat(done).containsExactlyInAnyOrder("alpha", "down");
        assertThat(counts).containsExactlyInAnyOrder(1, 2);
        assertEquals(1, finished.size());
        assertThat(finished.get(0)).extracting(SiteAuditResult::getName).containsExactly("alpha", "down");
        assertThat(finished.get(0)).isEqualTo(results);
    }

    @Test
    void rendererLaunchFailure_becomesFailureResult() {
        AuditConfig cfg = config(new SiteTarget("https://a.example/"));
        AuditService service = new AuditService(cfg, CLOCK,
                c -> { throw new IllegalStateException("browser launch failed"); },
                c -> url -> 200);

        List<SiteAuditResult> results = service.runAll();
        assertEquals(1, results.size());
        assertFalse(results.get(0).isSuccess());
        assertThat(results.get(0).getError()).contains("browser launch failed");
        assertEquals("a_example", results.get(0).getName());
        assertTrue(Files.isRegularFile(tmp.resolve("out").resolve(AuditNaming.AUDIT_SUMMARY)));
    }

    @Test
    void unreachableHomepage_isRecordedNotThrown() throws Exception {
        AuditConfig cfg = config(new SiteTarget("https://down.example/").setName("down").setSaveHtml(false));
        AuditService service = new AuditService(cfg, CLOCK, c -> new MapRenderer(), c -> url -> 200);

        SiteAuditResult r = service.auditSite(cfg.getSites().get(0));
        assertTrue(r.isSuccess());
        assertEquals(1, r.getStats().totalPages());
        assertEquals(1, r.getStats().failedPages());
        assertEquals(1, r.getStats().noDatePages());

        JsonNode json = new ObjectMapper().readTree(r.summaryPath().toFile());
        assertEquals("[crawl failed]", json.path("page_summary").path("https://down.example/").path("last_updated").asText());
        assertTrue(Files.isRegularFile(r.summaryPath().getParent().resolve(AuditNaming.ERROR_PAGES)));
    }

    @Test
    void siteDepthIsCappedByGlobal() {
        AuditConfig cfg = config(new SiteTarget("https://a.example/").setName("alpha").setSaveHtml(false).setDepth(0));
        MapRenderer renderer = new MapRenderer();
        SiteAuditResult r = new AuditService(cfg, CLOCK, c -> renderer, c -> url -> 200)
                .auditSite(cfg.getSites().get(0));

        assertEquals(1, r.getStats().totalPages());
        assertFalse(renderer.navigations.contains("https://a.example/about"));
    }

    @Test
    void invalidConfigRejectedOnConstruction() {
        AuditConfig cfg = config(new SiteTarget("ftp://a.example/"));
        assertThrows(IllegalArgumentException.class,
                () -> new AuditService(cfg, CLOCK, c -> new MapRenderer(), c -> url -> 200));
        assertNotNull(new AuditService(config(), CLOCK, c -> new MapRenderer(), c -> url -> 200).getConfig());
    }
}
