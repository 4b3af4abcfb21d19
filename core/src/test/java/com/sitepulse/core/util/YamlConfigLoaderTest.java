package com.sitepulse.core.util;

import com.sitepulse.core.model.AuditConfig;
import com.sitepulse.core.model.SiteTarget;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class YamlConfigLoaderTest {

    @TempDir Path tmp;

    private Path write(String yaml) throws IOException {
        Path p = tmp.resolve("audit.yml");
        Files.writeString(p, yaml);
        return p;
    }

    @Test
    void loadsAllKeys() throws Exception {
        AuditConfig cfg = YamlConfigLoader.load(write(String.join("\n",
                "outputDir: reports",
                "maxDepth: 4",
                "concurrentSites: 3",
                "timeoutMs: 20000",
                "spaSettleTimeoutMs: 3000",
                "saveHtml: false",
                "pagination: \"false\"",
                "linkCheck:",
                "  concurrency: 8",
                "  timeoutMs: 5000",
                "  userAgent: TestAgent/2",
                "renderer:",
                "  headless: false",
                "sites:",
                "  - url: \" https://www.example.gov.tw/ \"",
                "    name: gov",
                "    depth: 1",
                "    saveHtml: yes",
                "  - https://second.example/",
                "")));

        assertEquals(Path.of("reports"), cfg.getOutputDir());
        assertEquals(4, cfg.getMaxDepth());
        assertEquals(3, cfg.getConcurrentSites());
        assertEquals(Duration.ofSeconds(20), cfg.getNavigationTimeout());
        assertEquals(Duration.ofSeconds(3), cfg.getSpaSettleTimeout());
        assertFalse(cfg.isSaveHtml());
        assertFalse(cfg.isPagination());
        assertEquals(8, cfg.linkCheck().getConcurrency());
        assertEquals(Duration.ofSeconds(5), cfg.linkCheck().getTimeout());
        assertEquals("TestAgent/2", cfg.linkCheck().getUserAgent());
        assertFalse(cfg.renderer().isHeadless());

        assertThat(cfg.getSites()).hasSize(2);
        SiteTarget gov = cfg.getSites().get(0);
        assertEquals("https://www.example.gov.tw/", gov.getUrl());
        assertEquals("gov", gov.getName());
        assertEquals(1, gov.depthOr(cfg.getMaxDepth()));
        assertTrue(gov.saveHtmlOr(false));

        SiteTarget second = cfg.getSites().get(1);
        assertEquals("https://second.example/", second.getUrl());
        assertNull(second.getName());
        assertEquals(4, second.depthOr(cfg.getMaxDepth()));
    }

    @Test
    void siteDepthAboveGlobal_isCapped_andBadOverridesFallBack() throws Exception {
        AuditConfig cfg = YamlConfigLoader.load(write(String.join("\n",
                "maxDepth: 2",
                "sites:",
                "  - url: https://a.example/",
                "    depth: 9",
                "    pagination: maybe",
                "  - url: https://b.example/",
                "    depth: deep",
                "")));

        assertEquals(2, cfg.getSites().get(0).depthOr(cfg.getMaxDepth()));
        assertNull(cfg.getSites().get(0).getPagination());
        assertNull(cfg.getSites().get(1).getDepth());
    }

    @Test
    void emptyFile_givesDefaults() throws Exception {
        AuditConfig cfg = YamlConfigLoader.load(write(""));
        assertEquals(2, cfg.getMaxDepth());
        assertEquals(Path.of("assets"), cfg.getOutputDir());
        assertThat(cfg.getSites()).isEmpty();
    }

    @Test
    void invalidInputs() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(write("sites:\n  - name: no-url\n")));
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(write("sites: https://a.example/\n")));
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(write("maxDepth: many\n")));
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(write("timeoutMs: 0\n")));
        assertThrows(IllegalArgumentException.class,
                () -> YamlConfigLoader.load(write("sites:\n  - ftp://a.example/\n")));
        assertThrows(IOException.class,
                () -> YamlConfigLoader.load(write("maxDepth: [unclosed\n")));
        assertThrows(IOException.class,
                () -> YamlConfigLoader.load(tmp.resolve("missing.yml")));
    }
}
