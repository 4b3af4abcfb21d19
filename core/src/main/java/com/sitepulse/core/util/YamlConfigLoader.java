package com.sitepulse.core.util;

import com.sitepulse.core.model.AuditConfig;
import com.sitepulse.core.model.SiteTarget;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;

/**
 * audit.yml을 읽어 AuditConfig로 변환.
 *
 * 예상 YAML 키:
 * outputDir: "assets"
 * maxDepth: 2
 * concurrentSites: 2
 * timeoutMs: 15000
 * saveHtml: true
 * pagination: true
 * spaSettleTimeoutMs: 5000
 * linkCheck:
 *   concurrency: 20
 *   timeoutMs: 15000
 *   userAgent: "..."
 * renderer:
 *   headless: true
 * sites:
 *   - url: "https://www.example.gov.tw/"
 *     name: "example"
 *     depth: 3          # 선택
 *     saveHtml: false   # 선택
 *     pagination: true  # 선택
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static AuditConfig loadDefault() throws IOException {
        return load(Path.of("audit.yml"));
    }

    public static AuditConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("audit.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root;
            try {
                root = yaml.load(in);
            } catch (YAMLException e) {
                throw new IOException("audit.yml is not valid YAML: " + e.getMessage(), e);
            }

            AuditConfig cfg = AuditConfig.defaults();
            if (!(root instanceof Map<?, ?> map)) {
                cfg.validate();
                return cfg;
            }

            // 1) 평면 키
            setString(map, "outputDir", s -> cfg.setOutputDir(Path.of(s)));
            setInt(map, "maxDepth", cfg::setMaxDepth);
            setInt(map, "concurrentSites", cfg::setConcurrentSites);
            setDurationMs(map, "timeoutMs", cfg::setNavigationTimeout);
            setDurationMs(map, "spaSettleTimeoutMs", cfg::setSpaSettleTimeout);
            setBoolean(map, "saveHtml", cfg::setSaveHtml);
            setBoolean(map, "pagination", cfg::setPagination);

            // 2) linkCheck.*
            Map<String, Object> lc = getMap(map, "linkCheck");
            if (lc != null) {
                var c = cfg.linkCheck();
                setInt(lc, "concurrency", c::setConcurrency);
                setDurationMs(lc, "timeoutMs", c::setTimeout);
                setString(lc, "userAgent", c::setUserAgent);
            }

            // 3) renderer.*
            Map<String, Object> rd = getMap(map, "renderer");
            if (rd != null) {
                setBoolean(rd, "headless", cfg.renderer()::setHeadless);
            }

            // 4) sites[]
            Object sites = map.get("sites");
            if (sites instanceof List<?> list) {
                int idx = 0;
                for (Object o : list) {
                    cfg.addSite(toSite(o, idx++));
                }
            } else if (sites != null) {
                throw new IllegalArgumentException("sites must be a list");
            }

            cfg.validate();
            return cfg;
        }
    }

    private static SiteTarget toSite(Object o, int idx) {
        if (o instanceof String s) {
            return new SiteTarget(s); // "- https://..." 단축형
        }
        if (!(o instanceof Map<?, ?> m) || m.get("url") == null) {
            throw new IllegalArgumentException("sites[" + idx + "] has no url");
        }
        SiteTarget site = new SiteTarget(String.valueOf(m.get("url")));
        setString(m, "name", site::setName);
        // 사이트별 오버라이드: 해석 불가 값은 전역값 폴백
        site.setDepth(lenientInt(m.get("depth")));
        site.setSaveHtml(lenientBool(m.get("saveHtml")));
        site.setPagination(lenientBool(m.get("pagination")));
        return site;
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, v));
    }

    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : parseInt(key, v);
        setter.accept(Duration.ofMillis(ms)); // 0 이하는 validate()에서 거부
    }

    private static int parseInt(String key, Object v) {
        try {
            return Integer.parseInt(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + v, e);
        }
    }

    private static Integer lenientInt(Object v) {
        if (v instanceof Number n) return n.intValue();
        if (v == null) return null;
        try { return Integer.parseInt(String.valueOf(v).trim()); }
        catch (NumberFormatException e) { return null; }
    }

    private static Boolean lenientBool(Object v) {
        if (v instanceof Boolean b) return b;
        if (v == null) return null;
        String s = String.valueOf(v).trim().toLowerCase(java.util.Locale.ROOT);
        if (s.equals("true") || s.equals("yes") || s.equals("1")) return Boolean.TRUE;
        if (s.equals("false") || s.equals("no") || s.equals("0")) return Boolean.FALSE;
        return null;
    }
}
