package com.sitepulse.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 감사 이벤트를 JSON 한 줄로 JUL 에 남긴다.
 * <pre>{"ts":..., "lvl":"INFO", "comp":"SiteCrawler", "site":"example", "event":"page-visited", ...}</pre>
 * site 는 {@link #siteScope(String)} 로 현재 스레드에 걸어 둔 사이트 이름 (없으면 생략).
 */
public final class StructuredLog {
    private static final ObjectMapper OM = new ObjectMapper();
    private static final ThreadLocal<String> SITE = new ThreadLocal<>();

    private final Logger jul;
    private final String comp;
    private final Clock clock;

    private StructuredLog(Class<?> cls, Clock clock) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
        this.clock = clock;
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls, Clock.systemUTC());
    }

    static StructuredLog get(Class<?> cls, Clock clock) {
        return new StructuredLog(cls, clock);
    }

    /** 사이트 1건 처리 동안 같은 스레드의 이벤트에 "site" 를 붙인다. try-with-resources 로 사용 */
    public static SiteScope siteScope(String site) {
        String previous = SITE.get();
        SITE.set(site);
        return () -> {
            if (previous == null) SITE.remove(); else SITE.set(previous);
        };
    }

    @FunctionalInterface
    public interface SiteScope extends AutoCloseable {
        @Override void close();
    }

    public void debug(String event, Object... kvs) { log(Level.FINE, event, null, kvs); }
    public void info(String event, Object... kvs) { log(Level.INFO, event, null, kvs); }
    public void warn(String event, Object... kvs) { log(Level.WARNING, event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = toJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    /** kvs: key1, value1, key2, value2 ... (홀수 개면 "_kv_mismatch": true) */
    String toJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = OM.createObjectNode();
        n.put("ts", clock.instant().toString());
        n.put("lvl", lvl.getName());
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        String site = SITE.get();
        if (site != null) n.put("site", site);
        n.put("event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        try {
            return OM.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            // ObjectNode 직렬화는 실패하지 않는다
            throw new IllegalStateException(e);
        }
    }

    private static void put(ObjectNode n, String k, Object v) {
        if (v == null) n.putNull(k);
        else if (v instanceof Integer i) n.put(k, i);
        else if (v instanceof Long l) n.put(k, l);
        else if (v instanceof Double d) n.put(k, d);
        else if (v instanceof Boolean b) n.put(k, b);
        else n.put(k, String.valueOf(v));
    }
}
