package com.sitepulse.core.crawler;

import com.sitepulse.core.model.CrawlStats;
import com.sitepulse.core.model.ExternalLinkRecord;
import com.sitepulse.core.model.PageRecord;
import com.sitepulse.core.model.SourcePage;
import com.sitepulse.core.store.DirectoryLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 크롤 1회가 소유하는 상태: 방문 집합, 페이지/외부 링크 기록, 제목 맵, 상태 목록.
 * 크롤 스레드 하나에서만 갱신된다 (링크 검사 스레드는 결과만 돌려줌).
 */
public final class CrawlContext {
    private static final Logger LOG = LoggerFactory.getLogger(CrawlContext.class);

    private final Set<String> visited = new HashSet<>();
    private final Map<String, PageRecord> pages = new LinkedHashMap<>();
    private final Map<String, ExternalLinkRecord> externalLinks = new LinkedHashMap<>();
    private final Map<String, String> titles = new HashMap<>(); // 요청 URL → 제목
    private final List<Integer> statuses = new ArrayList<>();
    private final DirectoryLayout layout;
    private final CrawlStats stats;

    public CrawlContext(DirectoryLayout layout, CrawlStats stats) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.stats = Objects.requireNonNull(stats, "stats");
    }

    // ---- visited ----
    public boolean isVisited(String url) { return visited.contains(url); }
    public void markVisited(String url) { visited.add(url); }

    // ---- page ledger ----
    public Map<String, PageRecord> pages() { return Collections.unmodifiableMap(pages); }

    /** 키당 한 번만 기록. 이미 있으면 false */
    public boolean recordPage(String key, PageRecord record) {
        if (pages.putIfAbsent(key, record) != null) {
            LOG.debug("page already recorded, keeping first: {}", key);
            return false;
        }
        return true;
    }

    // ---- external ledger ----
    public Map<String, ExternalLinkRecord> externalLinks() { return Collections.unmodifiableMap(externalLinks); }

    /** 처음 보는 외부 링크면 status 0 으로 자리 잡고 true */
    public boolean claimExternal(String url, SourcePage source) {
        return externalLinks.putIfAbsent(url, new ExternalLinkRecord(0, source)) == null;
    }

    public void updateExternal(String url, int status) {
        ExternalLinkRecord r = externalLinks.get(url);
        if (r != null) externalLinks.put(url, r.withStatus(status));
    }

    public int externalStatus(String url) {
        ExternalLinkRecord r = externalLinks.get(url);
        return r == null ? 0 : r.status();
    }

    // ---- titles / lineage ----
    public String titleOf(String url) { return titles.get(url); }

    public void rememberTitle(String url, String title) {
        if (title != null && !title.isEmpty()) titles.put(url, title);
    }

    /** 부모 URL → {제목, URL}. 부모 없으면 null */
    public SourcePage sourcePageFor(String parentUrl) {
        if (parentUrl == null) return null;
        return new SourcePage(titles.getOrDefault(parentUrl, ""), parentUrl);
    }

    // ---- statuses ----
    public void appendStatus(int status) { statuses.add(status); }
    public List<Integer> statuses() { return Collections.unmodifiableList(statuses); }

    public DirectoryLayout layout() { return layout; }
    public CrawlStats stats() { return stats; }
}
