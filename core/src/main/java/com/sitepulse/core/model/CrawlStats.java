package com.sitepulse.core.model;

import java.util.concurrent.atomic.AtomicLong;

/** 크롤 1회 텔레메트리 누적기 (외부 링크 검사 스레드에서도 갱신되므로 스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong pagesVisited       = new AtomicLong(0); // 방문한 페이지 수 (https 재시도는 같은 페이지)
    private final AtomicLong duplicatesSkipped  = new AtomicLong(0);
    private final AtomicLong paginationHarvests = new AtomicLong(0);
    private final AtomicLong framesets          = new AtomicLong(0);
    private final AtomicLong skippedFiles       = new AtomicLong(0);
    private final AtomicLong failures           = new AtomicLong(0);
    private final AtomicLong externalChecks     = new AtomicLong(0);

    public void pageVisited()       { pagesVisited.incrementAndGet(); }
    public void duplicateSkipped()  { duplicatesSkipped.incrementAndGet(); }
    public void paginationHarvested() { paginationHarvests.incrementAndGet(); }
    public void framesetSeen()      { framesets.incrementAndGet(); }
    public void fileSkipped()       { skippedFiles.incrementAndGet(); }
    public void failure()           { failures.incrementAndGet(); }
    public void externalChecked()   { externalChecks.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(pagesVisited.get(), duplicatesSkipped.get(), paginationHarvests.get(),
                framesets.get(), skippedFiles.get(), failures.get(), externalChecks.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long pagesVisited;
        public final long duplicatesSkipped;
        public final long paginationHarvests;
        public final long framesets;
        public final long skippedFiles;
        public final long failures;
        public final long externalChecks;
        public Snapshot(long v, long d, long p, long f, long s, long x, long e) {
            this.pagesVisited = v;
            this.duplicatesSkipped = d;
            this.paginationHarvests = p;
            this.framesets = f;
            this.skippedFiles = s;
            this.failures = x;
            this.externalChecks = e;
        }
    }
}
