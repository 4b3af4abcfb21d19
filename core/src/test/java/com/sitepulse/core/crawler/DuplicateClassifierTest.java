package com.sitepulse.core.crawler;

import com.sitepulse.core.model.BodyMarker;
import com.sitepulse.core.model.PageRecord;
import com.sitepulse.core.store.DiscardingPageStore;
import com.sitepulse.core.store.FileSystemPageStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("DuplicateClassifier: new / duplicate / pagination / distinct")
class DuplicateClassifierTest {

    @TempDir
    Path tmp;

    private static PageRecord rec(String title, String savedPath) {
        return new PageRecord(title, "2024-01-01", savedPath, 200, 1, null);
    }

    private static DuplicateClassifier discarding(boolean pagination) {
        return new DuplicateClassifier(DuplicatePolicy.defaults(pagination), new DiscardingPageStore());
    }

    @Test
    void emptyLedger_isNew() {
        Verdict v = discarding(true).classify("https://ex.com/", "Home", "<p>x</p>", Map.of());
        assertEquals(Classification.NEW, v.kind());
        assertTrue(v.kind().isRecordable());
    }

    @Test
    @DisplayName("이미 기록된 실제 URL 은 제목과 무관하게 중복")
    void recordedUrl_isDuplicate() {
        Map<String, PageRecord> ledger = Map.of("https://ex.com/a", rec("A", ""));
        Verdict v = discarding(true).classify("https://ex.com/a", "Other", "", ledger);

        assertEquals(Classification.EXACT_DUPLICATE, v.kind());
        assertEquals(BodyMarker.SKIPPED_DUPLICATE, v.marker());
    }

    @Test
    @DisplayName("같은 제목 + 같은 경로 깊이 + page 파라미터 → 페이지네이션 변형")
    void sameTitle_paginationQuery() {
        Map<String, PageRecord> ledger = Map.of("https://ex.com/news", rec("News", ""));

        Verdict on = discarding(true).classify("https://ex.com/news?Page=3", "News", "", ledger);
        assertEquals(Classification.PAGINATION_VARIANT, on.kind());
        assertEquals("https://ex.com/news", on.matchedUrl());

        Verdict off = discarding(false).classify("https://ex.com/news?page=3", "News", "", ledger);
        assertEquals(Classification.EXACT_DUPLICATE, off.kind());
        assertEquals(BodyMarker.SKIPPED_PAGINATION, off.marker());
    }

    @Test
    @DisplayName("같은 제목 + 같은 경로 깊이, 페이지네이션 신호 없음 → distinct")
    void sameTitle_noPaginationSignal_isDistinct() {
        Map<String, PageRecord> ledger = Map.of("https://ex.com/news", rec("News", ""));

        assertEquals(Classification.DISTINCT,
                discarding(true).classify("https://ex.com/notice", "News", "", ledger).kind());
        // 값 없는 page= 는 신호로 보지 않는다
        assertEquals(Classification.DISTINCT,
                discarding(true).classify("https://ex.com/news?page=", "News", "", ledger).kind());
    }

    @Test
    @DisplayName("경로 깊이가 다르고 저장본이 없으면 정책값(기본: 중복)")
    void differentDepth_notComparable_followsPolicy() {
        Map<String, PageRecord> ledger = Map.of("https://ex.com/", rec("Home", "[not saved] Home.html"));

        assertEquals(Classification.EXACT_DUPLICATE,
                discarding(true).classify("https://ex.com/index.html", "Home", "<p>x</p>", ledger).kind());

        var lenient = new DuplicateClassifier(new DuplicatePolicy(true, false, 500), new DiscardingPageStore());
        assertEquals(Classification.DISTINCT,
                lenient.classify("https://ex.com/index.html", "Home", "<p>x</p>", ledger).kind());
    }

    @Test
    @DisplayName("경로 깊이가 다르면 저장본 앞 500자 본문 비교")
    void differentDepth_comparesSavedContent() throws Exception {
        var store = new FileSystemPageStore();
        String html = "<html><head><title>Home</title><script>var t = 1;</script></head>"
                + "<body><p>Welcome</p>\n\n<p>to   the office</p></body></html>";
        String saved = store.save(html, "Home", tmp);
        Map<String, PageRecord> ledger = Map.of("https://ex.com/", rec("Home", saved));
        var classifier = new DuplicateClassifier(DuplicatePolicy.defaults(true), store);

        // 공백/스크립트 차이는 무시
        String sameText = "<html><head><title>Home</title></head><body><p>Welcome</p> <p>to the office</p></body></html>";
        assertEquals(Classification.EXACT_DUPLICATE,
                classifier.classify("https://ex.com/index.html", "Home", sameText, ledger).kind());

        String other = "<html><head><title>Home</title></head><body><p>Another page</p></body></html>";
        assertEquals(Classification.DISTINCT,
                classifier.classify("https://ex.com/index.html", "Home", other, ledger).kind());
    }

    @Test
    @DisplayName("저장본을 읽을 수 없으면 distinct")
    void missingSavedCopy_isDistinct() {
        var classifier = new DuplicateClassifier(DuplicatePolicy.defaults(true), new FileSystemPageStore());
        Map<String, PageRecord> ledger = Map.of("https://ex.com/", rec("Home", tmp.resolve("gone.html").toString()));

        assertEquals(Classification.DISTINCT,
                classifier.classify("https://ex.com/a/b", "Home", "<p>x</p>", ledger).kind());
    }

    @Test
    @DisplayName("같은 제목 기록이 여러 개면 삽입 순서상 첫 번째로 판정")
    void firstMatchingTitle_decides() {
        Map<String, PageRecord> ledger = new LinkedHashMap<>();
        ledger.put("https://ex.com/list", rec("News", ""));
        ledger.put("https://ex.com/a/b/list", rec("News", ""));

        Verdict v = discarding(true).classify("https://ex.com/other?offset=20", "News", "", ledger);
        assertEquals(Classification.PAGINATION_VARIANT, v.kind());
        assertEquals("https://ex.com/list", v.matchedUrl());
    }

    @Test
    @DisplayName("같은 입력, 같은 기록이면 항상 같은 판정")
    void classification_isIdempotent() {
        Map<String, PageRecord> ledger = Map.of("https://ex.com/news", rec("News", ""));
        var c = discarding(true);
        Verdict first = c.classify("https://ex.com/news?p=2", "News", "", ledger);
        Verdict second = c.classify("https://ex.com/news?p=2", "News", "", ledger);
        assertEquals(first, second);
    }

    @Test
    void paginationKeys_caseInsensitive() {
        assertTrue(DuplicateClassifier.hasPaginationKey("https://ex.com/l?PageSize=10"));
        assertTrue(DuplicateClassifier.hasPaginationKey("https://ex.com/l?x=1&pn=4"));
        assertFalse(DuplicateClassifier.hasPaginationKey("https://ex.com/l?id=4"));
        assertThat(DuplicateClassifier.PAGINATION_KEYS).contains("start", "count", "limit");
    }
}
