package com.sitepulse.core.crawler;

import com.sitepulse.core.api.IPageStore;
import com.sitepulse.core.dom.JsoupPageDom;
import com.sitepulse.core.model.PageRecord;
import com.sitepulse.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * new | exact_duplicate | pagination_variant | distinct 판정.
 *
 * <ol>
 *   <li>실제 URL 이 이미 기록 키 → 중복</li>
 *   <li>제목이 같은 첫 기록(삽입 순서)으로 판정하고 스캔 종료
 *     <ul>
 *       <li>경로 조각 수 같음: 페이지네이션 키 있으면 변형(비활성 시 중복), 없으면 distinct</li>
 *       <li>경로 조각 수 다름: 저장본 앞부분 텍스트 비교(같으면 중복, 다르거나 못 읽으면 distinct).
 *           저장을 안 하는 경우 정책값</li>
 *     </ul>
 *   </li>
 *   <li>제목 일치 없음 → new</li>
 * </ol>
 * 기록(ledger)은 읽기만 한다.
 */
public final class DuplicateClassifier {
    private static final Logger LOG = LoggerFactory.getLogger(DuplicateClassifier.class);

    static final Set<String> PAGINATION_KEYS =
            Set.of("page", "pagesize", "offset", "limit", "start", "count", "p", "pn");

    private final DuplicatePolicy policy;
    private final IPageStore store;

    public DuplicateClassifier(DuplicatePolicy policy, IPageStore store) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.store = Objects.requireNonNull(store, "store");
    }

    public Verdict classify(String actualUrl, String title, String html, Map<String, PageRecord> ledger) {
        if (ledger.containsKey(actualUrl)) {
            return Verdict.duplicate(actualUrl, "url already recorded");
        }

        for (Map.Entry<String, PageRecord> e : ledger.entrySet()) {
            if (!Objects.equals(e.getValue().title(), title)) continue;
            String existingUrl = e.getKey();

            int cur = UrlUtils.pathSegmentCount(actualUrl);
            int old = UrlUtils.pathSegmentCount(existingUrl);

            if (cur == old) {
                if (hasPaginationKey(actualUrl)) {
                    LOG.debug("pagination variant {} of {} (enabled={})", actualUrl, existingUrl, policy.isPaginationEnabled());
                    return policy.isPaginationEnabled()
                            ? Verdict.pagination(existingUrl)
                            : Verdict.paginationSkipped(existingUrl);
                }
                return Verdict.distinct(existingUrl, "same title, no pagination parameters");
            }

            // 경로 깊이가 다른 동일 제목: /index.html vs / 같은 경우
            if (!store.isPersistent()) {
                return policy.isAssumeDuplicateWhenUncomparable()
                        ? Verdict.duplicate(existingUrl, "same title, content not comparable")
                        : Verdict.distinct(existingUrl, "same title, content not comparable");
            }
            Optional<String> saved = store.read(e.getValue().savedPath());
            if (saved.isEmpty()) {
                return Verdict.distinct(existingUrl, "saved copy unavailable");
            }
            boolean same = snippet(html).equals(snippet(saved.get()));
            LOG.debug("content comparison {} vs {}: {}", actualUrl, existingUrl, same ? "identical" : "different");
            return same
                    ? Verdict.duplicate(existingUrl, "same title, identical content")
                    : Verdict.distinct(existingUrl, "same title, different content");
        }
        return Verdict.fresh();
    }

    static boolean hasPaginationKey(String url) {
        for (String k : UrlUtils.queryParamNames(url)) {
            if (PAGINATION_KEYS.contains(k)) return true;
        }
        return false;
    }

    /** script/style 제거 + 공백 정규화 후 앞 N자 */
    String snippet(String html) {
        if (html == null || html.isEmpty()) return "";
        String text = JsoupPageDom.parse(html, "").visibleText();
        return text.length() <= policy.getSnippetLength() ? text : text.substring(0, policy.getSnippetLength());
    }
}
