package com.sitepulse.core.date;

import com.sitepulse.core.dom.PageDom;
import com.sitepulse.core.dom.PageElement;
import com.sitepulse.core.model.DateCandidate;
import com.sitepulse.core.model.DateCandidate.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 페이지 DOM → 마지막 수정일(YYYY-MM-DD) 또는 [no date].
 *
 * 1) 공통 영역 제거 2) 본문 텍스트 노드에서 키워드 단계/일반 단계 매칭
 * 3) 키워드 단계가 하나라도 잡히면 일반 단계는 버림
 * 4) 일반 단계를 쓴 경우에만 meta 날짜 보충 5) BestDateSelector
 */
public final class DateExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(DateExtractor.class);

    static final List<String> META_KEYS = List.of(
            "og:article:modified_time", "og:modified_time", "article:modified_time",
            "og:article:published_time", "og:published_time", "article:published_time",
            "DC.date.modified", "dcterms.modified", "DC.Date", "dcterms.created",
            "DC.Coverage.t.min", "DC.Coverage.t.max");

    private final NoiseStripper stripper;
    private final BestDateSelector selector;

    public DateExtractor(Clock clock) {
        this(new NoiseStripper(), new BestDateSelector(clock));
    }

    public DateExtractor(NoiseStripper stripper, BestDateSelector selector) {
        this.stripper = Objects.requireNonNull(stripper, "stripper");
        this.selector = Objects.requireNonNull(selector, "selector");
    }

    public String extractLastUpdated(PageDom dom) {
        List<String> dates = new ArrayList<>();
        for (DateCandidate c : collectCandidates(dom)) dates.add(c.normalized());
        return selector.select(dates);
    }

    /** 중복 제거된 후보 목록 (발견 순서 유지) */
    public List<DateCandidate> collectCandidates(PageDom dom) {
        PageDom cleaned = stripper.strip(dom);
        PageElement scope = cleaned.body().orElse(cleaned.root());

        List<DateCandidate> keyword = new ArrayList<>();
        List<DateCandidate> generic = new ArrayList<>();
        for (String text : scope.textNodes()) {
            scan(text, DatePatterns.KEYWORD, Tier.KEYWORD, keyword);
            scan(text, DatePatterns.GENERIC, Tier.GENERIC, generic);
        }

        Set<String> seen = new LinkedHashSet<>();
        List<DateCandidate> out = new ArrayList<>();
        boolean usedGeneric = keyword.isEmpty();
        for (DateCandidate c : usedGeneric ? generic : keyword) {
            if (seen.add(c.normalized())) {
                out.add(c);
                LOG.debug("date candidate {} ({}, raw={})", c.normalized(), c.tier(), c.raw());
            }
        }

        // meta 는 원본 문서 기준
        if (usedGeneric) {
            for (String key : META_KEYS) {
                Optional<String> content = dom.metaContent(key);
                if (content.isEmpty()) continue;
                String raw = content.get().strip();
                metaDate(raw).ifPresent(d -> {
                    if (seen.add(d)) {
                        out.add(new DateCandidate(raw, d, Tier.META));
                        LOG.debug("date candidate {} (META {}, raw={})", d, key, raw);
                    }
                });
            }
        }
        return out;
    }

    private static void scan(String text, List<Pattern> patterns, Tier tier, List<DateCandidate> sink) {
        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                List<String> groups = new ArrayList<>(m.groupCount());
                for (int i = 1; i <= m.groupCount(); i++) groups.add(m.group(i));
                DateNormalizer.normalize(groups)
                        .ifPresent(d -> sink.add(new DateCandidate(m.group(), d, tier)));
            }
        }
    }

    /** "2024-03-15T10:00:00+08:00" 류: '-' 분리, 첫 조각 4자리 숫자 + 둘째 조각 숫자, 최대 3조각 */
    static Optional<String> metaDate(String content) {
        String[] parts = content.split("-", -1);
        if (parts.length < 2) return Optional.empty();
        if (parts[0].length() != 4 || !isDigits(parts[0]) || !isDigits(parts[1])) return Optional.empty();
        List<String> groups = new ArrayList<>(3);
        for (int i = 0; i < Math.min(3, parts.length); i++) groups.add(parts[i]);
        return DateNormalizer.normalize(groups);
    }

    private static boolean isDigits(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) if (!Character.isDigit(s.charAt(i))) return false;
        return true;
    }
}
