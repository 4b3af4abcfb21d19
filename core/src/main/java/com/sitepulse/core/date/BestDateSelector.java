package com.sitepulse.core.date;

import com.sitepulse.core.model.DateSentinels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 여러 후보 중 "마지막 수정일" 하나 고르기.
 * <ol>
 *   <li>후보 없음 → [no date]</li>
 *   <li>후보 1개 → 그대로 (형식 검사 없음)</li>
 *   <li>여러 개 → 오늘 이후(오늘 포함) 제외 후 최댓값. 남는 게 없으면 오늘과 가장 가까운 날짜</li>
 * </ol>
 */
public final class BestDateSelector {
    private static final Logger LOG = LoggerFactory.getLogger(BestDateSelector.class);
    private static final Pattern ISO = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

    private final Clock clock;

    public BestDateSelector(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String select(List<String> dates) {
        if (dates == null || dates.isEmpty()) return DateSentinels.NO_DATE;
        if (dates.size() == 1) return dates.get(0);

        LocalDate today = LocalDate.now(clock);
        LocalDate best = null;
        String closest = null;
        long closestDiff = Long.MAX_VALUE;

        for (String s : dates) {
            if (!ISO.matcher(s).matches()) continue;
            LocalDate d;
            try {
                d = LocalDate.parse(s);
            } catch (DateTimeParseException e) {
                continue; // 2024-02-30 같은 값
            }
            long diff = Math.abs(ChronoUnit.DAYS.between(today, d));
            if (diff < closestDiff) {
                closestDiff = diff;
                closest = s;
            }
            if (!d.isBefore(today)) continue; // 미래 + 오늘 제외
            if (best == null || d.isAfter(best)) best = d;
        }

        if (best == null) {
            return closest != null ? closest : DateSentinels.NO_DATE;
        }
        LOG.debug("best date {} out of {}", best, dates);
        return best.toString();
    }
}
