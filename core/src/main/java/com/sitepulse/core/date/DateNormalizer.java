package com.sitepulse.core.date;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 정규식 그룹 → YYYY-MM-DD.
 * <ul>
 *   <li>숫자 3개: 마지막이 1900 이상이면 일-월-년, 아니면 년-월-일</li>
 *   <li>숫자 2개: 같은 규칙, 일은 01</li>
 *   <li>년 &lt; 200 은 민국년: 79 미만 거부, +1911</li>
 *   <li>서기 1990 미만 거부</li>
 * </ul>
 * 월/일 범위는 여기서 검증하지 않는다 (BestDateSelector 에서 파싱 실패로 걸러짐).
 */
public final class DateNormalizer {
    private DateNormalizer() {}

    static final int MIN_WESTERN_YEAR = 1990;
    static final int MIN_MINGUO_YEAR = 79;
    static final int MINGUO_OFFSET = 1911;
    private static final int MINGUO_CEILING = 200;
    private static final int TRAILING_YEAR_FLOOR = 1900;

    public static Optional<String> normalize(List<String> groups) {
        if (groups == null || groups.isEmpty()) return Optional.empty();

        List<Integer> nums = new ArrayList<>(3);
        for (String g : groups) {
            if (g == null || g.isEmpty() || !allDigits(g)) continue;
            try {
                nums.add(Integer.parseInt(g));
            } catch (NumberFormatException e) {
                return Optional.empty(); // 자릿수 과다
            }
        }

        int year, month, day;
        if (nums.size() == 3) {
            int a = nums.get(0), b = nums.get(1), c = nums.get(2);
            if (c >= TRAILING_YEAR_FLOOR) {
                day = a; month = b; year = c;
                if (year < MIN_WESTERN_YEAR) return Optional.empty();
            } else {
                year = a; month = b; day = c;
                Integer y = adjustYear(year);
                if (y == null) return Optional.empty();
                year = y;
            }
        } else if (nums.size() == 2) {
            int a = nums.get(0), b = nums.get(1);
            day = 1;
            if (b >= TRAILING_YEAR_FLOOR) {
                month = a; year = b;
                if (year < MIN_WESTERN_YEAR) return Optional.empty();
            } else {
                year = a; month = b;
                Integer y = adjustYear(year);
                if (y == null) return Optional.empty();
                year = y;
            }
        } else {
            return Optional.empty();
        }
        return Optional.of(String.format(Locale.ROOT, "%04d-%02d-%02d", year, month, day));
    }

    /** 민국년 보정 + 하한 검사. 거부면 null */
    private static Integer adjustYear(int year) {
        if (year < MINGUO_CEILING) {
            if (year < MIN_MINGUO_YEAR) return null;
            return year + MINGUO_OFFSET;
        }
        return year < MIN_WESTERN_YEAR ? null : year;
    }

    private static boolean allDigits(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }
}
