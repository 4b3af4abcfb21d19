package com.sitepulse.core.util;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 링크 해석 + 동일 사이트 판정 + 경로/쿼리 분해 유틸 (원문 문자열 기준) */
public final class UrlUtils {
    private UrlUtils(){}

    private static final String HTTP = "http://";
    private static final String HTTPS = "https://";
    private static final Pattern SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.\\-]*):");

    /** base 기준으로 href를 절대 URL로 해석하고 fragment를 제거한다. */
    public static String resolve(String base, String href) throws MalformedURLException {
        URL abs = new URL(new URL(base), href.trim());
        return stripFragment(abs.toString());
    }

    /**
     * 상대 참조이거나 http/https 로 시작하면 true.
     * line:, sms:, data: 처럼 다른 스킴은 웹 페이지 링크가 아니다.
     */
    public static boolean isWebReference(String href) {
        if (href == null) return false;
        Matcher m = SCHEME.matcher(href.trim());
        if (!m.find()) return true;
        String scheme = m.group(1).toLowerCase(Locale.ROOT);
        return scheme.equals("http") || scheme.equals("https");
    }

    /**
     * 요청용 URI. 경로/쿼리의 공백 등 URI 금지 문자는 구성 요소별 생성자가 인용한다.
     * fragment 는 버린다.
     */
    public static URI toRequestUri(String url) throws URISyntaxException {
        try {
            URL u = new URL(url);
            return new URI(u.getProtocol(), u.getUserInfo(), u.getHost(), u.getPort(),
                    u.getPath(), u.getQuery(), null);
        } catch (MalformedURLException e) {
            throw new URISyntaxException(url, e.getMessage());
        }
    }

    /** '#' 이후 제거 */
    public static String stripFragment(String url) {
        if (url == null) return null;
        int i = url.indexOf('#');
        return i < 0 ? url : url.substring(0, i);
    }

    /**
     * host[:port] (소문자). 파싱 실패 시 빈 문자열.
     * 동일 사이트 판정은 포트까지 포함한 authority 비교로 한다.
     */
    public static String authority(String url) {
        try {
            URL u = new URL(url);
            String host = u.getHost() == null ? "" : u.getHost().toLowerCase(Locale.ROOT);
            return u.getPort() < 0 ? host : host + ":" + u.getPort();
        } catch (MalformedURLException e) {
            return "";
        }
    }

    public static boolean sameSite(String a, String b) {
        String ha = authority(a);
        return !ha.isEmpty() && ha.equals(authority(b));
    }

    /** 비어있지 않은 경로 세그먼트 수. "/" → 0, "/a/b/" → 2 */
    public static int pathSegmentCount(String url) {
        String path = pathOf(url);
        int n = 0;
        for (String seg : path.split("/")) {
            if (!seg.isEmpty()) n++;
        }
        return n;
    }

    /** 값이 비어있지 않은 쿼리 파라미터 이름(소문자). */
    public static Set<String> queryParamNames(String url) {
        Set<String> out = new LinkedHashSet<>();
        String q = queryOf(url);
        if (q.isEmpty()) return out;
        for (String pair : q.split("&")) {
            int eq = pair.indexOf('=');
            if (eq <= 0 || eq == pair.length() - 1) continue; // 값 없는 키는 무시
            out.add(pair.substring(0, eq).toLowerCase(Locale.ROOT));
        }
        return out;
    }

    public static String pathOf(String url) {
        try {
            String p = new URL(url).getPath();
            return p == null ? "" : p;
        } catch (MalformedURLException e) {
            return "";
        }
    }

    public static String queryOf(String url) {
        try {
            String q = new URL(url).getQuery();
            return q == null ? "" : q;
        } catch (MalformedURLException e) {
            return "";
        }
    }

    /** 마지막 '/' 뒤 문자열(없으면 빈 문자열) */
    public static String lastSegment(String url) {
        if (url == null) return "";
        int i = url.lastIndexOf('/');
        return i < 0 ? url : url.substring(i + 1);
    }

    public static boolean isInsecure(String url) {
        return url != null && url.startsWith(HTTP);
    }

    /** http:// → https:// 변환. 대상이 아니면 empty. */
    public static Optional<String> upgradeToHttps(String url) {
        if (!isInsecure(url)) return Optional.empty();
        return Optional.of(HTTPS + url.substring(HTTP.length()));
    }
}
