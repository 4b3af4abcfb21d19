package com.sitepulse.core.http;

import com.sitepulse.core.api.ILinkVerifier;
import com.sitepulse.core.model.AuditConfig;
import com.sitepulse.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 외부 링크 도달 여부 검사.
 * HEAD → (403/404/405 또는 리다이렉트 과다) GET.
 * http:// 가 응답 없이 실패하면 https:// 로 한 번 더, 결과는 원래 URL 기준. 끝내 실패하면 0.
 * 리다이렉트는 https → http 방향까지 모두 따라간다.
 */
public class ExternalLinkVerifier implements ILinkVerifier {
    private static final Logger LOG = LoggerFactory.getLogger(ExternalLinkVerifier.class);

    /** HEAD 를 제대로 처리하지 않는 서버가 흔히 돌려주는 상태 */
    static final Set<Integer> GET_FALLBACK_STATUSES = Set.of(403, 404, 405);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<Void> send(HttpRequest req) throws Exception;
    }

    private final Duration timeout;
    private final String userAgent;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public ExternalLinkVerifier(AuditConfig.LinkCheckCfg cfg) {
        Objects.requireNonNull(cfg, "cfg");
        this.timeout = cfg.getTimeout();
        this.userAgent = cfg.getUserAgent();
        this.client = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.ALWAYS)
                .connectTimeout(cfg.getTimeout())
                .build();
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public ExternalLinkVerifier(AuditConfig.LinkCheckCfg cfg, HttpSender testSender) {
        Objects.requireNonNull(cfg, "cfg");
        this.timeout = cfg.getTimeout();
        this.userAgent = cfg.getUserAgent();
        this.client = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    /** 프로덕션 클라이언트의 리다이렉트 정책 (송신 훅 사용 시 null) */
    HttpClient.Redirect redirectPolicy() {
        return client == null ? null : client.followRedirects();
    }

    @Override
    public int checkLink(String url) {
        Objects.requireNonNull(url, "url");
        LinkCheckOutcome first = attempt(url);
        if (first.isResponse()) return first.status();
        LOG.debug("link check failed for {}: {} {}", url, first.kind(), first.detail());

        Optional<String> https = UrlUtils.upgradeToHttps(url);
        if (https.isPresent()) {
            LOG.debug("retrying {} as {}", url, https.get());
            LinkCheckOutcome second = attempt(https.get());
            if (second.isResponse()) return second.status(); // 원래 http URL 로 보고
            LOG.debug("https retry also failed for {}: {} {}", https.get(), second.kind(), second.detail());
        }
        return 0;
    }

    /** HEAD 후 필요하면 GET */
    LinkCheckOutcome attempt(String url) {
        LinkCheckOutcome head = send(url, "HEAD");
        if (head.isResponse() && GET_FALLBACK_STATUSES.contains(head.status())) {
            LOG.debug("HEAD {} returned {}, falling back to GET", url, head.status());
            return send(url, "GET");
        }
        if (head.kind() == LinkCheckOutcome.Kind.TOO_MANY_REDIRECTS) {
            LOG.debug("HEAD {} caused too many redirects, falling back to GET", url);
            return send(url, "GET");
        }
        return head;
    }

    private LinkCheckOutcome send(String url, String method) {
        HttpRequest req;
        try {
            req = HttpRequest.newBuilder(UrlUtils.toRequestUri(url))
                    .timeout(timeout)
                    .header("User-Agent", userAgent)
                    .method(method, HttpRequest.BodyPublishers.noBody())
                    .build();
        } catch (URISyntaxException | IllegalArgumentException e) {
            // 호스트 없음, 비 http 스킴 등 요청 자체를 만들 수 없는 URL
            return LinkCheckOutcome.connectionError("invalid url: " + e.getMessage());
        }

        try {
            HttpResponse<Void> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.discarding());
            return LinkCheckOutcome.response(resp.statusCode());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return LinkCheckOutcome.connectionError("interrupted");
        } catch (IOException e) {
            if (isTooManyRedirects(e)) return LinkCheckOutcome.tooManyRedirects(e.getMessage());
            return LinkCheckOutcome.connectionError(e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (Exception e) {
            return LinkCheckOutcome.connectionError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    static boolean isTooManyRedirects(IOException e) {
        String m = e.getMessage();
        return m != null && m.toLowerCase(Locale.ROOT).contains("redirect");
    }
}
