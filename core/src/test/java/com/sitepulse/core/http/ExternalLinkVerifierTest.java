package com.sitepulse.core.http;

import com.sitepulse.core.model.AuditConfig;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLSession;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("ExternalLinkVerifier: HEAD→GET, https 재시도, 도달 불가 = 0")
class ExternalLinkVerifierTest {

    /** 상태코드만 의미 있는 응답 */
    static final class Resp implements HttpResponse<Void> {
        private final int code;
        private final HttpRequest req;
        Resp(int code, HttpRequest req) { this.code = code; this.req = req; }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return req; }
        @Override public Optional<HttpResponse<Void>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(Map.of(), (a, b) -> true); }
        @Override public Void body() { return null; }
        @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return req.uri(); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    /** "METHOD url" 를 기록하고 handler 결과로 응답 (null 이면 연결 실패) */
    private static ExternalLinkVerifier verifier(List<String> log, Function<HttpRequest, Object> handler) {
        AuditConfig.LinkCheckCfg cfg = new AuditConfig.LinkCheckCfg().setTimeout(Duration.ofSeconds(2));
        return new ExternalLinkVerifier(cfg, req -> {
            log.add(req.method() + " " + req.uri());
            Object r = handler.apply(req);
            if (r instanceof Integer code) return new Resp(code, req);
            if (r instanceof IOException io) throw io;
            throw new IOException("Connection refused");
        });
    }

    @Test
    @DisplayName("HEAD 200 이면 GET 하지 않는다")
    void head200_noGet() {
        List<String> log = new ArrayList<>();
        assertEquals(200, verifier(log, r -> 200).checkLink("https://ok.example/"));
        assertThat(log).containsExactly("HEAD https://ok.example/");
    }

    @Test
    @DisplayName("HEAD 404/405/403 이면 GET 으로 다시")
    void headRejected_fallsBackToGet() {
        List<String> log = new ArrayList<>();
        var v = verifier(log, r -> r.method().equals("HEAD") ? 405 : 200);
        assertEquals(200, v.checkLink("https://nohead.example/x"));
        assertThat(log).containsExactly("HEAD https://nohead.example/x", "GET https://nohead.example/x");

        List<String> log2 = new ArrayList<>();
        assertEquals(404, verifier(log2, r -> 404).checkLink("https://gone.example/"));
        assertThat(log2).hasSize(2);
    }

    @Test
    @DisplayName("HEAD 리다이렉트 과다면 GET 으로 다시")
    void tooManyRedirects_fallsBackToGet() {
        List<String> log = new ArrayList<>();
        var v = verifier(log, r -> r.method().equals("HEAD") ? new IOException("too many redirects") : 200);
        assertEquals(200, v.checkLink("https://loop.example/"));
        assertThat(log).containsExactly("HEAD https://loop.example/", "GET https://loop.example/");
    }

    @Test
    @DisplayName("http 연결 실패면 https 로 재시도하고 그 상태를 보고")
    void httpFailure_retriesHttps() {
        List<String> log = new ArrayList<>();
        var v = verifier(log, r -> r.uri().getScheme().equals("https") ? 301 : null);
        assertEquals(301, v.checkLink("http://secure.example/a"));
        assertThat(log).containsExactly("HEAD http://secure.example/a", "HEAD https://secure.example/a");
    }

    @Test
    @DisplayName("모두 실패하면 0, 5xx 같은 HTTP 응답은 그대로")
    void unreachable_isZero() {
        assertEquals(0, verifier(new ArrayList<>(), r -> null).checkLink("http://down.example/"));
        assertEquals(0, verifier(new ArrayList<>(), r -> null).checkLink("https://down.example/"));
        assertEquals(503, verifier(new ArrayList<>(), r -> 503).checkLink("http://busy.example/"));
    }

    @Test
    @DisplayName("요청을 만들 수 없는 URL 은 0")
    void invalidUrl_isZero() {
        List<String> log = new ArrayList<>();
        assertEquals(0, verifier(log, r -> 200).checkLink("https://bad host.example/"));
        assertThat(log).isEmpty();
    }

    @Test
    @DisplayName("경로/쿼리의 공백은 인용해서 요청한다")
    void spaceInPath_isQuoted() {
        List<String> log = new ArrayList<>();
        assertEquals(200, verifier(log, r -> 200).checkLink("http://other.org/files/a b.pdf"));
        assertThat(log).containsExactly("HEAD http://other.org/files/a%20b.pdf");

        List<String> log2 = new ArrayList<>();
        assertEquals(200, verifier(log2, r -> 200).checkLink("https://other.org/q?name=a b"));
        assertThat(log2).containsExactly("HEAD https://other.org/q?name=a%20b");
    }

    @Test
    @DisplayName("https → http 리다이렉트도 따라간다")
    void redirectPolicy_followsDowngrade() {
        var v = new ExternalLinkVerifier(new AuditConfig.LinkCheckCfg());
        assertEquals(HttpClient.Redirect.ALWAYS, v.redirectPolicy());
    }

    @Test
    @DisplayName("실제 HTTP 서버: HEAD 405 → GET 200, User-Agent 전송")
    void endToEnd_headNotAllowed() throws Exception {
        List<String> seen = new CopyOnWriteArrayList<>();
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/page", ex -> {
            seen.add(ex.getRequestMethod() + " " + ex.getRequestHeaders().getFirst("User-Agent"));
            int code = "HEAD".equals(ex.getRequestMethod()) ? 405 : 200;
            ex.sendResponseHeaders(code, -1);
            ex.close();
        });
        server.start();
        try {
            AuditConfig.LinkCheckCfg cfg = new AuditConfig.LinkCheckCfg()
                    .setTimeout(Duration.ofSeconds(5))
                    .setUserAgent("SitePulseTest/1.0");
            var v = new ExternalLinkVerifier(cfg);
            int port = server.getAddress().getPort();

            assertEquals(200, v.checkLink("http://127.0.0.1:" + port + "/page"));
            assertThat(seen).containsExactly("HEAD SitePulseTest/1.0", "GET SitePulseTest/1.0");
            assertEquals(404, v.checkLink("http://127.0.0.1:" + port + "/missing"));
        } finally {
            server.stop(0);
        }
    }

    @Test
    void redirectMessageDetection() {
        assertThat(ExternalLinkVerifier.isTooManyRedirects(new IOException("Too many redirects: 6"))).isTrue();
        assertThat(ExternalLinkVerifier.isTooManyRedirects(new IOException("Connection reset"))).isFalse();
        assertThat(ExternalLinkVerifier.isTooManyRedirects(new IOException((String) null))).isFalse();
    }

}
