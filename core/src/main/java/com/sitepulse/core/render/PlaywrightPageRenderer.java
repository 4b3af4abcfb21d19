package com.sitepulse.core.render;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import com.sitepulse.core.api.IPageRenderer;
import com.sitepulse.core.api.NavigationException;
import com.sitepulse.core.api.RenderWaitTimeoutException;
import com.sitepulse.core.api.RenderedPage;
import com.sitepulse.core.model.AuditConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Chromium(Playwright) 기반 렌더러.
 * Playwright 객체는 스레드 안전하지 않으므로 사이트 크롤 스레드마다 하나씩 만들고 닫는다.
 */
public final class PlaywrightPageRenderer implements IPageRenderer {
    private static final Logger LOG = LoggerFactory.getLogger(PlaywrightPageRenderer.class);

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;

    public PlaywrightPageRenderer(AuditConfig.RendererCfg cfg, String userAgent) {
        Objects.requireNonNull(cfg, "cfg");
        this.playwright = Playwright.create();
        try {
            this.browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(cfg.isHeadless()));
            Browser.NewContextOptions opts = new Browser.NewContextOptions().setAcceptDownloads(false);
            if (userAgent != null && !userAgent.isBlank()) opts.setUserAgent(userAgent);
            this.context = browser.newContext(opts);
        } catch (PlaywrightException e) {
            playwright.close();
            throw e;
        }
    }

    @Override
    public RenderedPage navigate(String url, Duration timeout) throws NavigationException {
        Page page = context.newPage();
        try {
            Response resp = page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                    .setTimeout((double) timeout.toMillis()));
            // 같은 문서 내 이동 등 응답 객체가 없으면 200 취급
            int status = resp == null ? 200 : resp.status();
            return new PlaywrightRenderedPage(page, status);
        } catch (PlaywrightException e) {
            page.close();
            throw new NavigationException(firstLine(e.getMessage()), 0, e);
        }
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } finally {
            playwright.close();
        }
    }

    static String firstLine(String msg) {
        if (msg == null) return "navigation failed";
        int nl = msg.indexOf('\n');
        return nl < 0 ? msg : msg.substring(0, nl);
    }

    /** 열린 탭 하나. close() 시 탭을 닫는다 */
    private static final class PlaywrightRenderedPage implements RenderedPage {
        private final Page page;
        private final int status;

        PlaywrightRenderedPage(Page page, int status) {
            this.page = page;
            this.status = status;
        }

        @Override public String finalUrl() { return page.url(); }
        @Override public int statusCode() { return status; }
        @Override public String content() { return page.content(); }

        @Override public Object evaluate(String script) {
            try {
                return page.evaluate(script);
            } catch (PlaywrightException e) {
                LOG.debug("evaluate failed on {}: {}", page.url(), firstLine(e.getMessage()));
                return null;
            }
        }

        @Override
        public void waitForNetworkIdle(Duration timeout) throws RenderWaitTimeoutException {
            try {
                page.waitForLoadState(LoadState.NETWORKIDLE,
                        new Page.WaitForLoadStateOptions().setTimeout((double) timeout.toMillis()));
            } catch (TimeoutError e) {
                throw new RenderWaitTimeoutException("network idle not reached in " + timeout.toMillis() + "ms", e);
            }
        }

        @Override
        public void close() {
            try {
                page.close();
            } catch (PlaywrightException e) {
                LOG.debug("page close failed: {}", firstLine(e.getMessage()));
            }
        }
    }
}
