package com.sitepulse.core.crawler;

import com.sitepulse.core.api.RenderWaitTimeoutException;
import com.sitepulse.core.api.RenderedPage;
import com.sitepulse.core.dom.JsoupPageDom;
import com.sitepulse.core.dom.PageDom;
import com.sitepulse.core.dom.PageElement;
import com.sitepulse.core.model.RenderMode;
import com.sitepulse.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * static | spa(framework) | frameset(frameLinks) 판정.
 * 1) frame[src] 가 있으면 frameset 2) 브라우저 전역/DOM 표식으로 SPA 판정 후 network idle 대기 3) 나머지 static
 */
public final class RenderModeDetector {
    private static final Logger LOG = LoggerFactory.getLogger(RenderModeDetector.class);

    static final String STATIC = "Static";

    /** 브라우저 컨텍스트에서 실행: 'React' | 'Vue' | 'Angular' | 'Static' */
    static final String FRAMEWORK_PROBE =
            "() => {\n"
          + "  if (window.React || window.__REACT_DEVTOOLS_GLOBAL_HOOK__ || document.querySelector('[data-reactroot], #__next')) return 'React';\n"
          + "  if (window.Vue || window.__VUE__ || document.querySelector('[data-v-app], #__nuxt')) return 'Vue';\n"
          + "  if (window.angular || document.querySelector('.ng-version, [ng-version], app-root')) return 'Angular';\n"
          + "  return 'Static';\n"
          + "}";

    private final Duration settleTimeout;

    public RenderModeDetector(Duration settleTimeout) {
        this.settleTimeout = Objects.requireNonNull(settleTimeout, "settleTimeout");
    }

    public RenderMode detect(RenderedPage page) {
        String pageUrl = page.finalUrl();
        PageDom dom = JsoupPageDom.parse(page.content(), pageUrl);

        // ---- 1) frameset ----
        List<PageElement> frames = dom.select("frame");
        if (!frames.isEmpty()) {
            List<String> links = new ArrayList<>();
            for (PageElement f : frames) {
                String src = f.attr("src");
                if (src.isEmpty()) continue;
                try {
                    links.add(UrlUtils.resolve(pageUrl, src));
                } catch (MalformedURLException | IllegalArgumentException e) {
                    LOG.debug("frame src not resolvable: {} ({})", src, e.getMessage());
                }
            }
            LOG.info("frameset detected on {} ({} frames)", pageUrl, links.size());
            return RenderMode.frameset(links);
        }

        // ---- 2) SPA ----
        String framework = probeFramework(page, dom);
        if (STATIC.equals(framework)) {
            LOG.debug("static page: {}", pageUrl);
            return RenderMode.staticPage();
        }

        LOG.info("{} application detected on {}, waiting for network idle", framework, pageUrl);
        try {
            page.waitForNetworkIdle(settleTimeout);
        } catch (RenderWaitTimeoutException e) {
            // 부분 렌더링 상태로 계속 진행
            LOG.info("{} network idle wait timed out on {}: {}", framework, pageUrl, e.getMessage());
        }
        return RenderMode.spa(framework);
    }

    /** 스크립트 평가가 안 되는 렌더러면 DOM 표식만으로 판정 */
    static String probeFramework(RenderedPage page, PageDom dom) {
        Object r = page.evaluate(FRAMEWORK_PROBE);
        if (r != null) return String.valueOf(r);

        if (!dom.select("[data-reactroot], #__next").isEmpty()) return "React";
        if (!dom.select("[data-v-app], #__nuxt").isEmpty()) return "Vue";
        if (!dom.select(".ng-version, [ng-version], app-root").isEmpty()) return "Angular";
        return STATIC;
    }
}
