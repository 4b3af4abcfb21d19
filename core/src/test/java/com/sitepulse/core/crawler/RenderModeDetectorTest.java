package com.sitepulse.core.crawler;

import com.sitepulse.core.model.RenderMode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("RenderModeDetector: frameset > SPA > static")
class RenderModeDetectorTest {

    private final RenderModeDetector detector = new RenderModeDetector(Duration.ofMillis(100));

    @Test
    @DisplayName("frame[src] 는 절대 URL 로, src 없는 frame 은 무시")
    void frameset_resolvesFrameSources() {
        var page = new FakeRenderer.FakePage("https://gov.example/legacy/",
                "<html><frameset rows='50,*'><frame src='top.htm'><frame><frame src='/body.htm#x'></frameset></html>");

        RenderMode mode = detector.detect(page);

        assertEquals(RenderMode.Kind.FRAMESET, mode.kind());
        assertThat(mode.frameLinks())
                .containsExactly("https://gov.example/legacy/top.htm", "https://gov.example/body.htm");
        assertEquals(0, page.idleWaits);
    }

    @Test
    @DisplayName("브라우저 프로브가 프레임워크를 돌려주면 SPA + network idle 대기")
    void spa_fromProbe_waitsForIdle() {
        var page = new FakeRenderer.FakePage("https://ex.com/", 200, "<div id='app'></div>", "Vue", false);

        RenderMode mode = detector.detect(page);

        assertEquals(RenderMode.Kind.SPA, mode.kind());
        assertEquals("Vue", mode.framework());
        assertEquals(1, page.idleWaits);
    }

    @Test
    @DisplayName("스크립트 평가를 못 하면 DOM 표식(#__next)으로 React 판정")
    void spa_fromDomMarkers_whenProbeUnavailable() {
        var page = new FakeRenderer.FakePage("https://ex.com/", "<div id='__next'><p>hi</p></div>");

        RenderMode mode = detector.detect(page);

        assertEquals(RenderMode.Kind.SPA, mode.kind());
        assertEquals("React", mode.framework());
    }

    @Test
    @DisplayName("network idle 대기 초과는 치명적이지 않다")
    void spa_idleTimeout_isNotFatal() {
        var page = new FakeRenderer.FakePage("https://ex.com/", 200, "<app-root></app-root>", "Angular", true);

        RenderMode mode = detector.detect(page);

        assertEquals(RenderMode.Kind.SPA, mode.kind());
        assertEquals(1, page.idleWaits);
    }

    @Test
    void plainPage_isStatic() {
        var page = new FakeRenderer.FakePage("https://ex.com/", 200, "<p>hello</p>", "Static", false);

        assertEquals(RenderMode.Kind.STATIC, detector.detect(page).kind());
        assertEquals(0, page.idleWaits);
    }
}
