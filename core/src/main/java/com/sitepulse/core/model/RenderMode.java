package com.sitepulse.core.model;

import java.util.List;
import java.util.Objects;

/** 렌더 모드 판정 결과: static | spa(framework) | frameset(frameLinks) */
public final class RenderMode {
    public enum Kind { STATIC, SPA, FRAMESET }

    private static final RenderMode STATIC = new RenderMode(Kind.STATIC, null, List.of());

    private final Kind kind;
    private final String framework;
    private final List<String> frameLinks;

    private RenderMode(Kind kind, String framework, List<String> frameLinks) {
        this.kind = kind;
        this.framework = framework;
        this.frameLinks = List.copyOf(frameLinks);
    }

    public static RenderMode staticPage() { return STATIC; }

    public static RenderMode spa(String framework) {
        return new RenderMode(Kind.SPA, Objects.requireNonNull(framework, "framework"), List.of());
    }

    public static RenderMode frameset(List<String> frameLinks) {
        return new RenderMode(Kind.FRAMESET, null, frameLinks);
    }

    public Kind kind() { return kind; }
    public String framework() { return framework; }
    public List<String> frameLinks() { return frameLinks; }

    @Override public String toString() {
        switch (kind) {
            case SPA: return "spa(" + framework + ")";
            case FRAMESET: return "frameset(" + frameLinks.size() + ")";
            default: return "static";
        }
    }
}
