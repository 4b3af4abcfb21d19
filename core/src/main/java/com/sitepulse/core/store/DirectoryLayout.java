package com.sitepulse.core.store;

import com.sitepulse.core.util.UrlUtils;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 페이지 저장 디렉터리 결정: 부모 페이지 디렉터리 아래 "<부모제목>_links".
 * 진입 페이지(부모 없음)는 사이트 루트. 저장을 안 하면 항상 사이트 루트.
 */
public final class DirectoryLayout {
    private final Path siteRoot;
    private final boolean nested;
    private final Map<String, Path> dirs = new HashMap<>();

    public DirectoryLayout(Path siteRoot, boolean nested) {
        this.siteRoot = Objects.requireNonNull(siteRoot, "siteRoot");
        this.nested = nested;
    }

    public Path siteRoot() { return siteRoot; }

    /**
     * @param titleOf 요청 URL → 기록된 제목(없으면 null)
     */
    public Path directoryFor(String url, String parentUrl, Function<String, String> titleOf) {
        if (!nested || parentUrl == null) return siteRoot;

        Path parentDir = dirs.getOrDefault(parentUrl, siteRoot);
        String parentTitle = titleOf.apply(parentUrl);
        if (parentTitle == null) {
            String seg = UrlUtils.lastSegment(UrlUtils.pathOf(parentUrl));
            parentTitle = seg.isEmpty() ? "page" : seg;
        }
        Path dir = parentDir.resolve(FileNames.directoryName(parentTitle));
        dirs.put(url, dir);
        return dir;
    }
}
