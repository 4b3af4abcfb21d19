package com.sitepulse.core.store;

import com.sitepulse.core.api.IPageStore;

import java.nio.file.Path;
import java.util.Optional;

/** saveHtml=false 용: 아무것도 쓰지 않고 "[not saved] <제목>.html" 을 돌려준다 */
public final class DiscardingPageStore implements IPageStore {
    static final String NOT_SAVED_PREFIX = "[not saved] ";

    @Override
    public String save(String content, String suggestedName, Path directory) {
        return NOT_SAVED_PREFIX + suggestedName + ".html";
    }

    @Override public Optional<String> read(String storedPath) { return Optional.empty(); }

    @Override public boolean isPersistent() { return false; }
}
