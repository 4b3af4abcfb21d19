package com.sitepulse.core.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/** 페이지 HTML 보관소 계약. */
public interface IPageStore {
    /**
     * content를 directory 아래 suggestedName 기반 파일명으로 저장하고 저장 경로를 돌려준다.
     * 같은 이름이 이미 있으면 _1, _2 ... 를 붙인다.
     */
    String save(String content, String suggestedName, Path directory) throws IOException;

    /** 저장본 읽기. 없거나 읽을 수 없으면 empty */
    Optional<String> read(String storedPath);

    /** 저장본 비교가 가능한 보관소인지 */
    boolean isPersistent();
}
