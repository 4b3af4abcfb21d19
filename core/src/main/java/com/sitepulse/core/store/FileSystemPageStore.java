package com.sitepulse.core.store;

import com.sitepulse.core.api.IPageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;

/** 디스크 보관소: UTF-8, 이름 충돌 시 _1, _2 ... */
public final class FileSystemPageStore implements IPageStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileSystemPageStore.class);

    @Override
    public String save(String content, String suggestedName, Path directory) throws IOException {
        Objects.requireNonNull(directory, "directory");
        Files.createDirectories(directory);

        String base = FileNames.fileName(suggestedName);
        String name = base;
        int counter = 1;
        while (true) {
            Path target = directory.resolve(name);
            try {
                // CREATE_NEW: 존재 검사와 생성을 한 번에
                Files.writeString(target, content == null ? "" : content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                LOG.debug("saved {}", target);
                return target.toString();
            } catch (FileAlreadyExistsException e) {
                name = FileNames.withCounter(base, counter++);
            }
        }
    }

    @Override
    public Optional<String> read(String storedPath) {
        if (storedPath == null || storedPath.isEmpty()) return Optional.empty();
        Path p = Path.of(storedPath);
        if (!Files.isRegularFile(p)) return Optional.empty();
        try {
            return Optional.of(Files.readString(p, StandardCharsets.UTF_8));
        } catch (IOException e) {
            LOG.warn("cannot read saved page {}: {}", storedPath, e.getMessage());
            return Optional.empty();
        }
    }

    @Override public boolean isPersistent() { return true; }
}
