package com.sitepulse.core.store;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemPageStoreTest {

    @TempDir Path tmp;

    @Test
    @DisplayName("같은 이름이면 _1, _2 를 붙이고 디렉터리는 필요할 때 만든다")
    void collisionsGetCounters() throws Exception {
        FileSystemPageStore store = new FileSystemPageStore();
        Path dir = tmp.resolve("Home_links");
        assertFalse(Files.exists(dir));

        String p1 = store.save("<p>1</p>", "공지", dir);
        String p2 = store.save("<p>2</p>", "공지", dir);
        String p3 = store.save("<p>3</p>", "공지", dir);

        assertEquals(dir.resolve("공지.html").toString(), p1);
        assertEquals(dir.resolve("공지_1.html").toString(), p2);
        assertEquals(dir.resolve("공지_2.html").toString(), p3);
        assertEquals("<p>2</p>", Files.readString(Path.of(p2), StandardCharsets.UTF_8));
    }

    @Test
    void sanitizesSuggestedName() throws Exception {
        String p = new FileSystemPageStore().save("x", "a/b?c", tmp);
        assertEquals(tmp.resolve("a_b_c.html").toString(), p);
    }

    @Test
    void readBack() throws Exception {
        FileSystemPageStore store = new FileSystemPageStore();
        String p = store.save("본문 한글", "page", tmp);
        assertThat(store.read(p)).contains("본문 한글");
        assertThat(store.read(tmp.resolve("missing.html").toString())).isEmpty();
        assertThat(store.read("")).isEmpty();
        assertThat(store.read(null)).isEmpty();
        assertTrue(store.isPersistent());
    }

    @Test
    void discardingStoreWritesNothing() throws Exception {
        DiscardingPageStore store = new DiscardingPageStore();
        String p = store.save("<html/>", "Home", tmp.resolve("never"));
        assertEquals("[not saved] Home.html", p);
        assertFalse(Files.exists(tmp.resolve("never")));
        assertThat(store.read(p)).isEmpty();
        assertFalse(store.isPersistent());
    }
}
