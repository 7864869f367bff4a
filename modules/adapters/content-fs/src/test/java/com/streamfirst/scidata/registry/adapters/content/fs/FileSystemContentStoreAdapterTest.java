package com.streamfirst.scidata.registry.adapters.content.fs;

import com.streamfirst.scidata.registry.domain.ContentReference;
import com.streamfirst.scidata.registry.domain.StorageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemContentStoreAdapterTest {

    // SHA-256 of "hello"
    private static final String HELLO_KEY = "2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824";

    @TempDir
    Path root;

    @Test
    void storesBlobsUnderTheirDigest() {
        FileSystemContentStoreAdapter store = new FileSystemContentStoreAdapter(root);

        ContentReference ref = store.put("hello".getBytes(StandardCharsets.UTF_8));

        assertThat(ref.key()).isEqualTo(HELLO_KEY);
        assertThat(root.resolve("2c").resolve(HELLO_KEY)).exists();
        assertThat(store.get(ref)).asString(StandardCharsets.UTF_8).isEqualTo("hello");
        assertThat(store.size(ref)).isEqualTo(5);
        assertThat(store.exists(ref)).isTrue();
    }

    @Test
    void identicalContentIsStoredOnce() throws IOException {
        FileSystemContentStoreAdapter store = new FileSystemContentStoreAdapter(root);

        ContentReference first = store.put("hello".getBytes(StandardCharsets.UTF_8));
        ContentReference second = store.put("hello".getBytes(StandardCharsets.UTF_8));

        assertThat(second).isEqualTo(first);
        try (var files = Files.list(root.resolve("2c"))) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    void blobsSurviveNewInstance() {
        ContentReference ref = new FileSystemContentStoreAdapter(root).put(new byte[] {1, 2, 3});

        assertThat(new FileSystemContentStoreAdapter(root).get(ref)).containsExactly(1, 2, 3);
    }

    @Test
    void missingOrForeignKeysAreReported() {
        FileSystemContentStoreAdapter store = new FileSystemContentStoreAdapter(root);
        ContentReference missing = new ContentReference("0".repeat(64));
        ContentReference foreign = new ContentReference("mem-123");

        assertThat(store.exists(missing)).isFalse();
        assertThat(store.exists(foreign)).isFalse();
        assertThatThrownBy(() -> store.get(missing))
            .isInstanceOf(StorageException.class)
            .hasMessageContaining("Blob not found");
        assertThatThrownBy(() -> store.size(foreign)).isInstanceOf(StorageException.class);
    }

    @Test
    void emptyBlobIsAllowed() {
        FileSystemContentStoreAdapter store = new FileSystemContentStoreAdapter(root);

        ContentReference ref = store.put(new byte[0]);

        assertThat(store.size(ref)).isZero();
        assertThat(store.get(ref)).isEmpty();
    }
}
