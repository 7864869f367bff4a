package com.streamfirst.scidata.registry.adapters.content.fs;

import com.streamfirst.scidata.registry.domain.ContentReference;
import com.streamfirst.scidata.registry.domain.StorageException;
import com.streamfirst.scidata.registry.ports.ContentStorePort;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Content-addressed blob store on the local file system.
 *
 * <p>Blobs are keyed by the SHA-256 of their bytes and laid out as {@code root/ab/abcdef...}, so
 * identical content is stored once. Each write goes to a temporary file that is forced to disk and
 * then moved into place, which makes a blob durable and complete before {@link #put} returns.
 */
@Slf4j
public class FileSystemContentStoreAdapter implements ContentStorePort {

    private static final Pattern KEY = Pattern.compile("[0-9a-f]{64}");
    private static final HexFormat HEX = HexFormat.of();

    @Getter
    private final Path root;

    public FileSystemContentStoreAdapter(Path root) {
        this.root = root;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("Cannot create content directory " + root, e);
        }
        log.info("Content store rooted at {}", root);
    }

    @Override
    public ContentReference put(byte[] data) {
        ContentReference reference = new ContentReference(sha256(data));
        Path target = pathOf(reference);
        if (Files.exists(target)) {
            log.debug("Blob {} already stored", reference);
            return reference;
        }
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), reference.key(), ".tmp");
            try {
                try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                    ByteBuffer buffer = ByteBuffer.wrap(data);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            log.error("Failed to store blob {}", reference, e);
            throw new StorageException("Failed to store blob " + reference, e);
        }
        log.debug("Stored blob {} ({} bytes)", reference, data.length);
        return reference;
    }

    @Override
    public byte[] get(ContentReference reference) {
        try {
            return Files.readAllBytes(pathOf(reference));
        } catch (NoSuchFileException e) {
            throw new StorageException("Blob not found: " + reference, e);
        } catch (IOException e) {
            throw new StorageException("Failed to read blob " + reference, e);
        }
    }

    @Override
    public long size(ContentReference reference) {
        try {
            return Files.size(pathOf(reference));
        } catch (NoSuchFileException e) {
            throw new StorageException("Blob not found: " + reference, e);
        } catch (IOException e) {
            throw new StorageException("Failed to stat blob " + reference, e);
        }
    }

    @Override
    public boolean exists(ContentReference reference) {
        return KEY.matcher(reference.key()).matches() && Files.isRegularFile(pathOf(reference));
    }

    private Path pathOf(ContentReference reference) {
        String key = reference.key();
        if (!KEY.matcher(key).matches()) {
            throw new StorageException("Not a content key of this store: " + key);
        }
        return root.resolve(key.substring(0, 2)).resolve(key);
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            if (!Files.exists(target)) {
                Files.move(temp, target);
            }
        } catch (FileAlreadyExistsException e) {
            log.debug("Blob {} stored concurrently", target.getFileName());
        }
    }

    private static String sha256(byte[] data) {
        try {
            return HEX.formatHex(MessageDigest.getInstance("SHA-256").digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
