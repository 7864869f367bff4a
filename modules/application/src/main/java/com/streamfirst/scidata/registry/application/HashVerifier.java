package com.streamfirst.scidata.registry.application;

import com.streamfirst.scidata.registry.domain.ContentReference;
import com.streamfirst.scidata.registry.domain.FileEntry;
import com.streamfirst.scidata.registry.ports.ContentStorePort;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes and checks the payload digest of a dataset manifest.
 *
 * <p>The digest covers a canonical serialization of the entries: sorted by name, each entry
 * contributes its length-prefixed UTF-8 name, its 8-byte size and then its stored bytes. The
 * result is therefore independent of the order in which files were appended. Inline previews are
 * not part of the payload and are never hashed.
 *
 * <p>Never mutates anything; content is fetched from the content store on every call.
 */
@Slf4j
public class HashVerifier {

    public static final String DEFAULT_ALGORITHM = "SHA-256";

    private static final HexFormat HEX = HexFormat.of();

    private final ContentStorePort contentStore;

    @Getter
    private final String algorithm;

    public HashVerifier(ContentStorePort contentStore) {
        this(contentStore, DEFAULT_ALGORITHM);
    }

    public HashVerifier(@NonNull ContentStorePort contentStore, @NonNull String algorithm) {
        this.contentStore = contentStore;
        this.algorithm = algorithm;
        newDigest(); // fail fast on an unknown algorithm
    }

    /**
     * Outcome of checking a manifest against a claimed digest. When a single file is at fault
     * {@code fileName} names it and the expected/computed values are sizes; otherwise they are
     * the claimed and the computed digest.
     */
    public record Verification(boolean match, String fileName, String expected, String computed) {

        static Verification matched(String digest) {
            return new Verification(true, null, digest, digest);
        }

        static Verification digestMismatch(String claimed, String computed) {
            return new Verification(false, null, claimed, computed);
        }

        static Verification fileMismatch(String fileName, long declaredSize, long storedSize) {
            return new Verification(false, fileName,
                declaredSize + " bytes", storedSize + " bytes");
        }
    }

    /**
     * Computes the hex digest of the manifest.
     *
     * @param entries manifest entries in any order
     * @return lowercase hex digest
     */
    public String digest(List<FileEntry> entries) {
        MessageDigest md = newDigest();
        for (FileEntry entry : canonicalOrder(entries)) {
            update(md, entry.name(), fetch(entry.reference()));
        }
        return HEX.formatHex(md.digest());
    }

    /**
     * Computes the digest that {@link #digest} yields once the given contents are stored under
     * their names.
     *
     * @param contents file name to bytes, in any order
     * @return lowercase hex digest
     */
    public String digestOf(Map<String, byte[]> contents) {
        MessageDigest md = newDigest();
        new TreeMap<>(contents).forEach((name, content) -> update(md, name, content));
        return HEX.formatHex(md.digest());
    }

    /**
     * Checks every entry's stored size against its declared size and then the aggregate digest
     * against the claim. Comparison of digests ignores case.
     *
     * @param entries manifest entries in any order
     * @param claimedDigest the digest the uploader claims for the payload
     * @return match, or the first mismatch found
     */
    public Verification verify(List<FileEntry> entries, @NonNull String claimedDigest) {
        MessageDigest md = newDigest();
        for (FileEntry entry : canonicalOrder(entries)) {
            byte[] content = fetch(entry.reference());
            if (content.length != entry.size()) {
                log.warn("Stored size of '{}' is {} bytes, manifest declares {}",
                         entry.name(), content.length, entry.size());
                return Verification.fileMismatch(entry.name(), entry.size(), content.length);
            }
            update(md, entry.name(), content);
        }
        String computed = HEX.formatHex(md.digest());
        if (!computed.equalsIgnoreCase(claimedDigest.trim())) {
            log.debug("Digest mismatch over {} entries: claimed {}, computed {}",
                      entries.size(), claimedDigest, computed);
            return Verification.digestMismatch(claimedDigest, computed);
        }
        return Verification.matched(computed);
    }

    private static List<FileEntry> canonicalOrder(List<FileEntry> entries) {
        List<FileEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(FileEntry::name));
        return sorted;
    }

    private static void update(MessageDigest md, String fileName, byte[] content) {
        byte[] name = fileName.getBytes(StandardCharsets.UTF_8);
        md.update(ByteBuffer.allocate(Integer.BYTES).putInt(name.length).array());
        md.update(name);
        md.update(ByteBuffer.allocate(Long.BYTES).putLong(content.length).array());
        md.update(content);
    }

    private byte[] fetch(ContentReference reference) {
        return StorageCalls.call("read content " + reference, () -> contentStore.get(reference));
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalArgumentException("Unsupported digest algorithm: " + algorithm, e);
        }
    }
}
