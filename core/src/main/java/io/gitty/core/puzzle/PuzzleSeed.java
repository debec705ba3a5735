// file: src/main/java/io/gitty/core/puzzle/PuzzleSeed.java
package io.gitty.core.puzzle;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;

/**
 * Deterministic 64-bit generation seeds.
 * <p>
 * The same date (or archive id) always yields the same seed, on every JVM,
 * so every player sees the same daily puzzle.
 */
public final class PuzzleSeed {

    private PuzzleSeed() {
        // utility
    }

    public static long forDate(LocalDate date) {
        return hash64("daily:" + date);
    }

    public static long forArchive(String archiveId) {
        return hash64("archive:" + archiveId);
    }

    /** Seed for retry number {@code attempt}; attempt 0 is the seed itself. */
    public static long advance(long seed, int attempt) {
        if (attempt == 0) return seed;
        long z = seed + attempt * 0x9E3779B97F4A7C15L;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    private static long hash64(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] h = md.digest(s.getBytes(StandardCharsets.UTF_8));
            // first 8 bytes, big-endian
            return ByteBuffer.wrap(h, 0, 8).order(ByteOrder.BIG_ENDIAN).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
