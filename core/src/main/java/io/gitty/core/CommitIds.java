// file: src/main/java/io/gitty/core/CommitIds.java
package io.gitty.core;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.function.Predicate;

/**
 * Deterministic commit id derivation.
 * <p>
 * Ids look like abbreviated git hashes (8 lowercase hex chars) but are derived
 * from the parent ids and the commit's ordinal in its graph, not from content.
 * <p>
 * Properties:
 *  - Deterministic: replaying the same commands on the same initial graph
 *    reproduces the same ids, so a recorded solution may contain
 *    {@code checkout <id>} and still replay.
 *  - Unique per graph: on collision a salt is appended and the digest retried.
 */
public final class CommitIds {

    static final int LENGTH = 8;

    private CommitIds() {
        // utility
    }

    /**
     * Derive a fresh id.
     *
     * @param parentIds parents of the new commit, in order
     * @param ordinal   number of commits already in the graph
     * @param taken     true for ids already present in the graph
     */
    public static String derive(List<String> parentIds, int ordinal, Predicate<String> taken) {
        MessageDigest md = sha1();
        String base = String.join(",", parentIds) + "#" + ordinal;
        for (int salt = 0; ; salt++) {
            String seed = salt == 0 ? base : base + "~" + salt;
            md.reset();
            byte[] h = md.digest(seed.getBytes(StandardCharsets.UTF_8));
            String id = HexFormat.of().formatHex(h, 0, LENGTH / 2);
            if (!taken.test(id)) {
                return id;
            }
        }
    }

    private static MessageDigest sha1() {
        try {
            return MessageDigest.getInstance("SHA-1");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
