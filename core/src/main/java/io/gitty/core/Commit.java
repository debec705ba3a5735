// file: src/main/java/io/gitty/core/Commit.java
package io.gitty.core;

import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Immutable node of the puzzle commit graph.
 * <p>
 * Fields:
 *  - id:           opaque token, unique within one graph.
 *  - message:      free text, never inspected by the engine.
 *  - parentIds:    0 parents (root), 1 (normal commit) or 2 (merge commit).
 *                  Order matters: the first parent is the one rebase walks.
 *  - originBranch: branch the commit was created on, or {@link CommitGraph#DETACHED}.
 *  - depth:        puzzle coordinate, 0 for the root, max(parent depths) + 1 otherwise.
 *  - timestamp:    creation time in epoch millis, informational only.
 *  - fileIds:      file targets collected when this commit landed (sorted, distinct).
 * <p>
 * Because commits never change after creation, graph copies can share them.
 */
public record Commit(
        String id,
        String message,
        List<String> parentIds,
        String originBranch,
        int depth,
        long timestamp,
        List<String> fileIds
) {
    public Commit {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(parentIds, "parentIds");
        Objects.requireNonNull(originBranch, "originBranch");
        if (id.isBlank()) throw new IllegalArgumentException("commit id must not be blank");
        if (parentIds.size() > 2) throw new IllegalArgumentException("a commit has at most 2 parents");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
        message = message == null ? "" : message;
        parentIds = List.copyOf(parentIds);
        fileIds = fileIds == null ? List.of() : List.copyOf(new TreeSet<>(fileIds));
    }

    public boolean isRoot() { return parentIds.isEmpty(); }

    public boolean isMerge() { return parentIds.size() == 2; }

    /** First parent id, or null for the root. */
    public String firstParentId() { return parentIds.isEmpty() ? null : parentIds.get(0); }

    /** Abbreviated id as shown to players. */
    public String shortId() { return id.length() <= 7 ? id : id.substring(0, 7); }
}
