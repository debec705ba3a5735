// file: src/main/java/io/gitty/core/FileTarget.java
package io.gitty.core;

import java.util.Objects;

/**
 * A collectible placed at the puzzle coordinate (branch, depth).
 * <p>
 * A target becomes collected when a commit lands exactly on its coordinate.
 * Instances are immutable; collecting produces a new record.
 */
public record FileTarget(String id, String name, String branch, int depth, boolean collected) {
    public FileTarget {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(branch, "branch");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
    }

    public boolean isAt(String branchName, int commitDepth) {
        return branch.equals(branchName) && depth == commitDepth;
    }

    public FileTarget collect() { return collected ? this : new FileTarget(id, name, branch, depth, true); }

    public FileTarget reset() { return collected ? new FileTarget(id, name, branch, depth, false) : this; }
}
