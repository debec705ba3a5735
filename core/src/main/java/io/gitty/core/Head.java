// file: src/main/java/io/gitty/core/Head.java
package io.gitty.core;

import java.util.Objects;

/**
 * The player's current position.
 * <p>
 *  - Attached: HEAD follows a branch; commits advance that branch.
 *  - Detached: HEAD sits on a raw commit; commits advance HEAD only.
 */
public interface Head {

    /** Branch name when attached, commit id when detached. */
    String ref();

    boolean isDetached();

    static Head attached(String branchName) { return new Attached(branchName); }

    static Head detached(String commitId) { return new Detached(commitId); }

    record Attached(String branchName) implements Head {
        public Attached {
            Objects.requireNonNull(branchName, "branchName");
        }

        @Override public String ref() { return branchName; }

        @Override public boolean isDetached() { return false; }
    }

    record Detached(String commitId) implements Head {
        public Detached {
            Objects.requireNonNull(commitId, "commitId");
        }

        @Override public String ref() { return commitId; }

        @Override public boolean isDetached() { return true; }
    }
}
