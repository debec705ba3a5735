// file: src/main/java/io/gitty/core/Branch.java
package io.gitty.core;

import java.util.Objects;

/** Named pointer to a commit. Moving a branch means replacing its record. */
public record Branch(String name, String tipCommitId) {
    public Branch {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tipCommitId, "tipCommitId");
        if (name.isBlank()) throw new IllegalArgumentException("branch name must not be blank");
    }

    public Branch withTip(String commitId) { return new Branch(name, commitId); }
}
