// file: src/main/java/io/gitty/core/solver/StateSignature.java
package io.gitty.core.solver;

import java.util.List;

/**
 * Canonical identity of a game position, independent of concrete commit ids.
 *
 * @param branches  "name=ordinal" pairs sorted by branch name
 * @param head      "A:branch" when attached, "D:ordinal" when detached
 * @param collected ids of collected files, sorted
 * @param shape     one entry per reachable commit in ordinal order:
 *                  depth, parent ordinals and carried file ids
 */
public record StateSignature(List<String> branches, String head, List<String> collected, List<String> shape) {
    public StateSignature {
        branches = List.copyOf(branches);
        collected = List.copyOf(collected);
        shape = List.copyOf(shape);
    }

    @Override
    public String toString() {
        return "branches=" + branches + " head=" + head + " collected=" + collected + " shape=" + shape;
    }
}
