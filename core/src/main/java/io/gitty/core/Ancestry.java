// file: src/main/java/io/gitty/core/Ancestry.java
package io.gitty.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Ancestor walks shared by merge, rebase, the win check and the solver.
 * <p>
 * All walks are breadth-first over parent edges and tolerate dangling ids
 * (they are simply not expanded), so they never throw on a malformed graph.
 */
public final class Ancestry {

    private Ancestry() {
        // utility
    }

    /**
     * True iff {@code ancestorId} is reachable from {@code commitId} by following
     * parent edges (all of them, not only first parents). Reflexive.
     */
    public static boolean isAncestor(CommitGraph graph, String ancestorId, String commitId) {
        if (ancestorId == null || commitId == null) return false;
        if (ancestorId.equals(commitId)) return true;

        var visited = new HashSet<String>();
        var queue = new ArrayDeque<String>();
        queue.add(commitId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(ancestorId)) return true;
            if (!visited.add(current)) continue;
            Commit c = graph.commit(current);
            if (c != null) queue.addAll(c.parentIds());
        }
        return false;
    }

    /** {@code commitId} and everything reachable from it. Empty if the id is unknown. */
    public static Set<String> ancestorsOf(CommitGraph graph, String commitId) {
        var visited = new LinkedHashSet<String>();
        if (commitId == null || !graph.hasCommit(commitId)) return visited;

        var queue = new ArrayDeque<String>();
        queue.add(commitId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) continue;
            Commit c = graph.commit(current);
            if (c != null) queue.addAll(c.parentIds());
        }
        return visited;
    }

    /**
     * Commits a rebase of {@code fromTip} onto {@code ontoTip} must replay, oldest first.
     * <p>
     * Walks first-parent links back from {@code fromTip} and stops at the first
     * commit that is already an ancestor of {@code ontoTip} (the common point,
     * which includes {@code ontoTip} itself) or when the chain runs out.
     * Empty when {@code fromTip} is already contained in {@code ontoTip}.
     */
    public static List<Commit> commitsToReplay(CommitGraph graph, String fromTip, String ontoTip) {
        Set<String> ontoHistory = ancestorsOf(graph, ontoTip);
        var replay = new ArrayList<Commit>();
        var visited = new HashSet<String>();

        Commit current = graph.commit(fromTip);
        while (current != null && !ontoHistory.contains(current.id()) && visited.add(current.id())) {
            replay.add(current);
            String parent = current.firstParentId();
            current = parent == null ? null : graph.commit(parent);
        }
        Collections.reverse(replay);
        return replay;
    }

    /** File ids carried by a commit: its own plus those of every ancestor, sorted. */
    public static Set<String> carriedFiles(CommitGraph graph, String commitId) {
        var files = new TreeSet<String>();
        for (String id : ancestorsOf(graph, commitId)) {
            files.addAll(graph.commit(id).fileIds());
        }
        return files;
    }

    /**
     * Commits reachable from HEAD or any branch tip, in discovery order
     * (HEAD first, then branches in creation order).
     */
    public static Set<String> reachableFromRefs(CommitGraph graph) {
        var reachable = new LinkedHashSet<String>();
        Commit current = graph.currentCommit();
        if (current != null) reachable.addAll(ancestorsOf(graph, current.id()));
        for (Branch b : graph.branches().values()) {
            if (!reachable.contains(b.tipCommitId())) {
                reachable.addAll(ancestorsOf(graph, b.tipCommitId()));
            }
        }
        return reachable;
    }
}
