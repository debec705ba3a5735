// file: src/main/java/io/gitty/core/CommitGraph.java
package io.gitty.core;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The puzzle's commit DAG plus branch pointers and HEAD.
 * <p>
 * Representation:
 *  - commits:  id -> Commit, insertion ordered (prefix lookups take the first match).
 *  - branches: name -> Branch, insertion ordered.
 *  - head:     Attached(branch) or Detached(commit).
 * <p>
 * Invariants (checked by {@link #validate()} and enforced by the mutators):
 *  - exactly one root commit, at depth 0;
 *  - every parent reference resolves; parents exist before their children,
 *    which makes the graph acyclic by construction;
 *  - depth of a non-root commit = max(parent depths) + 1;
 *  - every branch tip resolves; an attached HEAD names an existing branch.
 * <p>
 * Reads return live views. Copies are made only by {@link #copy()}, which the
 * undo stack and persistence call at their snapshot points. Commits are
 * immutable and shared between copies.
 * <p>
 * Not thread safe: a graph belongs to one session, which has a single writer.
 */
public final class CommitGraph {

    /** originBranch label for commits created with a detached HEAD. */
    public static final String DETACHED = "detached";

    private final Map<String, Commit> commits;
    private final Map<String, Branch> branches;
    private Head head;

    /**
     * Build a graph from existing parts (deserialization, tests).
     * Inputs are copied and the result is validated.
     */
    public CommitGraph(Collection<Commit> commits, Collection<Branch> branches, Head head) {
        this.commits = new LinkedHashMap<>();
        for (Commit c : commits) {
            if (this.commits.put(c.id(), c) != null) {
                throw new IllegalArgumentException("duplicate commit id " + c.id());
            }
        }
        this.branches = new LinkedHashMap<>();
        for (Branch b : branches) {
            if (this.branches.put(b.name(), b) != null) {
                throw new IllegalArgumentException("duplicate branch " + b.name());
            }
        }
        this.head = Objects.requireNonNull(head, "head");
        validate();
    }

    private CommitGraph(CommitGraph other) {
        this.commits = new LinkedHashMap<>(other.commits);
        this.branches = new LinkedHashMap<>(other.branches);
        this.head = other.head;
    }

    /**
     * A graph holding only a root commit, with {@code trunk} pointing at it and
     * HEAD attached to {@code trunk}.
     */
    public static CommitGraph withRoot(String trunk, long timestamp) {
        String rootId = CommitIds.derive(List.of(), 0, id -> false);
        Commit root = new Commit(rootId, "Initial commit", List.of(), trunk, 0, timestamp, List.of());
        return new CommitGraph(List.of(root), List.of(new Branch(trunk, rootId)), Head.attached(trunk));
    }

    /** Deep copy: new maps, shared immutable commits. */
    public CommitGraph copy() {
        return new CommitGraph(this);
    }

    // ---------- queries ----------

    public Commit commit(String id) { return commits.get(id); }

    public boolean hasCommit(String id) { return commits.containsKey(id); }

    /** Read-only view in insertion order. */
    public Map<String, Commit> commits() { return Collections.unmodifiableMap(commits); }

    public int commitCount() { return commits.size(); }

    public Branch branch(String name) { return branches.get(name); }

    public boolean hasBranch(String name) { return branches.containsKey(name); }

    /** Read-only view in creation order. */
    public Map<String, Branch> branches() { return Collections.unmodifiableMap(branches); }

    public Head head() { return head; }

    public boolean isDetached() { return head.isDetached(); }

    /** Commit HEAD resolves to, or null if it does not resolve. */
    public Commit currentCommit() {
        String id = head.isDetached() ? head.ref() : tipOf(head.ref());
        return id == null ? null : commits.get(id);
    }

    /** Branch HEAD is attached to, or null when detached. */
    public Branch currentBranch() {
        return head.isDetached() ? null : branches.get(head.ref());
    }

    public String tipOf(String branchName) {
        Branch b = branches.get(branchName);
        return b == null ? null : b.tipCommitId();
    }

    public Commit root() {
        for (Commit c : commits.values()) {
            if (c.isRoot()) return c;
        }
        return null;
    }

    /** First commit, in insertion order, whose id starts with {@code prefix}. */
    public Commit findByPrefix(String prefix) {
        if (prefix == null || prefix.isEmpty()) return null;
        for (Commit c : commits.values()) {
            if (c.id().startsWith(prefix)) return c;
        }
        return null;
    }

    /** True if {@code ancestorId} is reachable from {@code commitId} over parent edges (or equal). */
    public boolean isAncestor(String ancestorId, String commitId) {
        return Ancestry.isAncestor(this, ancestorId, commitId);
    }

    // ---------- mutators (used by the command executor) ----------

    /** Fresh deterministic id for a commit with the given parents. */
    public String nextCommitId(List<String> parentIds) {
        return CommitIds.derive(parentIds, commits.size(), commits::containsKey);
    }

    public void addCommit(Commit c) {
        Objects.requireNonNull(c, "commit");
        if (commits.containsKey(c.id())) {
            throw new IllegalArgumentException("commit " + c.id() + " already exists");
        }
        if (c.isRoot()) {
            throw new IllegalArgumentException("graph already has a root commit");
        }
        int maxParentDepth = -1;
        for (String p : c.parentIds()) {
            Commit parent = commits.get(p);
            if (parent == null) {
                throw new IllegalArgumentException("parent " + p + " of " + c.id() + " does not exist");
            }
            maxParentDepth = Math.max(maxParentDepth, parent.depth());
        }
        if (c.depth() != maxParentDepth + 1) {
            throw new IllegalArgumentException("commit " + c.id() + " has depth " + c.depth()
                    + ", expected " + (maxParentDepth + 1));
        }
        commits.put(c.id(), c);
    }

    public void createBranch(String name, String tipCommitId) {
        if (branches.containsKey(name)) {
            throw new IllegalArgumentException("branch " + name + " already exists");
        }
        requireCommit(tipCommitId);
        branches.put(name, new Branch(name, tipCommitId));
    }

    public void moveBranchTip(String name, String tipCommitId) {
        Branch b = branches.get(name);
        if (b == null) throw new IllegalArgumentException("unknown branch " + name);
        requireCommit(tipCommitId);
        branches.put(name, b.withTip(tipCommitId));
    }

    public void setHead(Head newHead) {
        Objects.requireNonNull(newHead, "head");
        if (newHead.isDetached()) {
            requireCommit(newHead.ref());
        } else if (!branches.containsKey(newHead.ref())) {
            throw new IllegalArgumentException("unknown branch " + newHead.ref());
        }
        this.head = newHead;
    }

    private void requireCommit(String id) {
        if (!commits.containsKey(id)) throw new IllegalArgumentException("unknown commit " + id);
    }

    // ---------- invariants ----------

    /**
     * Check every structural invariant.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void validate() {
        int roots = 0;
        // Insertion order doubles as creation order: parents must come first.
        var seen = new LinkedHashMap<String, Commit>();
        for (Commit c : commits.values()) {
            if (c.isRoot()) {
                roots++;
                if (c.depth() != 0) throw new IllegalStateException("root " + c.id() + " must have depth 0");
            } else {
                int maxParentDepth = -1;
                for (String p : c.parentIds()) {
                    Commit parent = seen.get(p);
                    if (parent == null) {
                        throw new IllegalStateException("parent " + p + " of " + c.id() + " is missing or created later");
                    }
                    maxParentDepth = Math.max(maxParentDepth, parent.depth());
                }
                if (c.depth() != maxParentDepth + 1) {
                    throw new IllegalStateException("commit " + c.id() + " has inconsistent depth " + c.depth());
                }
            }
            seen.put(c.id(), c);
        }
        if (roots != 1) throw new IllegalStateException("expected exactly one root commit, found " + roots);

        for (Branch b : branches.values()) {
            if (!commits.containsKey(b.tipCommitId())) {
                throw new IllegalStateException("branch " + b.name() + " points at missing commit " + b.tipCommitId());
            }
        }
        if (head.isDetached()) {
            if (!commits.containsKey(head.ref())) {
                throw new IllegalStateException("detached HEAD points at missing commit " + head.ref());
            }
        } else if (!branches.containsKey(head.ref())) {
            throw new IllegalStateException("HEAD attached to missing branch " + head.ref());
        }
    }

    @Override
    public String toString() {
        return "CommitGraph{commits=" + commits.size() + ", branches=" + branches.values() + ", head=" + head + "}";
    }
}
