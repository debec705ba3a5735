// file: src/main/java/io/gitty/core/game/CommandExecutor.java
package io.gitty.core.game;

import io.gitty.core.Ancestry;
import io.gitty.core.Branch;
import io.gitty.core.Commit;
import io.gitty.core.CommitGraph;
import io.gitty.core.FileTarget;
import io.gitty.core.Head;
import io.gitty.core.puzzle.Puzzle;
import io.gitty.core.puzzle.PuzzleConstraints;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Applies one command to a {@link GameState}.
 * <p>
 * Contract:
 *  - Never throws for a bad command; every call returns a {@link CommandResult}.
 *  - All checks (game over, whitelist, quotas, references, HEAD state) run
 *    before anything is mutated, so a rejected command leaves the state and
 *    every counter untouched.
 *  - On success: the pre-command snapshot is pushed on the undo stack (play
 *    mode only), counters move, file collection runs on every commit that
 *    landed, and the win predicate is evaluated.
 * <p>
 * Win predicate: every file collected, the branch this command advanced is the
 * trunk, and the trunk tip carries every file (its history contains the
 * commits that collected them). A file picked up on a side branch only counts
 * once that work reaches trunk through a merge or rebase.
 * <p>
 * Stateless apart from its clock; one instance may serve any number of sessions.
 */
public final class CommandExecutor {

    private final Clock clock;
    private final boolean recordUndo;

    public CommandExecutor(Clock clock, boolean recordUndo) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.recordUndo = recordUndo;
    }

    /** Interactive sessions: undo snapshots and history are recorded. */
    public static CommandExecutor forPlay(Clock clock) {
        return new CommandExecutor(clock, true);
    }

    /** Solver use: no undo snapshots, no history, fixed timestamps. */
    public static CommandExecutor forSearch() {
        return new CommandExecutor(Clock.fixed(Instant.EPOCH, ZoneOffset.UTC), false);
    }

    /** Apply any command, including {@code undo}. */
    public CommandResult apply(GameState state, Command command) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(command, "command");
        if (command.type() == CommandType.UNDO) {
            return undo(state);
        }

        CommandResult rejected = checkQuotas(state, command);
        if (rejected != null) return rejected;

        UndoSnapshot before = recordUndo ? state.snapshot(command.type()) : null;
        CommandResult result;
        if (command instanceof Command.CommitCommand c) {
            result = commit(state, c.message());
        } else if (command instanceof Command.BranchCommand b) {
            result = branch(state, b.name());
        } else if (command instanceof Command.CheckoutCommand c) {
            result = checkout(state, c.target());
        } else if (command instanceof Command.MergeCommand m) {
            result = merge(state, m.branch());
        } else if (command instanceof Command.RebaseCommand r) {
            result = rebase(state, r.onto());
        } else {
            throw new IllegalStateException("Unhandled command: " + command);
        }

        if (result.success()) {
            state.recordSuccess(command, before);
            if (result.gameWon()) state.markWon(clock.millis());
        }
        return result;
    }

    /**
     * Pop the latest snapshot and restore it verbatim. Gives the command slot
     * back, and the checkout slot too when the undone command was a checkout.
     * Undo itself never consumes quota.
     */
    public CommandResult undo(GameState state) {
        Objects.requireNonNull(state, "state");
        if (state.status().isTerminal()) {
            return CommandResult.failure(CommandError.STATE, "Game has ended");
        }
        if (!state.puzzle().constraints().allows(CommandType.UNDO)) {
            return CommandResult.failure(CommandError.VALIDATION, "Command 'undo' is not allowed in this puzzle");
        }
        UndoSnapshot snapshot = state.undoStack().pop();
        if (snapshot == null) {
            return CommandResult.failure(CommandError.STATE, "Nothing to undo");
        }
        state.restore(snapshot);
        return CommandResult.ok("Undid last " + snapshot.commandType().wireName(), state.graph(), List.of(), false);
    }

    // ---------- pre-checks ----------

    private CommandResult checkQuotas(GameState state, Command command) {
        PuzzleConstraints c = state.puzzle().constraints();
        CommandType type = command.type();

        if (state.status().isTerminal()) {
            return CommandResult.failure(CommandError.STATE, "Game has ended");
        }
        if (!c.allows(type)) {
            return CommandResult.failure(CommandError.VALIDATION,
                    "Command '" + type.wireName() + "' is not allowed in this puzzle");
        }
        if (state.commandsUsed() >= c.maxCommands()) {
            return CommandResult.failure(CommandError.VALIDATION,
                    "Maximum commands (" + c.maxCommands() + ") reached. Use undo or restart.");
        }
        switch (type) {
            case COMMIT -> {
                if (state.graph().commitCount() >= c.maxCommits()) {
                    return CommandResult.failure(CommandError.VALIDATION,
                            "Maximum commits (" + c.maxCommits() + ") reached");
                }
                if (state.consecutiveCommits() >= c.maxConsecutiveCommits()) {
                    return CommandResult.failure(CommandError.VALIDATION,
                            "Maximum consecutive commits (" + c.maxConsecutiveCommits() + ") reached");
                }
            }
            case CHECKOUT -> {
                if (state.checkoutsUsed() >= c.maxCheckouts()) {
                    return CommandResult.failure(CommandError.VALIDATION,
                            "Maximum checkouts (" + c.maxCheckouts() + ") reached");
                }
            }
            case BRANCH -> {
                if (state.graph().branches().size() >= c.maxBranches()) {
                    return CommandResult.failure(CommandError.VALIDATION,
                            "Maximum branches (" + c.maxBranches() + ") reached");
                }
            }
            default -> {
                // no command-specific quota
            }
        }
        return null;
    }

    // ---------- commands ----------

    private CommandResult commit(GameState state, String message) {
        CommitGraph g = state.graph();
        Commit current = g.currentCommit();
        if (current == null) {
            return CommandResult.failure(CommandError.STATE, "No current commit found");
        }
        Branch branch = g.currentBranch();
        String label = branch != null ? branch.name() : CommitGraph.DETACHED;
        int depth = current.depth() + 1;

        List<FileTarget> landed = state.uncollectedAt(label, depth);
        List<String> parents = List.of(current.id());
        String id = g.nextCommitId(parents);
        g.addCommit(new Commit(id, message, parents, label, depth, clock.millis(), idsOf(landed)));

        if (branch != null) {
            g.moveBranchTip(branch.name(), id);
        } else {
            g.setHead(Head.detached(id));
        }
        List<FileTarget> collected = state.markCollected(landed);
        boolean won = branch != null && isWin(state, branch.name());

        return CommandResult.ok("Created commit " + id.substring(0, 7) + ": " + message, g, collected, won);
    }

    private CommandResult branch(GameState state, String name) {
        if (name.isBlank()) {
            return CommandResult.failure(CommandError.VALIDATION, "Branch name is required");
        }
        Puzzle puzzle = state.puzzle();
        CommitGraph g = state.graph();
        if (!puzzle.branchNames().contains(name)) {
            return CommandResult.failure(CommandError.REFERENCE,
                    "Branch '" + name + "' is not part of this puzzle (available: "
                            + String.join(", ", puzzle.branchNames()) + ")");
        }
        if (g.hasBranch(name)) {
            return CommandResult.failure(CommandError.VALIDATION, "Branch '" + name + "' already exists");
        }
        Commit current = g.currentCommit();
        if (current == null) {
            return CommandResult.failure(CommandError.STATE, "No current commit found");
        }
        g.createBranch(name, current.id());
        return CommandResult.ok("Created branch '" + name + "'", g, List.of(), false);
    }

    private CommandResult checkout(GameState state, String target) {
        if (target.isBlank()) {
            return CommandResult.failure(CommandError.VALIDATION, "Checkout target is required");
        }
        CommitGraph g = state.graph();

        Branch branch = g.branch(target);
        if (branch != null) {
            g.setHead(Head.attached(target));
            Commit tip = g.commit(branch.tipCommitId());
            return CommandResult.ok("Switched to branch '" + target + "'\n  -> HEAD at "
                    + tip.shortId() + ": \"" + tip.message() + "\"", g, List.of(), false);
        }

        Commit commit = g.hasCommit(target) ? g.commit(target) : g.findByPrefix(target);
        if (commit != null) {
            g.setHead(Head.detached(commit.id()));
            return CommandResult.ok("HEAD is now at " + commit.shortId(), g, List.of(), false);
        }
        return CommandResult.failure(CommandError.REFERENCE,
                "pathspec '" + target + "' did not match any branch or commit");
    }

    private CommandResult merge(GameState state, String branchName) {
        if (branchName.isBlank()) {
            return CommandResult.failure(CommandError.VALIDATION, "Branch name is required");
        }
        CommitGraph g = state.graph();
        Branch current = g.currentBranch();
        if (current == null) {
            return CommandResult.failure(CommandError.STATE, "Cannot merge in detached HEAD state");
        }
        Branch target = g.branch(branchName);
        if (target == null) {
            return CommandResult.failure(CommandError.REFERENCE, "Branch '" + branchName + "' not found");
        }
        Commit currentTip = g.commit(current.tipCommitId());
        Commit targetTip = g.commit(target.tipCommitId());

        if (g.isAncestor(currentTip.id(), targetTip.id())) {
            g.moveBranchTip(current.name(), targetTip.id());
            boolean won = isWin(state, current.name());
            return CommandResult.ok("Fast-forward merge: " + current.name() + " -> " + branchName,
                    g, List.of(), won);
        }

        int depth = Math.max(currentTip.depth(), targetTip.depth()) + 1;
        List<FileTarget> landed = state.uncollectedAt(current.name(), depth);
        List<String> parents = List.of(currentTip.id(), targetTip.id());
        String id = g.nextCommitId(parents);
        g.addCommit(new Commit(id, "Merge branch '" + branchName + "' into " + current.name(),
                parents, current.name(), depth, clock.millis(), idsOf(landed)));
        g.moveBranchTip(current.name(), id);

        List<FileTarget> collected = state.markCollected(landed);
        boolean won = isWin(state, current.name());
        return CommandResult.ok("Merged '" + branchName + "' into '" + current.name() + "'", g, collected, won);
    }

    private CommandResult rebase(GameState state, String onto) {
        if (onto.isBlank()) {
            return CommandResult.failure(CommandError.VALIDATION, "Target branch is required");
        }
        CommitGraph g = state.graph();
        Branch current = g.currentBranch();
        if (current == null) {
            return CommandResult.failure(CommandError.STATE, "Cannot rebase in detached HEAD state");
        }
        Branch target = g.branch(onto);
        if (target == null) {
            return CommandResult.failure(CommandError.REFERENCE, "Branch '" + onto + "' not found");
        }

        List<Commit> replay = Ancestry.commitsToReplay(g, current.tipCommitId(), target.tipCommitId());
        if (replay.isEmpty()) {
            return CommandResult.ok("Already up to date", g, List.of(), isWin(state, current.name()));
        }

        // Each replayed commit lands at its new depth; collection uses those depths.
        var collected = new ArrayList<FileTarget>();
        Commit parent = g.commit(target.tipCommitId());
        for (Commit original : replay) {
            int depth = parent.depth() + 1;
            List<FileTarget> landed = state.uncollectedAt(current.name(), depth);
            Set<String> fileIds = new TreeSet<>(original.fileIds());
            fileIds.addAll(idsOf(landed));

            List<String> parents = List.of(parent.id());
            Commit replayed = new Commit(g.nextCommitId(parents), original.message(), parents,
                    current.name(), depth, clock.millis(), List.copyOf(fileIds));
            g.addCommit(replayed);
            collected.addAll(state.markCollected(landed));
            parent = replayed;
        }
        g.moveBranchTip(current.name(), parent.id());

        boolean won = isWin(state, current.name());
        return CommandResult.ok("Rebased '" + current.name() + "' onto '" + onto + "' ("
                + replay.size() + " commit" + (replay.size() == 1 ? "" : "s") + " replayed)", g, collected, won);
    }

    // ---------- helpers ----------

    private static boolean isWin(GameState state, String advancedBranch) {
        Puzzle puzzle = state.puzzle();
        if (!puzzle.trunkBranch().equals(advancedBranch) || !state.allFilesCollected()) {
            return false;
        }
        String trunkTip = state.graph().tipOf(puzzle.trunkBranch());
        Set<String> carried = Ancestry.carriedFiles(state.graph(), trunkTip);
        for (FileTarget f : state.files()) {
            if (!carried.contains(f.id())) return false;
        }
        return true;
    }

    private static List<String> idsOf(List<FileTarget> targets) {
        return targets.stream().map(FileTarget::id).toList();
    }
}
