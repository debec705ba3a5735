// file: src/test/java/io/gitty/core/game/CommandExecutorTest.java
package io.gitty.core.game;

import io.gitty.core.Commit;
import io.gitty.core.CommitGraph;
import io.gitty.core.puzzle.Puzzle;
import io.gitty.core.puzzle.PuzzleConstraints;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static io.gitty.core.PuzzleFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class CommandExecutorTest {

    private final CommandExecutor executor = CommandExecutor.forPlay(CLOCK);

    private static PuzzleConstraints limits(int maxCommands, int maxCommits, int maxCheckouts,
                                            int maxConsecutive, int maxBranches) {
        return new PuzzleConstraints(maxCommands, maxCommits, maxCheckouts, maxConsecutive, maxBranches,
                EnumSet.allOf(CommandType.class));
    }

    // ---------- commit ----------

    @Test
    void commit_advances_attached_branch_and_collects_matching_file() {
        var state = start(puzzle(file("a", "main", 1), farFile()));
        String rootId = state.graph().root().id();

        var r = executor.apply(state, Command.commit("first"));

        assertTrue(r.success());
        Commit tip = state.graph().currentCommit();
        assertEquals(List.of(rootId), tip.parentIds());
        assertEquals(1, tip.depth());
        assertEquals("main", tip.originBranch());
        assertEquals(List.of("a"), tip.fileIds());
        assertEquals(tip.id(), state.graph().tipOf("main"));
        assertEquals(1, r.filesCollected().size());
        assertTrue(r.filesCollected().get(0).collected());
        assertEquals(1, state.commandsUsed());
        assertEquals(1, state.consecutiveCommits());
        assertFalse(r.gameWon());
    }

    @Test
    void commit_with_detached_head_moves_head_only() {
        var state = start(puzzle(file("a", "main", 1)));
        String rootId = state.graph().root().id();

        run(executor, state, Command.checkout(rootId));
        var r = executor.apply(state, Command.commit(""));

        assertTrue(r.success());
        Commit c = state.graph().currentCommit();
        assertEquals(CommitGraph.DETACHED, c.originBranch());
        assertEquals(Command.DEFAULT_COMMIT_MESSAGE, c.message());
        assertEquals(rootId, state.graph().tipOf("main"));
        assertTrue(state.graph().isDetached());
        // (detached, 1) is not (main, 1)
        assertTrue(r.filesCollected().isEmpty());
    }

    // ---------- branch / checkout ----------

    @Test
    void branch_must_be_declared_and_new() {
        var state = start(puzzle(farFile()));

        var undeclared = executor.apply(state, Command.branch("release"));
        assertEquals(CommandError.REFERENCE, undeclared.error());

        var existing = executor.apply(state, Command.branch("main"));
        assertEquals(CommandError.VALIDATION, existing.error());

        var blank = executor.apply(state, Command.branch(" "));
        assertEquals(CommandError.VALIDATION, blank.error());

        var ok = executor.apply(state, Command.branch("feature"));
        assertTrue(ok.success());
        assertEquals(state.graph().tipOf("main"), state.graph().tipOf("feature"));
        assertEquals("main", state.graph().head().ref());
        assertEquals(1, state.commandsUsed());
    }

    @Test
    void checkout_of_unknown_target_is_a_reference_error_and_changes_nothing() {
        var state = start(puzzle(farFile()));

        var r = executor.apply(state, Command.checkout("nonexistent"));

        assertFalse(r.success());
        assertEquals(CommandError.REFERENCE, r.error());
        assertEquals("pathspec 'nonexistent' did not match any branch or commit", r.message());
        assertEquals(0, state.commandsUsed());
        assertEquals(0, state.checkoutsUsed());
        assertTrue(state.undoStack().isEmpty());
    }

    @Test
    void checkout_resolves_branch_then_full_id_then_prefix() {
        var state = start(puzzle(farFile()));
        run(executor, state, Command.commit("c1"), Command.branch("feature"));
        String rootId = state.graph().root().id();

        run(executor, state, Command.checkout("feature"));
        assertEquals("feature", state.graph().head().ref());
        assertFalse(state.graph().isDetached());

        run(executor, state, Command.checkout(rootId));
        assertTrue(state.graph().isDetached());
        assertEquals(rootId, state.graph().head().ref());

        run(executor, state, Command.checkout("main"));
        run(executor, state, Command.checkout(rootId.substring(0, 4)));
        assertEquals(state.graph().findByPrefix(rootId.substring(0, 4)).id(), state.graph().head().ref());
        assertEquals(4, state.checkoutsUsed());
    }

    // ---------- merge ----------

    @Test
    void merge_while_detached_is_a_state_error() {
        var state = start(puzzle(farFile()));
        run(executor, state, Command.branch("feature"), Command.checkout(state.graph().root().id()));
        int commits = state.graph().commitCount();
        var head = state.graph().head();

        var r = executor.apply(state, Command.merge("feature"));

        assertEquals(CommandError.STATE, r.error());
        assertEquals(commits, state.graph().commitCount());
        assertEquals(head, state.graph().head());
        assertEquals(2, state.commandsUsed());
    }

    @Test
    void merge_of_unknown_branch_is_a_reference_error() {
        var state = start(puzzle(farFile()));
        assertEquals(CommandError.REFERENCE, executor.apply(state, Command.merge("feature")).error());
    }

    @Test
    void merge_fast_forwards_when_current_tip_is_an_ancestor() {
        var state = start(puzzle(farFile()));
        run(executor, state,
                Command.branch("feature"), Command.checkout("feature"), Command.commit("f1"),
                Command.checkout("main"));
        int before = state.graph().commitCount();

        var r = executor.apply(state, Command.merge("feature"));

        assertTrue(r.success());
        assertTrue(r.message().startsWith("Fast-forward"));
        assertEquals(before, state.graph().commitCount());
        assertEquals(state.graph().tipOf("feature"), state.graph().tipOf("main"));
    }

    @Test
    void merge_creates_two_parent_commit_at_max_depth_plus_one() {
        var state = start(puzzle(farFile()));
        run(executor, state,
                Command.branch("feature"), Command.commit("m1"), Command.commit("m2"),
                Command.checkout("feature"), Command.commit("f1"),
                Command.checkout("main"));
        String mainTip = state.graph().tipOf("main");
        String featureTip = state.graph().tipOf("feature");

        var r = executor.apply(state, Command.merge("feature"));

        assertTrue(r.success());
        Commit merge = state.graph().currentCommit();
        assertTrue(merge.isMerge());
        assertEquals(List.of(mainTip, featureTip), merge.parentIds());
        assertEquals(3, merge.depth());
        assertEquals("main", merge.originBranch());
        assertEquals(merge.id(), state.graph().tipOf("main"));
        assertEquals(featureTip, state.graph().tipOf("feature"));
        assertDoesNotThrow(state.graph()::validate);
    }

    // ---------- rebase ----------

    @Test
    void rebase_replays_commits_and_keeps_originals() {
        var state = start(puzzle(farFile()));
        run(executor, state,
                Command.branch("feature"), Command.checkout("feature"),
                Command.commit("f1"), Command.commit("f2"),
                Command.checkout("main"), Command.commit("m1"),
                Command.checkout("feature"));
        String oldTip = state.graph().tipOf("feature");
        String mainTip = state.graph().tipOf("main");
        int before = state.graph().commitCount();

        var r = executor.apply(state, Command.rebase("main"));

        assertTrue(r.success(), r.message());
        assertEquals(before + 2, state.graph().commitCount());
        assertTrue(state.graph().hasCommit(oldTip));

        Commit tip = state.graph().currentCommit();
        assertEquals("f2", tip.message());
        assertEquals(3, tip.depth());
        Commit replayedF1 = state.graph().commit(tip.firstParentId());
        assertEquals("f1", replayedF1.message());
        assertEquals(2, replayedF1.depth());
        assertEquals(mainTip, replayedF1.firstParentId());
        assertTrue(state.graph().isAncestor(mainTip, tip.id()));
        assertEquals(mainTip, state.graph().tipOf("main"));
        assertDoesNotThrow(state.graph()::validate);
    }

    @Test
    void rebase_with_nothing_to_replay_is_already_up_to_date() {
        var state = start(puzzle(farFile()));
        run(executor, state, Command.branch("feature"), Command.checkout("feature"));
        int before = state.graph().commitCount();

        var r = executor.apply(state, Command.rebase("main"));

        assertTrue(r.success());
        assertEquals("Already up to date", r.message());
        assertEquals(before, state.graph().commitCount());
        assertFalse(r.gameWon());
        assertEquals(3, state.commandsUsed());
    }

    @Test
    void rebase_collects_at_replayed_depths_and_trunk_must_catch_up_to_win() {
        var state = start(puzzle(file("deep", "feature", 3)));
        run(executor, state,
                Command.branch("feature"), Command.checkout("feature"),
                Command.commit("f1"), Command.commit("f2"),
                Command.checkout("main"), Command.commit("m1"),
                Command.checkout("feature"));
        assertFalse(state.allFilesCollected());

        var rebased = executor.apply(state, Command.rebase("main"));

        assertTrue(rebased.success());
        assertEquals(1, rebased.filesCollected().size());
        assertTrue(state.allFilesCollected());
        assertFalse(rebased.gameWon(), "feature advanced, not trunk");
        assertEquals(List.of("deep"), state.graph().currentCommit().fileIds());

        run(executor, state, Command.checkout("main"));
        var merged = executor.apply(state, Command.merge("feature"));
        assertTrue(merged.gameWon());
        assertEquals(GameStatus.WON, state.status());
    }

    @Test
    void rebase_while_detached_is_a_state_error() {
        var state = start(puzzle(farFile()));
        run(executor, state, Command.checkout(state.graph().root().id()));
        assertEquals(CommandError.STATE, executor.apply(state, Command.rebase("main")).error());
    }

    // ---------- win predicate ----------

    @Test
    void single_file_on_trunk_is_won_by_two_commits() {
        var state = start(puzzle(file("a", "main", 2)));

        assertFalse(executor.apply(state, Command.commit("one")).gameWon());
        var r = executor.apply(state, Command.commit("two"));

        assertTrue(r.gameWon());
        assertEquals(GameStatus.WON, state.status());
        assertEquals(CLOCK.millis(), state.completedAt());
    }

    @Test
    void collecting_everything_does_not_win_until_trunk_carries_it() {
        var state = start(puzzle(file("A", "feature", 1), file("B", "main", 1)));
        run(executor, state,
                Command.branch("feature"), Command.checkout("feature"), Command.commit("a"),
                Command.checkout("main"));

        var lastFile = executor.apply(state, Command.commit("b"));
        assertTrue(state.allFilesCollected());
        assertFalse(lastFile.gameWon());
        assertEquals(GameStatus.IN_PROGRESS, state.status());

        var merge = executor.apply(state, Command.merge("feature"));
        assertTrue(merge.gameWon());
        assertEquals(6, state.commandsUsed());
    }

    @Test
    void finished_game_rejects_further_commands() {
        var state = start(puzzle(file("a", "main", 1)));
        assertTrue(executor.apply(state, Command.commit("win")).gameWon());

        var r = executor.apply(state, Command.commit("again"));
        assertEquals(CommandError.STATE, r.error());
        assertEquals(1, state.commandsUsed());
    }

    // ---------- quotas ----------

    @Test
    void disallowed_command_type_is_rejected_before_anything_else() {
        var c = new PuzzleConstraints(10, 5, 5, 5, 5, EnumSet.of(CommandType.COMMIT, CommandType.BRANCH));
        var state = start(puzzle(c, farFile()));

        var r = executor.apply(state, Command.rebase("main"));

        assertEquals(CommandError.VALIDATION, r.error());
        assertTrue(r.message().contains("not allowed"));
    }

    @Test
    void command_limit_blocks_the_next_command() {
        var state = start(puzzle(PuzzleConstraints.commandsOnly(2), farFile()));
        run(executor, state, Command.commit("1"), Command.commit("2"));

        var r = executor.apply(state, Command.branch("feature"));

        assertEquals(CommandError.VALIDATION, r.error());
        assertTrue(r.message().startsWith("Maximum commands (2)"));
        assertFalse(state.graph().hasBranch("feature"));
    }

    @Test
    void commit_limit_counts_commits_in_the_graph() {
        var state = start(puzzle(limits(10, 2, 10, 10, 10), farFile()));
        run(executor, state, Command.commit("1"));

        var r = executor.apply(state, Command.commit("2"));

        assertEquals(CommandError.VALIDATION, r.error());
        assertEquals(2, state.graph().commitCount());
    }

    @Test
    void checkout_limit() {
        var state = start(puzzle(limits(10, 10, 1, 10, 10), farFile()));
        run(executor, state, Command.branch("feature"), Command.checkout("feature"));

        var r = executor.apply(state, Command.checkout("main"));

        assertEquals(CommandError.VALIDATION, r.error());
        assertEquals("feature", state.graph().head().ref());
        assertEquals(1, state.checkoutsUsed());
    }

    @Test
    void consecutive_commit_limit_is_reset_by_checkout_but_not_by_branch() {
        var state = start(puzzle(limits(20, 20, 20, 2, 10), farFile()));
        run(executor, state, Command.commit("1"), Command.commit("2"));
        assertEquals(CommandError.VALIDATION, executor.apply(state, Command.commit("3")).error());

        run(executor, state, Command.branch("feature"));
        assertEquals(2, state.consecutiveCommits());
        assertEquals(CommandError.VALIDATION, executor.apply(state, Command.commit("3")).error());

        run(executor, state, Command.checkout("feature"));
        assertEquals(0, state.consecutiveCommits());
        assertTrue(executor.apply(state, Command.commit("3")).success());
    }

    @Test
    void branch_limit_counts_existing_branches() {
        var state = start(puzzle(limits(10, 10, 10, 10, 1), farFile()));

        var r = executor.apply(state, Command.branch("feature"));

        assertEquals(CommandError.VALIDATION, r.error());
        assertEquals(1, state.graph().branches().size());
    }

    @Test
    void history_records_successful_commands_only() {
        var state = start(puzzle(farFile()));
        executor.apply(state, Command.commit("1"));
        executor.apply(state, Command.checkout("nowhere"));
        executor.apply(state, Command.branch("feature"));

        assertEquals(List.of(Command.commit("1"), Command.branch("feature")), state.commandHistory());
        assertEquals(2, state.undoStack().size());
    }

    @Test
    void search_executor_records_no_undo_or_history() {
        Puzzle p = puzzle(farFile());
        var state = start(p);

        run(CommandExecutor.forSearch(), state, Command.commit("1"), Command.branch("feature"));

        assertEquals(2, state.commandsUsed());
        assertTrue(state.commandHistory().isEmpty());
        assertTrue(state.undoStack().isEmpty());
    }
}
