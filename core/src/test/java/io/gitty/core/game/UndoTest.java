package io.gitty.core.game;

import io.gitty.core.CommitGraph;
import io.gitty.core.FileTarget;
import io.gitty.core.puzzle.PuzzleConstraints;
import io.gitty.core.solver.StateCanonicalizer;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static io.gitty.core.PuzzleFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class UndoTest {

    private final CommandExecutor executor = CommandExecutor.forPlay(CLOCK);

    @Test
    void undo_on_empty_stack_fails_without_changes() {
        var state = start(puzzle(farFile()));
        var before = StateCanonicalizer.signature(state);

        var r = executor.apply(state, Command.undo());

        assertFalse(r.success());
        assertEquals(CommandError.STATE, r.error());
        assertEquals(before, StateCanonicalizer.signature(state));
        assertEquals(0, state.commandsUsed());
    }

    @Test
    void n_commands_then_n_undos_restore_the_initial_position() {
        var state = start(puzzle(file("A", "feature", 1), file("B", "main", 1)));
        var initial = StateCanonicalizer.signature(state);
        List<Command> script = List.of(
                Command.branch("feature"), Command.checkout("feature"), Command.commit("a"),
                Command.checkout("main"), Command.commit("b"));
        script.forEach(c -> assertTrue(executor.apply(state, c).success()));
        assertTrue(state.allFilesCollected());

        for (int i = 0; i < script.size(); i++) {
            assertTrue(executor.undo(state).success());
        }

        assertEquals(initial, StateCanonicalizer.signature(state));
        assertEquals(0, state.commandsUsed());
        assertEquals(0, state.checkoutsUsed());
        assertEquals(0, state.consecutiveCommits());
        assertTrue(state.commandHistory().isEmpty());
        assertTrue(state.files().stream().noneMatch(FileTarget::collected));
        assertEquals(1, state.graph().commitCount());
        assertFalse(executor.undo(state).success());
    }

    @Test
    void undo_of_checkout_gives_the_checkout_back() {
        var state = start(puzzle(new PuzzleConstraints(10, 10, 1, 10, 10, EnumSet.allOf(CommandType.class)),
                farFile()));
        run(executor, state, Command.branch("feature"), Command.checkout("feature"));
        assertEquals(1, state.checkoutsUsed());

        var r = executor.apply(state, Command.undo());

        assertTrue(r.success());
        assertEquals("Undid last checkout", r.message());
        assertEquals(0, state.checkoutsUsed());
        assertEquals(1, state.commandsUsed());
        assertEquals("main", state.graph().head().ref());
        // the quota is usable again
        assertTrue(executor.apply(state, Command.checkout("feature")).success());
    }

    @Test
    void undo_restores_consecutive_commit_counter() {
        var state = start(puzzle(new PuzzleConstraints(10, 10, 10, 1, 10, EnumSet.allOf(CommandType.class)),
                farFile()));
        run(executor, state, Command.commit("1"));
        assertEquals(CommandError.VALIDATION, executor.apply(state, Command.commit("2")).error());

        run(executor, state, Command.undo());

        assertEquals(0, state.consecutiveCommits());
        assertTrue(executor.apply(state, Command.commit("again")).success());
    }

    @Test
    void undo_restores_a_private_graph_copy() {
        var state = start(puzzle(farFile()));
        run(executor, state, Command.commit("1"));
        CommitGraph live = state.graph();

        run(executor, state, Command.commit("2"), Command.undo());

        assertNotSame(live, state.graph());
        assertEquals(2, state.graph().commitCount());
        assertEquals(3, live.commitCount(), "the old live graph is not reused");
    }

    @Test
    void undo_must_be_allowed_and_game_must_be_running() {
        var noUndo = new PuzzleConstraints(10, 10, 10, 10, 10, EnumSet.of(CommandType.COMMIT));
        var state = start(puzzle(noUndo, farFile()));
        run(executor, state, Command.commit("1"));
        assertEquals(CommandError.VALIDATION, executor.apply(state, Command.undo()).error());

        var won = start(puzzle(file("a", "main", 1)));
        run(executor, won, Command.commit("win"));
        assertEquals(GameStatus.WON, won.status());
        assertEquals(CommandError.STATE, executor.apply(won, Command.undo()).error());
    }

    @Test
    void stack_drops_oldest_snapshot_when_full() {
        var graph = CommitGraph.withRoot("main", 0L);
        var stack = new UndoStack(2);
        var s1 = new UndoSnapshot(graph, List.of(), CommandType.COMMIT, 1);
        var s2 = new UndoSnapshot(graph, List.of(), CommandType.BRANCH, 2);
        var s3 = new UndoSnapshot(graph, List.of(), CommandType.CHECKOUT, 3);

        stack.push(s1);
        stack.push(s2);
        stack.push(s3);

        assertEquals(2, stack.size());
        assertEquals(List.of(s2, s3), stack.oldestFirst());
        assertSame(s3, stack.pop());
        assertSame(s2, stack.pop());
        assertNull(stack.pop());
    }

    @Test
    void stack_rebuilt_from_oldest_first_list_pops_newest_first() {
        var graph = CommitGraph.withRoot("main", 0L);
        var a = new UndoSnapshot(graph, List.of(), CommandType.COMMIT, 0);
        var b = new UndoSnapshot(graph, List.of(), CommandType.MERGE, 0);

        var stack = UndoStack.of(5, List.of(a, b));

        assertSame(b, stack.peek());
        assertEquals(List.of(a, b), stack.oldestFirst());
    }
}
