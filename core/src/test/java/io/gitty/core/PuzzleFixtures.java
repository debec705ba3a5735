package io.gitty.core;

import io.gitty.core.game.Command;
import io.gitty.core.game.CommandExecutor;
import io.gitty.core.game.CommandResult;
import io.gitty.core.game.GameState;
import io.gitty.core.puzzle.Puzzle;
import io.gitty.core.puzzle.PuzzleConstraints;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

/** Small hand-built puzzles shared by the core tests. */
public final class PuzzleFixtures {

    public static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private PuzzleFixtures() {
    }

    public static FileTarget file(String id, String branch, int depth) {
        return new FileTarget(id, id + ".txt", branch, depth, false);
    }

    /** Declares main + feature, starts from a root commit on main. */
    public static Puzzle puzzle(PuzzleConstraints constraints, FileTarget... files) {
        return new Puzzle("puzzle-test", null, 1, "main", List.of("main", "feature"),
                CommitGraph.withRoot("main", 0L), List.of(files), constraints, 0, List.of());
    }

    public static Puzzle puzzle(FileTarget... files) {
        return puzzle(PuzzleConstraints.commandsOnly(20), files);
    }

    /** A file nobody reaches in short tests, so trunk commits never end the game. */
    public static FileTarget farFile() {
        return file("far", "main", 50);
    }

    public static GameState start(Puzzle puzzle) {
        return GameState.start(puzzle, CLOCK.millis());
    }

    /** Apply each command, failing the test on the first rejection. Returns the last result. */
    public static CommandResult run(CommandExecutor executor, GameState state, Command... commands) {
        CommandResult last = null;
        for (Command c : commands) {
            last = executor.apply(state, c);
            assertTrue(last.success(), () -> c.describe() + " failed");
        }
        return last;
    }
}
