// file: src/main/java/io/gitty/core/game/GameState.java
package io.gitty.core.game;

import io.gitty.core.CommitGraph;
import io.gitty.core.FileTarget;
import io.gitty.core.puzzle.Puzzle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One player's session on one puzzle.
 * <p>
 * The state is an explicit value threaded through the host: it is created
 * from a {@link Puzzle}, mutated only by {@link CommandExecutor}, and
 * checkpointed by the host after every successful command.
 * <p>
 * Accessors return live read-only views; nothing is copied on read.
 * Not thread safe: the host guarantees a single writer per session.
 */
public final class GameState {
    private final Puzzle puzzle;
    private CommitGraph graph;
    private final List<FileTarget> files;
    private final List<Command> commandHistory;
    private final UndoStack undoStack;
    private int commandsUsed;
    private int checkoutsUsed;
    private int consecutiveCommits;
    private GameStatus status;
    private final long startedAt;
    private long completedAt;

    /** Full constructor, used when rehydrating a persisted session. */
    public GameState(
            Puzzle puzzle,
            CommitGraph graph,
            List<FileTarget> files,
            List<Command> commandHistory,
            UndoStack undoStack,
            int commandsUsed,
            int checkoutsUsed,
            int consecutiveCommits,
            GameStatus status,
            long startedAt,
            long completedAt
    ) {
        this.puzzle = Objects.requireNonNull(puzzle, "puzzle");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.files = new ArrayList<>(files);
        this.commandHistory = new ArrayList<>(commandHistory);
        this.undoStack = Objects.requireNonNull(undoStack, "undoStack");
        if (commandsUsed < 0 || checkoutsUsed < 0 || consecutiveCommits < 0) {
            throw new IllegalArgumentException("counters must be >= 0");
        }
        this.commandsUsed = commandsUsed;
        this.checkoutsUsed = checkoutsUsed;
        this.consecutiveCommits = consecutiveCommits;
        this.status = Objects.requireNonNull(status, "status");
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    /** Fresh session at the puzzle's starting position. */
    public static GameState start(Puzzle puzzle, long startedAt) {
        return new GameState(
                puzzle,
                puzzle.initialGraph(),
                puzzle.fileTargets(),
                List.of(),
                new UndoStack(puzzle.constraints().maxCommands()),
                0, 0, 0,
                GameStatus.IN_PROGRESS,
                startedAt,
                0L
        );
    }

    /**
     * Independent copy of the position and counters without undo stack or
     * history. Used by the solver to branch the search.
     */
    public GameState fork() {
        return new GameState(puzzle, graph.copy(), files, List.of(), new UndoStack(1),
                commandsUsed, checkoutsUsed, consecutiveCommits, status, startedAt, completedAt);
    }

    // ---------- read access ----------

    public Puzzle puzzle() { return puzzle; }

    public CommitGraph graph() { return graph; }

    public List<FileTarget> files() { return Collections.unmodifiableList(files); }

    public List<Command> commandHistory() { return Collections.unmodifiableList(commandHistory); }

    public UndoStack undoStack() { return undoStack; }

    public int commandsUsed() { return commandsUsed; }

    public int checkoutsUsed() { return checkoutsUsed; }

    public int consecutiveCommits() { return consecutiveCommits; }

    public GameStatus status() { return status; }

    public long startedAt() { return startedAt; }

    /** Epoch millis when the session ended, 0 while in progress. */
    public long completedAt() { return completedAt; }

    public boolean allFilesCollected() {
        for (FileTarget f : files) {
            if (!f.collected()) return false;
        }
        return true;
    }

    // ---------- executor-only mutation ----------

    List<FileTarget> uncollectedAt(String branch, int depth) {
        var hits = new ArrayList<FileTarget>();
        for (FileTarget f : files) {
            if (!f.collected() && f.isAt(branch, depth)) hits.add(f);
        }
        return hits;
    }

    /** Marks the given targets collected and returns their collected form. */
    List<FileTarget> markCollected(List<FileTarget> targets) {
        var collected = new ArrayList<FileTarget>(targets.size());
        for (FileTarget t : targets) {
            for (int i = 0; i < files.size(); i++) {
                if (files.get(i).id().equals(t.id())) {
                    FileTarget c = files.get(i).collect();
                    files.set(i, c);
                    collected.add(c);
                }
            }
        }
        return collected;
    }

    UndoSnapshot snapshot(CommandType type) {
        return new UndoSnapshot(graph.copy(), files, type, consecutiveCommits);
    }

    void recordSuccess(Command command, UndoSnapshot before) {
        if (before != null) {
            undoStack.push(before);
            commandHistory.add(command);
        }
        commandsUsed++;
        if (command.type() == CommandType.CHECKOUT) checkoutsUsed++;
        if (command.type() == CommandType.COMMIT) {
            consecutiveCommits++;
        } else if (command.type() != CommandType.BRANCH) {
            consecutiveCommits = 0;
        }
    }

    void restore(UndoSnapshot snapshot) {
        graph = snapshot.graph();
        files.clear();
        files.addAll(snapshot.files());
        consecutiveCommits = snapshot.consecutiveCommits();
        commandsUsed = Math.max(0, commandsUsed - 1);
        if (snapshot.commandType() == CommandType.CHECKOUT) {
            checkoutsUsed = Math.max(0, checkoutsUsed - 1);
        }
        if (!commandHistory.isEmpty()) {
            commandHistory.remove(commandHistory.size() - 1);
        }
    }

    void markWon(long now) {
        status = GameStatus.WON;
        completedAt = now;
    }

    /** Called by the host's inactivity cleanup. No effect on a finished game. */
    public void abandon(long now) {
        if (status == GameStatus.IN_PROGRESS) {
            status = GameStatus.ABANDONED;
            completedAt = now;
        }
    }
}
