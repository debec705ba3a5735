// file: src/main/java/io/gitty/server/SessionService.java
package io.gitty.server;

import io.gitty.core.game.Command;
import io.gitty.core.game.CommandError;
import io.gitty.core.game.CommandExecutor;
import io.gitty.core.game.CommandResult;
import io.gitty.core.game.GameState;
import io.gitty.core.game.GameStatus;
import io.gitty.core.game.InvalidCommandException;
import io.gitty.core.puzzle.Puzzle;
import io.gitty.storage.CommandCodec;
import io.gitty.storage.PuzzleStore;
import io.gitty.storage.SessionStore;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Session boundary: the only way callers touch a {@link GameState}.
 * <p>
 * Responsibilities:
 *  - hydrate a session from the in-memory cache or its last checkpoint;
 *  - decode wire or text input into a typed command before it reaches the executor;
 *  - run every command for one (userId, puzzleId) key under that key's lock,
 *    so each session has exactly one writer;
 *  - checkpoint the full state after every successful command, before returning;
 *  - drop a session from memory once it is won, abandoned or evicted.
 * <p>
 * Sessions on different keys never contend.
 */
public final class SessionService {
    private static final Logger log = Logger.getLogger(SessionService.class.getName());

    private final PuzzleStore puzzles;
    private final SessionStore sessions;
    private final CommandExecutor executor;
    private final Clock clock;

    private final ConcurrentHashMap<String, GameState> active = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Object> locks = new ConcurrentHashMap<>();

    public SessionService(PuzzleStore puzzles, SessionStore sessions, Clock clock) {
        this.puzzles = Objects.requireNonNull(puzzles, "puzzles");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.executor = CommandExecutor.forPlay(clock);
    }

    /** The user's session on this puzzle, or null if there is none. */
    public GameState hydrate(String puzzleId, String userId) {
        return locked(puzzleId, userId, () -> load(puzzleId, userId));
    }

    /**
     * Begin a fresh session, discarding an unfinished one. A won session is
     * returned unchanged.
     *
     * @throws IllegalArgumentException if the puzzle does not exist
     */
    public GameState start(String puzzleId, String userId) {
        return locked(puzzleId, userId, () -> {
            GameState existing = load(puzzleId, userId);
            if (existing != null && existing.status() == GameStatus.WON) {
                return existing;
            }
            Puzzle puzzle = puzzles.get(puzzleId);
            if (puzzle == null) throw new IllegalArgumentException("Unknown puzzle " + puzzleId);

            GameState state = GameState.start(puzzle, clock.millis());
            checkpoint(puzzleId, userId, state);
            active.put(key(puzzleId, userId), state);
            log.info(() -> "Started " + puzzleId + " for " + userId);
            return state;
        });
    }

    public CommandResult apply(String puzzleId, String userId, Command command) {
        Objects.requireNonNull(command, "command");
        return withSession(puzzleId, userId, command.describe(), state -> executor.apply(state, command));
    }

    /** Decode a JSON command payload, then apply it. Undecodable payloads are VALIDATION failures. */
    public CommandResult applyWire(String puzzleId, String userId, String payload) {
        Command command;
        try {
            command = CommandCodec.decode(payload);
        } catch (InvalidCommandException e) {
            CommandLogger.logRejectedPayload(userId, puzzleId, payload, e);
            return CommandResult.failure(CommandError.VALIDATION, e.getMessage());
        }
        return apply(puzzleId, userId, command);
    }

    /** Parse a {@code git ...} line, then apply it. */
    public CommandResult applyText(String puzzleId, String userId, String line) {
        Command command;
        try {
            command = GitCommandParser.parse(line);
        } catch (InvalidCommandException e) {
            CommandLogger.logRejectedPayload(userId, puzzleId, line, e);
            return CommandResult.failure(CommandError.VALIDATION, e.getMessage());
        }
        return apply(puzzleId, userId, command);
    }

    public CommandResult undo(String puzzleId, String userId) {
        return withSession(puzzleId, userId, "git undo", executor::undo);
    }

    /**
     * Mark an unfinished session abandoned and release it from memory.
     * Returns false if there was nothing to abandon.
     */
    public boolean abandon(String puzzleId, String userId) {
        return locked(puzzleId, userId, () -> {
            GameState state = load(puzzleId, userId);
            if (state == null || state.status() != GameStatus.IN_PROGRESS) return false;
            state.abandon(clock.millis());
            checkpoint(puzzleId, userId, state);
            release(puzzleId, userId);
            log.info(() -> "Abandoned " + puzzleId + " for " + userId);
            return true;
        });
    }

    /**
     * Drop the in-memory session, undo history included. The checkpoint stays,
     * so a later call picks the game up from the store. Used by the host's
     * inactivity cleanup.
     */
    public void evict(String puzzleId, String userId) {
        locked(puzzleId, userId, () -> {
            release(puzzleId, userId);
            return null;
        });
    }

    /** Reward for a won session, or null while the session is not won. */
    public GameReward reward(String puzzleId, String userId) {
        return locked(puzzleId, userId, () -> {
            GameState state = load(puzzleId, userId);
            return state == null || state.status() != GameStatus.WON ? null : RewardCalculator.forWin(state);
        });
    }

    // ---------- internals ----------

    private CommandResult withSession(String puzzleId, String userId, String description,
                                      Function<GameState, CommandResult> action) {
        return locked(puzzleId, userId, () -> {
            GameState state = load(puzzleId, userId);
            if (state == null) {
                return CommandResult.failure(CommandError.STATE, "No active game for " + puzzleId);
            }
            long t0 = System.nanoTime();
            CommandResult result = action.apply(state);
            if (result.success()) {
                checkpoint(puzzleId, userId, state);
                if (state.status() == GameStatus.WON) release(puzzleId, userId);
            }
            CommandLogger.logCommand(userId, puzzleId, description, result, state, (System.nanoTime() - t0) / 1_000);
            return result;
        });
    }

    /**
     * Persist {@code state}. On failure the cached copy, which may be ahead of
     * the store, is dropped so the next call reloads the last checkpoint.
     */
    private void checkpoint(String puzzleId, String userId, GameState state) {
        try {
            sessions.checkpoint(userId, state);
        } catch (RuntimeException e) {
            active.remove(key(puzzleId, userId));
            log.log(Level.WARNING, "Checkpoint failed for " + userId + " on " + puzzleId, e);
            throw e;
        }
    }

    private GameState load(String puzzleId, String userId) {
        String key = key(puzzleId, userId);
        GameState cached = active.get(key);
        if (cached != null) return cached;
        GameState stored = sessions.load(puzzleId, userId);
        if (stored != null && stored.status() == GameStatus.IN_PROGRESS) active.put(key, stored);
        return stored;
    }

    /**
     * Run {@code body} holding the key's lock. A lock lives only while its
     * session is cached; a caller that waited on a lock dropped in the meantime
     * retries with the current one, so two callers never hold different locks
     * for the same key.
     */
    private <T> T locked(String puzzleId, String userId, Supplier<T> body) {
        String key = key(puzzleId, userId);
        while (true) {
            Object lock = locks.computeIfAbsent(key, k -> new Object());
            synchronized (lock) {
                if (locks.get(key) != lock) continue;
                try {
                    return body.get();
                } finally {
                    if (!active.containsKey(key)) locks.remove(key);
                }
            }
        }
    }

    /** Caller holds the key's lock. */
    private void release(String puzzleId, String userId) {
        active.remove(key(puzzleId, userId));
    }

    private static String key(String puzzleId, String userId) {
        return Objects.requireNonNull(userId, "userId") + "|" + Objects.requireNonNull(puzzleId, "puzzleId");
    }

    /** Sessions currently held in memory. */
    int activeCount() { return active.size(); }

    int lockCount() { return locks.size(); }
}
