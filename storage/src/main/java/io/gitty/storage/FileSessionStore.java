// file: src/main/java/io/gitty/storage/FileSessionStore.java
package io.gitty.storage;

import io.gitty.core.game.GameState;
import io.gitty.core.puzzle.Puzzle;
import io.gitty.storage.dto.GameStateJson;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Objects;

/**
 * Session checkpoints as JSON files: {@code <dir>/session-<user>.<puzzle>.json}.
 * <p>
 * Both key parts are URL-safe Base64 without padding. That alphabet has no
 * '.', so distinct (userId, puzzleId) pairs always map to distinct files.
 * <p>
 * Loading resolves the puzzle through the {@link PuzzleStore}; a checkpoint
 * whose puzzle has disappeared, or that was written for another user, is an
 * error, not an absent session.
 */
public final class FileSessionStore implements SessionStore {
    private final Path dir;
    private final PuzzleStore puzzles;

    public FileSessionStore(Path dir, PuzzleStore puzzles) {
        this.dir = Objects.requireNonNull(dir, "dir");
        this.puzzles = Objects.requireNonNull(puzzles, "puzzles");
        AtomicFiles.createDirectories(dir);
    }

    @Override
    public GameState load(String puzzleId, String userId) {
        String json = AtomicFiles.readIfExists(pathFor(puzzleId, userId));
        if (json == null) return null;
        Puzzle puzzle = puzzles.get(puzzleId);
        if (puzzle == null) {
            throw new IllegalStateException("Session for " + userId + " references missing puzzle " + puzzleId);
        }
        GameStateJson dto = Json.read(json, GameStateJson.class);
        if (!userId.equals(dto.userId)) {
            throw new IllegalStateException("Checkpoint " + pathFor(puzzleId, userId)
                    + " belongs to " + dto.userId + ", not " + userId);
        }
        return GameStateCodec.decode(dto, puzzle);
    }

    @Override
    public void checkpoint(String userId, GameState state) {
        AtomicFiles.write(pathFor(state.puzzle().id(), userId), GameStateCodec.toJson(state, userId));
    }

    Path pathFor(String puzzleId, String userId) {
        return dir.resolve("session-" + encode(userId) + "." + encode(puzzleId) + ".json");
    }

    private static String encode(String keyPart) {
        return Base64.getUrlEncoder().withoutPadding()
                .encodeToString(Objects.requireNonNull(keyPart).getBytes(StandardCharsets.UTF_8));
    }
}
