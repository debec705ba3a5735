package io.gitty.storage;

import io.gitty.core.puzzle.Puzzle;

import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * One pretty-printed JSON file per puzzle: {@code <dir>/<puzzleId>.json}.
 */
public final class FilePuzzleStore implements PuzzleStore {
    private static final Logger log = Logger.getLogger(FilePuzzleStore.class.getName());

    private final Path dir;

    public FilePuzzleStore(Path dir) {
        this.dir = Objects.requireNonNull(dir, "dir");
        AtomicFiles.createDirectories(dir);
    }

    @Override
    public Puzzle get(String puzzleId) {
        String json = AtomicFiles.readIfExists(pathFor(puzzleId));
        return json == null ? null : PuzzleCodec.fromJson(json);
    }

    @Override
    public void put(Puzzle puzzle) {
        Path dst = pathFor(puzzle.id());
        AtomicFiles.write(dst, PuzzleCodec.toJson(puzzle));
        log.info(() -> "Stored " + puzzle.id() + " at " + dst);
    }

    Path pathFor(String puzzleId) {
        return dir.resolve(AtomicFiles.safeName(puzzleId) + ".json");
    }
}
