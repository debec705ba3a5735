package io.gitty.storage;

import io.gitty.core.puzzle.Puzzle;

/**
 * Where generated puzzles live.
 * <p>
 * A puzzle is written once by the daily job and then read by every session.
 */
public interface PuzzleStore {

    /** The puzzle with this id, or null if none was stored. */
    Puzzle get(String puzzleId);

    /** Store (or replace) a puzzle under its id. */
    void put(Puzzle puzzle);
}
