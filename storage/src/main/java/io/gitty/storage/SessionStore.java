// file: src/main/java/io/gitty/storage/SessionStore.java
package io.gitty.storage;

import io.gitty.core.game.GameState;

/**
 * Per-user session checkpoints, keyed by (userId, puzzleId).
 */
public interface SessionStore {

    /** Latest checkpoint, or null if the user never started this puzzle. */
    GameState load(String puzzleId, String userId);

    /** Persist the full state, replacing any previous checkpoint. */
    void checkpoint(String userId, GameState state);
}
