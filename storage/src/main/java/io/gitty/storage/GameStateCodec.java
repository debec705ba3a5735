// file: src/main/java/io/gitty/storage/GameStateCodec.java
package io.gitty.storage;

import io.gitty.core.game.CommandType;
import io.gitty.core.game.GameState;
import io.gitty.core.game.GameStatus;
import io.gitty.core.game.UndoSnapshot;
import io.gitty.core.game.UndoStack;
import io.gitty.core.puzzle.Puzzle;
import io.gitty.storage.dto.GameStateJson;
import io.gitty.storage.dto.UndoSnapshotJson;

import java.util.ArrayList;

/**
 * Session checkpoints.
 * <p>
 * The checkpoint carries everything needed to resume exactly where the player
 * left off, undo history included. The puzzle itself is stored once in the
 * puzzle store and referenced here by id.
 */
public final class GameStateCodec {

    private GameStateCodec() {
        // utility
    }

    public static GameStateJson encode(GameState state, String userId) {
        var json = new GameStateJson();
        json.puzzleId = state.puzzle().id();
        json.userId = userId;
        json.graph = GraphCodec.encode(state.graph());
        json.files = GraphCodec.encodeFiles(state.files());
        json.commandHistory = CommandCodec.encodeAll(state.commandHistory());
        json.undoStack = new ArrayList<>();
        for (UndoSnapshot s : state.undoStack().oldestFirst()) {
            var sj = new UndoSnapshotJson();
            sj.graph = GraphCodec.encode(s.graph());
            sj.files = GraphCodec.encodeFiles(s.files());
            sj.commandType = s.commandType().wireName();
            sj.consecutiveCommits = s.consecutiveCommits();
            json.undoStack.add(sj);
        }
        json.commandsUsed = state.commandsUsed();
        json.checkoutsUsed = state.checkoutsUsed();
        json.consecutiveCommits = state.consecutiveCommits();
        json.status = state.status().name();
        json.startedAt = state.startedAt();
        json.completedAt = state.completedAt();
        return json;
    }

    /**
     * @param puzzle the puzzle {@code json.puzzleId} refers to
     * @throws IllegalArgumentException if the checkpoint belongs to another puzzle or is malformed
     */
    public static GameState decode(GameStateJson json, Puzzle puzzle) {
        if (!puzzle.id().equals(json.puzzleId)) {
            throw new IllegalArgumentException("checkpoint is for " + json.puzzleId + ", not " + puzzle.id());
        }
        var snapshots = new ArrayList<UndoSnapshot>();
        if (json.undoStack != null) {
            for (UndoSnapshotJson sj : json.undoStack) {
                snapshots.add(new UndoSnapshot(
                        GraphCodec.decode(sj.graph),
                        GraphCodec.decodeFiles(sj.files),
                        CommandType.fromWireName(sj.commandType),
                        sj.consecutiveCommits));
            }
        }
        return new GameState(
                puzzle,
                GraphCodec.decode(json.graph),
                GraphCodec.decodeFiles(json.files),
                CommandCodec.decodeAll(json.commandHistory),
                UndoStack.of(puzzle.constraints().maxCommands(), snapshots),
                json.commandsUsed,
                json.checkoutsUsed,
                json.consecutiveCommits,
                json.status == null ? GameStatus.IN_PROGRESS : GameStatus.valueOf(json.status),
                json.startedAt,
                json.completedAt
        );
    }

    public static String toJson(GameState state, String userId) { return Json.write(encode(state, userId)); }

    public static GameState fromJson(String json, Puzzle puzzle) {
        return decode(Json.read(json, GameStateJson.class), puzzle);
    }
}
