// file: src/main/java/io/gitty/storage/dto/GameStateJson.java
package io.gitty.storage.dto;

import java.util.List;

/**
 * Session checkpoint. The puzzle is referenced by id and resolved from the
 * puzzle store on load; the undo stack is stored oldest first.
 */
public class GameStateJson {
    public String puzzleId;
    public String userId;
    public GraphJson graph;
    public List<FileTargetJson> files;
    public List<CommandJson> commandHistory;
    public List<UndoSnapshotJson> undoStack;
    public int commandsUsed;
    public int checkoutsUsed;
    public int consecutiveCommits;
    public String status;
    public long startedAt;
    public long completedAt;
}
