// file: src/main/java/io/gitty/core/game/UndoSnapshot.java
package io.gitty.core.game;

import io.gitty.core.CommitGraph;
import io.gitty.core.FileTarget;

import java.util.List;
import java.util.Objects;

/**
 * Session state captured right before a successful command was applied.
 * <p>
 *  - graph:              private deep copy, never shared with the live session.
 *  - files:              file targets with their collected flags at that time.
 *  - commandType:        the command this snapshot undoes (drives the checkout counter).
 *  - consecutiveCommits: counter value to restore.
 */
public record UndoSnapshot(CommitGraph graph, List<FileTarget> files, CommandType commandType, int consecutiveCommits) {
    public UndoSnapshot {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(commandType, "commandType");
        files = List.copyOf(files);
    }
}
