// file: src/main/java/io/gitty/core/game/CommandResult.java
package io.gitty.core.game;

import io.gitty.core.CommitGraph;
import io.gitty.core.FileTarget;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one executor call.
 * <p>
 *  - graph is the live session graph (a view, not a copy); null on failure.
 *  - filesCollected lists targets newly collected by this command.
 *  - error is null on success.
 */
public record CommandResult(
        boolean success,
        String message,
        CommandError error,
        CommitGraph graph,
        List<FileTarget> filesCollected,
        boolean gameWon
) {
    public CommandResult {
        Objects.requireNonNull(message, "message");
        filesCollected = filesCollected == null ? List.of() : List.copyOf(filesCollected);
        if (success == (error != null)) {
            throw new IllegalArgumentException("error must be set exactly when success is false");
        }
    }

    public static CommandResult ok(String message, CommitGraph graph, List<FileTarget> collected, boolean won) {
        return new CommandResult(true, message, null, graph, collected, won);
    }

    public static CommandResult failure(CommandError error, String message) {
        return new CommandResult(false, message, Objects.requireNonNull(error, "error"), null, List.of(), false);
    }
}
