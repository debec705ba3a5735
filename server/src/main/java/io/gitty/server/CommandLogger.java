// file: src/main/java/io/gitty/server/CommandLogger.java
package io.gitty.server;

import io.gitty.core.game.CommandResult;
import io.gitty.core.game.GameState;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One log line per command a session handles.
 * <p>
 * Executed and refused commands go out at INFO, payloads that could not be
 * decoded at WARNING. Messages carry the session key and the counters after
 * the command.
 */
public final class CommandLogger {
    private static final Logger log = Logger.getLogger(CommandLogger.class.getName());

    private CommandLogger() {
        // utility
    }

    public static void logCommand(String userId, String puzzleId, String command,
                                  CommandResult result, GameState state, long elapsedMicros) {
        String msg = String.format(
                "%s/%s %s -> %s%s (commands=%d checkouts=%d status=%s, %dus)",
                userId,
                puzzleId,
                command,
                result.success() ? "ok" : result.error(),
                result.gameWon() ? " WON" : "",
                state.commandsUsed(),
                state.checkoutsUsed(),
                state.status(),
                elapsedMicros
        );
        log.log(Level.INFO, msg);
    }

    public static void logRejectedPayload(String userId, String puzzleId, String payload, Throwable error) {
        log.log(Level.WARNING, String.format("%s/%s rejected payload %s: %s",
                userId, puzzleId, payload, error.getMessage()));
    }
}
