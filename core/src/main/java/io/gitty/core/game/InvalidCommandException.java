// file: src/main/java/io/gitty/core/game/InvalidCommandException.java
package io.gitty.core.game;

/**
 * Raised while decoding a wire or text payload into a {@link Command}.
 * Never raised by the executor itself; the session boundary turns it into a
 * {@link CommandError#VALIDATION} result.
 */
public class InvalidCommandException extends RuntimeException {
    public InvalidCommandException(String message) {
        super(message);
    }
}
