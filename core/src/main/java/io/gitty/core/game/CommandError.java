// file: src/main/java/io/gitty/core/game/CommandError.java
package io.gitty.core.game;

/**
 * Why a command was rejected. All are recoverable by the caller: retry with a
 * different command or argument. A rejected command never mutates state and
 * never consumes quota.
 * <p>
 *  - VALIDATION: disallowed command type, exhausted quota, malformed argument.
 *  - REFERENCE:  unresolvable checkout target, unknown or undeclared branch.
 *  - STATE:      merge/rebase with a detached HEAD, undo with an empty stack,
 *                no current commit, or the game is already over.
 */
public enum CommandError {
    VALIDATION, REFERENCE, STATE
}
