// file: src/main/java/io/gitty/core/puzzle/GenerationFailure.java
package io.gitty.core.puzzle;

/**
 * No acceptable puzzle could be generated within the attempt budget.
 * Callers must surface this; there is no fallback puzzle.
 */
public class GenerationFailure extends RuntimeException {
    private final String puzzleId;
    private final int attempts;

    public GenerationFailure(String puzzleId, int attempts, String lastReason) {
        super("Could not generate " + puzzleId + " after " + attempts + " attempts (last: " + lastReason + ")");
        this.puzzleId = puzzleId;
        this.attempts = attempts;
    }

    public String puzzleId() { return puzzleId; }

    public int attempts() { return attempts; }
}
