// file: src/main/java/io/gitty/server/RewardCalculator.java
package io.gitty.server;

import io.gitty.core.game.Command;
import io.gitty.core.game.GameState;
import io.gitty.core.game.GameStatus;
import io.gitty.core.puzzle.Puzzle;

import java.util.stream.Collectors;

/**
 * Scoring against par.
 * <p>
 *  - at or under par: 100 + 20 per command saved;
 *  - over par:        100 - 10 per extra command, never below 10;
 *  - bonus points:    20 per command saved, 0 otherwise.
 */
public final class RewardCalculator {

    static final int BASE_SCORE = 100;
    static final int MIN_SCORE = 10;

    private RewardCalculator() {
        // utility
    }

    public static int score(int commandsUsed, int par) {
        int diff = par - commandsUsed;
        return diff >= 0 ? BASE_SCORE + diff * 20 : Math.max(MIN_SCORE, BASE_SCORE + diff * 10);
    }

    /**
     * @throws IllegalStateException if the game has not been won
     */
    public static GameReward forWin(GameState state) {
        if (state.status() != GameStatus.WON) {
            throw new IllegalStateException("No reward for a game in status " + state.status());
        }
        Puzzle puzzle = state.puzzle();
        int par = puzzle.parScore();
        int used = state.commandsUsed();
        int diff = par - used;
        return new GameReward(
                score(used, par),
                par,
                used,
                diff,
                Performance.of(used, par),
                Math.max(0, diff * 20),
                puzzle.solution(),
                explain(puzzle));
    }

    private static String explain(Puzzle puzzle) {
        if (puzzle.solution().isEmpty()) return "No recorded solution.";
        return "Par is " + puzzle.parScore() + " commands: "
                + puzzle.solution().stream().map(Command::describe).collect(Collectors.joining("; "));
    }
}
