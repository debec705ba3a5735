// file: src/main/java/io/gitty/server/GameReward.java
package io.gitty.server;

import io.gitty.core.game.Command;

import java.util.List;

/**
 * What a player earns on a win.
 *
 * @param commandsUnderPar par minus commands used (negative when over par)
 * @param optimalSolution  the puzzle's recorded optimal sequence
 */
public record GameReward(
        int score,
        int parScore,
        int commandsUsed,
        int commandsUnderPar,
        Performance performance,
        int bonusPoints,
        List<Command> optimalSolution,
        String explanation
) {
    public GameReward {
        optimalSolution = List.copyOf(optimalSolution);
    }
}
