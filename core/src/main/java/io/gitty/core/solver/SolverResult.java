// file: src/main/java/io/gitty/core/solver/SolverResult.java
package io.gitty.core.solver;

import io.gitty.core.game.Command;

import java.util.List;

/** Outcome of a solver run. */
public interface SolverResult {

    int statesExpanded();

    /** A shortest winning sequence; {@code parScore == solution.size()}. */
    record Solved(int parScore, List<Command> solution, int statesExpanded) implements SolverResult {
        public Solved {
            solution = List.copyOf(solution);
            if (parScore != solution.size()) {
                throw new IllegalArgumentException("parScore " + parScore + " != solution length " + solution.size());
            }
        }
    }

    /** The reachable state space within the command limit holds no win. */
    record Unsolvable(int statesExpanded) implements SolverResult { }

    /** The expansion budget ran out before the search finished. */
    record Exhausted(int statesExpanded) implements SolverResult { }
}
