// file: src/main/java/io/gitty/core/puzzle/Puzzle.java
package io.gitty.core.puzzle;

import io.gitty.core.CommitGraph;
import io.gitty.core.FileTarget;
import io.gitty.core.game.Command;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * A day's puzzle, generated once and shared by every player.
 * <p>
 * Fields:
 *  - id:           "puzzle-YYYY-MM-DD" for dailies, "archive-..." otherwise.
 *  - date:         null for archive puzzles.
 *  - difficulty:   numeric tier level (1 = easiest).
 *  - trunkBranch:  the branch everything must be merged back to.
 *  - branchNames:  the fixed set of branch names this puzzle declares; players
 *                  can only create branches from this list.
 *  - initialGraph: starting graph; kept private and handed out as copies.
 *  - fileTargets:  targets with collected=false.
 *  - parScore:     optimal command count (0 until solved).
 *  - solution:     one optimal command sequence (empty until solved).
 */
public record Puzzle(
        String id,
        LocalDate date,
        int difficulty,
        String trunkBranch,
        List<String> branchNames,
        CommitGraph initialGraph,
        List<FileTarget> fileTargets,
        PuzzleConstraints constraints,
        int parScore,
        List<Command> solution
) {
    public static final String DEFAULT_TRUNK = "main";

    public Puzzle {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(trunkBranch, "trunkBranch");
        Objects.requireNonNull(initialGraph, "initialGraph");
        Objects.requireNonNull(constraints, "constraints");
        branchNames = List.copyOf(branchNames);
        fileTargets = fileTargets.stream().map(FileTarget::reset).toList();
        solution = solution == null ? List.of() : List.copyOf(solution);
        if (!branchNames.contains(trunkBranch)) {
            throw new IllegalArgumentException("trunk " + trunkBranch + " must be a declared branch");
        }
        for (String existing : initialGraph.branches().keySet()) {
            if (!branchNames.contains(existing)) {
                throw new IllegalArgumentException("initial graph has undeclared branch " + existing);
            }
        }
        var ids = new HashSet<String>();
        for (FileTarget f : fileTargets) {
            if (!ids.add(f.id())) throw new IllegalArgumentException("duplicate file id " + f.id());
        }
        if (parScore < 0) throw new IllegalArgumentException("parScore must be >= 0");
        initialGraph = initialGraph.copy();
    }

    /** A fresh copy of the starting graph. */
    @Override
    public CommitGraph initialGraph() { return initialGraph.copy(); }

    public boolean isSolved() { return parScore > 0; }

    public Puzzle withSolution(int par, List<Command> commands) {
        return new Puzzle(id, date, difficulty, trunkBranch, branchNames, initialGraph, fileTargets,
                constraints, par, commands);
    }
}
