// file: src/main/java/io/gitty/core/solver/Solver.java
package io.gitty.core.solver;

import io.gitty.core.Ancestry;
import io.gitty.core.Branch;
import io.gitty.core.Commit;
import io.gitty.core.CommitGraph;
import io.gitty.core.game.Command;
import io.gitty.core.game.CommandExecutor;
import io.gitty.core.game.CommandResult;
import io.gitty.core.game.GameState;
import io.gitty.core.puzzle.Puzzle;
import io.gitty.core.puzzle.PuzzleConstraints;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Breadth-first search for the shortest winning command sequence.
 * <p>
 * Every edge is one legal command, so the first win found is optimal. The
 * goal test runs when a child is generated, not when it is dequeued.
 * <p>
 * Memory: a search node keeps only (parent, command, depth). A node's state is
 * rebuilt by replaying its path from the initial position, which reproduces
 * the same commit ids because ids are derived deterministically and the
 * search executor runs on a fixed clock.
 * <p>
 * Dedup key: the canonical signature plus each counter whose quota is finite
 * (checkouts used, consecutive commits, total commits). Counters under an
 * unlimited quota cannot change which moves stay legal, so they are left out.
 * <p>
 * Detached checkouts are generated only for commits reachable from HEAD or a
 * branch tip. Originals left behind by a rebase stay checkoutable by id in
 * play, but the search never visits them, and the signature leaves them out
 * to match.
 */
public final class Solver {
    private static final Logger LOG = Logger.getLogger(Solver.class.getName());

    public static final int DEFAULT_MAX_STATES = 200_000;

    private final CommandExecutor executor = CommandExecutor.forSearch();
    private final int maxStates;

    public Solver() {
        this(DEFAULT_MAX_STATES);
    }

    public Solver(int maxStates) {
        if (maxStates <= 0) throw new IllegalArgumentException("maxStates must be > 0");
        this.maxStates = maxStates;
    }

    private record Node(int parent, Command via, int depth) { }

    private record SearchKey(StateSignature signature, int checkouts, int consecutive, int commits) { }

    public SolverResult solve(Puzzle puzzle) {
        PuzzleConstraints c = puzzle.constraints();
        GameState initial = GameState.start(puzzle, 0L);

        var nodes = new ArrayList<Node>();
        var seen = new HashSet<SearchKey>();
        var queue = new ArrayDeque<Integer>();

        nodes.add(new Node(-1, null, 0));
        seen.add(keyOf(initial, c));
        queue.add(0);

        int expanded = 0;
        while (!queue.isEmpty()) {
            int index = queue.poll();
            Node node = nodes.get(index);
            if (node.depth() >= c.maxCommands()) continue;
            if (expanded >= maxStates) {
                LOG.log(Level.FINE, "solver budget exhausted for {0} after {1} states",
                        new Object[]{puzzle.id(), expanded});
                return new SolverResult.Exhausted(expanded);
            }
            expanded++;

            GameState state = replay(initial, pathTo(nodes, index));
            for (Command move : candidateMoves(state)) {
                GameState child = state.fork();
                CommandResult r = executor.apply(child, move);
                if (!r.success()) continue;
                if (r.gameWon()) {
                    List<Command> solution = new ArrayList<>(pathTo(nodes, index));
                    solution.add(move);
                    LOG.log(Level.FINE, "solved {0}: par {1}, {2} states expanded",
                            new Object[]{puzzle.id(), solution.size(), expanded});
                    return new SolverResult.Solved(solution.size(), solution, expanded);
                }
                if (seen.add(keyOf(child, c))) {
                    nodes.add(new Node(index, move, node.depth() + 1));
                    queue.add(nodes.size() - 1);
                }
            }
        }
        return new SolverResult.Unsolvable(expanded);
    }

    /**
     * Every move worth trying from {@code state}, restricted to allowed types.
     * The executor still decides legality (quotas, HEAD state). Orphaned
     * commits are not offered as checkout targets.
     */
    static List<Command> candidateMoves(GameState state) {
        Puzzle puzzle = state.puzzle();
        CommitGraph g = state.graph();
        Branch attached = g.currentBranch();
        var moves = new ArrayList<Command>();

        moves.add(Command.commit(Command.DEFAULT_COMMIT_MESSAGE));

        for (String name : puzzle.branchNames()) {
            if (!g.hasBranch(name)) moves.add(Command.branch(name));
        }

        for (String name : g.branches().keySet()) {
            if (attached == null || !attached.name().equals(name)) moves.add(Command.checkout(name));
        }
        Commit current = g.currentCommit();
        for (String id : Ancestry.reachableFromRefs(g)) {
            if (!g.isDetached() || current == null || !current.id().equals(id)) {
                moves.add(Command.checkout(id));
            }
        }

        if (attached != null) {
            for (String name : g.branches().keySet()) {
                if (name.equals(attached.name())) continue;
                moves.add(Command.merge(name));
                moves.add(Command.rebase(name));
            }
        }

        moves.removeIf(m -> !puzzle.constraints().allows(m.type()));
        return moves;
    }

    private GameState replay(GameState initial, List<Command> path) {
        GameState state = initial.fork();
        for (Command step : path) {
            CommandResult r = executor.apply(state, step);
            if (!r.success()) {
                throw new IllegalStateException("replay diverged at " + step.describe() + ": " + r.message());
            }
        }
        return state;
    }

    private static List<Command> pathTo(List<Node> nodes, int index) {
        var path = new ArrayList<Command>();
        for (int i = index; nodes.get(i).via() != null; i = nodes.get(i).parent()) {
            path.add(nodes.get(i).via());
        }
        Collections.reverse(path);
        return path;
    }

    private static SearchKey keyOf(GameState s, PuzzleConstraints c) {
        return new SearchKey(
                StateCanonicalizer.signature(s),
                PuzzleConstraints.isLimited(c.maxCheckouts()) ? s.checkoutsUsed() : -1,
                PuzzleConstraints.isLimited(c.maxConsecutiveCommits()) ? s.consecutiveCommits() : -1,
                PuzzleConstraints.isLimited(c.maxCommits()) ? s.graph().commitCount() : -1
        );
    }
}
