// file: src/main/java/io/gitty/core/puzzle/PuzzleGenerator.java
package io.gitty.core.puzzle;

import io.gitty.core.CommitGraph;
import io.gitty.core.FileTarget;
import io.gitty.core.solver.Solver;
import io.gitty.core.solver.SolverResult;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Seeded puzzle generation with solver-verified par.
 * <p>
 * Procedure per attempt:
 *  1. seed a {@link Random} from the date or archive id, advanced by the attempt number;
 *  2. start from a single root commit on trunk;
 *  3. place the tier's files at distinct (branch, depth) positions, at least one off trunk;
 *  4. solve; accept when solved with par inside the tier's band.
 * <p>
 * After {@code maxAttempts} rejected candidates a {@link GenerationFailure} is
 * thrown. Identical inputs produce identical puzzles.
 */
public final class PuzzleGenerator {
    private static final Logger LOG = Logger.getLogger(PuzzleGenerator.class.getName());

    public static final int DEFAULT_MAX_ATTEMPTS = 12;

    static final List<String> FILE_NAMES = List.of(
            "README.md", "index.ts", "config.json", "utils.ts",
            "styles.css", "package.json", "main.py", "Makefile");

    private final Solver solver;
    private final int maxAttempts;

    public PuzzleGenerator() {
        this(new Solver(), DEFAULT_MAX_ATTEMPTS);
    }

    public PuzzleGenerator(Solver solver, int maxAttempts) {
        this.solver = Objects.requireNonNull(solver, "solver");
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be > 0");
        this.maxAttempts = maxAttempts;
    }

    public Puzzle generateDaily(LocalDate date, DifficultyTier tier) {
        Objects.requireNonNull(date, "date");
        long timestamp = date.atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
        return generate("puzzle-" + date, date, PuzzleSeed.forDate(date), timestamp, tier);
    }

    public Puzzle generateArchive(String archiveId, DifficultyTier tier) {
        if (archiveId == null || archiveId.isBlank()) throw new IllegalArgumentException("archiveId");
        return generate("archive-" + archiveId, null, PuzzleSeed.forArchive(archiveId), 0L, tier);
    }

    private Puzzle generate(String id, LocalDate date, long seed, long timestamp, DifficultyTier tier) {
        Objects.requireNonNull(tier, "tier");
        String lastReason = "none";
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            Random rnd = new Random(PuzzleSeed.advance(seed, attempt));
            Puzzle candidate = candidate(id, date, timestamp, tier, rnd);

            SolverResult result = solver.solve(candidate);
            int tries = attempt + 1;
            if (result instanceof SolverResult.Solved solved && tier.acceptsPar(solved.parScore())) {
                LOG.info(() -> "Generated " + id + " (" + tier + ") on attempt " + tries
                        + ": par " + solved.parScore() + ", " + solved.statesExpanded() + " states");
                return candidate.withSolution(solved.parScore(), solved.solution());
            }
            lastReason = describe(result);
            LOG.fine("Rejected " + id + " attempt " + attempt + ": " + lastReason);
        }
        LOG.log(Level.SEVERE, "Generation failed for {0} after {1} attempts", new Object[]{id, maxAttempts});
        throw new GenerationFailure(id, maxAttempts, lastReason);
    }

    static Puzzle candidate(String id, LocalDate date, long timestamp, DifficultyTier tier, Random rnd) {
        String trunk = tier.trunk();

        var positions = new ArrayList<FileTarget>();
        for (String branch : tier.branchNames()) {
            for (int depth = tier.minDepth(); depth <= tier.maxDepth(); depth++) {
                positions.add(new FileTarget("?", "?", branch, depth, false));
            }
        }
        Collections.shuffle(positions, rnd);
        var picked = new ArrayList<>(positions.subList(0, tier.fileCount()));
        if (picked.stream().allMatch(p -> p.branch().equals(trunk))) {
            for (FileTarget p : positions.subList(tier.fileCount(), positions.size())) {
                if (!p.branch().equals(trunk)) {
                    picked.set(picked.size() - 1, p);
                    break;
                }
            }
        }

        var names = new ArrayList<>(FILE_NAMES);
        Collections.shuffle(names, rnd);
        var files = new ArrayList<FileTarget>(picked.size());
        for (int i = 0; i < picked.size(); i++) {
            FileTarget p = picked.get(i);
            files.add(new FileTarget("file-" + (i + 1), names.get(i), p.branch(), p.depth(), false));
        }

        return new Puzzle(id, date, tier.level(), trunk, tier.branchNames(),
                CommitGraph.withRoot(trunk, timestamp), files, tier.constraints(), 0, List.of());
    }

    private static String describe(SolverResult result) {
        if (result instanceof SolverResult.Solved s) return "par " + s.parScore() + " outside band";
        if (result instanceof SolverResult.Exhausted e) return "search budget exhausted after " + e.statesExpanded() + " states";
        return "unsolvable";
    }
}
