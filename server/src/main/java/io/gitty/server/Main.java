// file: src/main/java/io/gitty/server/Main.java
package io.gitty.server;

import io.gitty.core.game.Command;
import io.gitty.core.puzzle.GenerationFailure;
import io.gitty.core.puzzle.Puzzle;
import io.gitty.core.puzzle.PuzzleGenerator;
import io.gitty.core.solver.Solver;
import io.gitty.storage.FilePuzzleStore;
import io.gitty.storage.PuzzleStore;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Daily generation entry point.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Generate the day's (or an archive) puzzle and verify it with the solver.
 *  - Write it to the puzzle store and print a summary.
 *  - Exit non-zero when generation fails; there is no fallback puzzle.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = GeneratorConfig.fromArgs(args);
        var store = new FilePuzzleStore(Path.of(cfg.puzzleDir()));
        var generator = new PuzzleGenerator(new Solver(), cfg.maxAttempts());

        try {
            Puzzle p = generate(cfg, generator, store);
            System.out.printf("Generated %s (tier %s): %d files, par %d%n",
                    p.id(), cfg.tier(), p.fileTargets().size(), p.parScore());
            for (Command c : p.solution()) {
                System.out.println("  " + c.describe());
            }
        } catch (GenerationFailure e) {
            log.log(Level.SEVERE, "Puzzle generation failed", e);
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        }
    }

    static Puzzle generate(GeneratorConfig cfg, PuzzleGenerator generator, PuzzleStore store) {
        Puzzle p = cfg.isArchive()
                ? generator.generateArchive(cfg.archiveId(), cfg.tier())
                : generator.generateDaily(cfg.date(), cfg.tier());
        store.put(p);
        return p;
    }
}
