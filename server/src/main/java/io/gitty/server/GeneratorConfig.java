// file: src/main/java/io/gitty/server/GeneratorConfig.java
package io.gitty.server;

import io.gitty.core.puzzle.DifficultyTier;
import io.gitty.core.puzzle.PuzzleGenerator;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Daily generation settings parsed from CLI args.
 *
 * Supports:
 *  - date:        day to generate (default: today, UTC)
 *  - archiveId:   generate an archive puzzle instead of a daily one
 *  - tier:        easy | medium | hard
 *  - puzzleDir:   where puzzle JSON files are written
 *  - maxAttempts: regeneration budget before giving up
 */
public record GeneratorConfig(
        LocalDate date,
        String archiveId,
        DifficultyTier tier,
        String puzzleDir,
        int maxAttempts
) {

    /**
     * Supported flags:
     *   --date,         -d   <yyyy-MM-dd>
     *   --archive-id,   -a   <id>
     *   --tier,         -t   <easy|medium|hard>
     *   --puzzle-dir,   -p   <path>
     *   --max-attempts       <n>
     *   --help,         -h
     */
    public static GeneratorConfig fromArgs(String[] args) {
        LocalDate date = LocalDate.now(ZoneOffset.UTC);
        String archiveId = null;
        DifficultyTier tier = DifficultyTier.EASY;
        String puzzleDir = "./data/puzzles";
        int maxAttempts = PuzzleGenerator.DEFAULT_MAX_ATTEMPTS;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--date", "-d" -> {
                    ensureValue(args, i);
                    try {
                        date = LocalDate.parse(args[++i]);
                    } catch (DateTimeParseException e) {
                        System.err.println("Invalid date: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--archive-id", "-a" -> {
                    ensureValue(args, i);
                    archiveId = args[++i];
                }

                case "--tier", "-t" -> {
                    ensureValue(args, i);
                    try {
                        tier = DifficultyTier.parse(args[++i]);
                    } catch (IllegalArgumentException e) {
                        System.err.println(e.getMessage());
                        System.exit(1);
                    }
                }

                case "--puzzle-dir", "-p" -> {
                    ensureValue(args, i);
                    puzzleDir = args[++i];
                }

                case "--max-attempts" -> {
                    ensureValue(args, i);
                    try {
                        maxAttempts = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid max-attempts: " + args[i]);
                        System.exit(1);
                    }
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new GeneratorConfig(date, archiveId, tier, puzzleDir, maxAttempts);
    }

    public boolean isArchive() { return archiveId != null && !archiveId.isBlank(); }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: gitty-generate [options]

            Options:
              --date,         -d   Day to generate, yyyy-MM-dd (default: today UTC)
              --archive-id,   -a   Generate archive puzzle <id> instead of a daily one
              --tier,         -t   easy | medium | hard (default: easy)
              --puzzle-dir,   -p   Puzzle directory (default: ./data/puzzles)
              --max-attempts       Generation attempts before failing (default: 12)
              --help,         -h   Show this help message
            """);
        System.exit(0);
    }
}
