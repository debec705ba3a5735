// file: src/main/java/io/gitty/core/puzzle/DifficultyTier.java
package io.gitty.core.puzzle;

import io.gitty.core.game.CommandType;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;

/**
 * Generation parameters per difficulty.
 * <p>
 * A tier fixes the declared branch set (trunk first), how many files are
 * placed and at which depths, the constraints handed to players, and the
 * par band a generated puzzle must land in to be accepted.
 */
public enum DifficultyTier {
    EASY(1, List.of("main", "feature"), 2, 1, 2, 4, 9,
            new PuzzleConstraints(10, PuzzleConstraints.UNLIMITED, PuzzleConstraints.UNLIMITED,
                    PuzzleConstraints.UNLIMITED, PuzzleConstraints.UNLIMITED, EnumSet.allOf(CommandType.class))),
    MEDIUM(2, List.of("main", "feature", "hotfix"), 3, 1, 3, 7, 13,
            new PuzzleConstraints(14, PuzzleConstraints.UNLIMITED, 6,
                    PuzzleConstraints.UNLIMITED, PuzzleConstraints.UNLIMITED, EnumSet.allOf(CommandType.class))),
    HARD(3, List.of("main", "feature", "bugfix"), 4, 1, 2, 9, 14,
            new PuzzleConstraints(14, 10, 6, 3, PuzzleConstraints.UNLIMITED, EnumSet.allOf(CommandType.class)));

    private final int level;
    private final List<String> branchNames;
    private final int fileCount;
    private final int minDepth;
    private final int maxDepth;
    private final int minPar;
    private final int maxPar;
    private final PuzzleConstraints constraints;

    DifficultyTier(int level, List<String> branchNames, int fileCount, int minDepth, int maxDepth,
                   int minPar, int maxPar, PuzzleConstraints constraints) {
        this.level = level;
        this.branchNames = branchNames;
        this.fileCount = fileCount;
        this.minDepth = minDepth;
        this.maxDepth = maxDepth;
        this.minPar = minPar;
        this.maxPar = maxPar;
        this.constraints = constraints;
    }

    public int level() { return level; }

    public String trunk() { return branchNames.get(0); }

    public List<String> branchNames() { return branchNames; }

    public int fileCount() { return fileCount; }

    public int minDepth() { return minDepth; }

    public int maxDepth() { return maxDepth; }

    public PuzzleConstraints constraints() { return constraints; }

    public boolean acceptsPar(int par) { return par >= minPar && par <= maxPar; }

    /** Case-insensitive lookup by name ("easy", "MEDIUM", ...). */
    public static DifficultyTier parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tier: " + name + " (expected easy, medium or hard)", e);
        }
    }
}
