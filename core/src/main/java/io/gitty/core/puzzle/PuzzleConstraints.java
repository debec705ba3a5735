// file: src/main/java/io/gitty/core/puzzle/PuzzleConstraints.java
package io.gitty.core.puzzle;

import io.gitty.core.game.CommandType;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Per-puzzle quotas and command whitelist.
 * <p>
 *  - maxCommands:           successful commands per session (undo gives slots back).
 *  - maxCommits:            total commits in the graph, checked by {@code commit}.
 *  - maxCheckouts:          successful checkouts per session.
 *  - maxConsecutiveCommits: back-to-back {@code commit} commands.
 *  - maxBranches:           total branches in the graph, checked by {@code branch}.
 *  - allowedCommandTypes:   anything else is rejected before quotas are looked at.
 * <p>
 * A limit of {@link #UNLIMITED} is never enforced.
 */
public record PuzzleConstraints(
        int maxCommands,
        int maxCommits,
        int maxCheckouts,
        int maxConsecutiveCommits,
        int maxBranches,
        Set<CommandType> allowedCommandTypes
) {
    public static final int UNLIMITED = Integer.MAX_VALUE;

    public PuzzleConstraints {
        if (maxCommands <= 0) throw new IllegalArgumentException("maxCommands must be > 0");
        if (maxCommits <= 0 || maxCheckouts < 0 || maxConsecutiveCommits <= 0 || maxBranches <= 0) {
            throw new IllegalArgumentException("limits must be positive");
        }
        Objects.requireNonNull(allowedCommandTypes, "allowedCommandTypes");
        allowedCommandTypes = allowedCommandTypes.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(allowedCommandTypes));
    }

    /** Every command allowed; only the command count is limited. */
    public static PuzzleConstraints commandsOnly(int maxCommands) {
        return new PuzzleConstraints(maxCommands, UNLIMITED, UNLIMITED, UNLIMITED, UNLIMITED,
                EnumSet.allOf(CommandType.class));
    }

    public boolean allows(CommandType type) { return allowedCommandTypes.contains(type); }

    public static boolean isLimited(int limit) { return limit != UNLIMITED; }
}
