// file: src/main/java/io/gitty/server/GitCommandParser.java
package io.gitty.server;

import io.gitty.core.game.Command;
import io.gitty.core.game.InvalidCommandException;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a typed command line such as {@code git commit -m "wip"} into a {@link Command}.
 * <p>
 * Rules:
 *  - the line must start with "git ";
 *  - the subcommand is case-insensitive, its arguments are taken verbatim;
 *  - aliases: co = checkout, ci = commit, br = branch, mg = merge, rb = rebase;
 *  - commit takes an optional -m with a single- or double-quoted message,
 *    defaulting to "Commit";
 *  - branch, checkout, merge and rebase require one argument.
 */
public final class GitCommandParser {

    private static final Map<String, String> ALIASES = Map.of(
            "co", "checkout",
            "ci", "commit",
            "br", "branch",
            "mg", "merge",
            "rb", "rebase");

    private static final Pattern MESSAGE = Pattern.compile("-m\\s+([\"'])(.+?)\\1");

    private GitCommandParser() {
        // utility
    }

    /**
     * @throws InvalidCommandException if the line is not a supported command
     */
    public static Command parse(String line) {
        if (line == null || line.isBlank()) throw new InvalidCommandException("Empty command");
        String trimmed = line.trim();
        if (!trimmed.regionMatches(true, 0, "git ", 0, 4)) {
            throw new InvalidCommandException("Commands must start with 'git'");
        }
        String[] parts = trimmed.substring(4).trim().split("\\s+");
        String sub = parts[0].toLowerCase(Locale.ROOT);
        sub = ALIASES.getOrDefault(sub, sub);

        return switch (sub) {
            case "commit" -> Command.commit(message(trimmed));
            case "branch" -> Command.branch(argument(parts, sub));
            case "checkout" -> Command.checkout(argument(parts, sub));
            case "merge" -> Command.merge(argument(parts, sub));
            case "rebase" -> Command.rebase(argument(parts, sub));
            case "undo" -> Command.undo();
            default -> throw new InvalidCommandException("Unknown command: git " + parts[0]);
        };
    }

    private static String message(String line) {
        Matcher m = MESSAGE.matcher(line);
        return m.find() ? m.group(2) : Command.DEFAULT_COMMIT_MESSAGE;
    }

    private static String argument(String[] parts, String sub) {
        if (parts.length < 2 || parts[1].isBlank()) {
            throw new InvalidCommandException("git " + sub + " requires an argument");
        }
        return parts[1];
    }
}
