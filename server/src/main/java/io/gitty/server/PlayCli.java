// file: src/main/java/io/gitty/server/PlayCli.java
package io.gitty.server;

import io.gitty.core.FileTarget;
import io.gitty.core.game.CommandResult;
import io.gitty.core.game.GameState;
import io.gitty.storage.FilePuzzleStore;
import io.gitty.storage.FileSessionStore;
import io.gitty.storage.ResultCodec;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Terminal front end for playing a stored puzzle.
 *
 * Usage:
 *   gitty-play [--puzzle-dir dir] [--session-dir dir] [--user id] [--json] <puzzleId>
 *
 * Reads one command per line from stdin:
 *   git commit -m "msg" | git branch x | git checkout x | git merge x | git rebase x | git undo
 *   status   show counters and files
 *   restart  start the puzzle over
 *   quit     leave; the session stays checkpointed
 */
public final class PlayCli {

    private final SessionService sessions;
    private final String puzzleId;
    private final String userId;
    private final boolean json;

    PlayCli(SessionService sessions, String puzzleId, String userId, boolean json) {
        this.sessions = sessions;
        this.puzzleId = puzzleId;
        this.userId = userId;
        this.json = json;
    }

    public static void main(String[] args) {
        String puzzleDir = "./data/puzzles";
        String sessionDir = "./data/sessions";
        String user = "local";
        boolean json = false;
        String puzzleId = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--puzzle-dir" -> puzzleDir = value(args, ++i);
                case "--session-dir" -> sessionDir = value(args, ++i);
                case "--user" -> user = value(args, ++i);
                case "--json" -> json = true;
                default -> {
                    if (args[i].startsWith("--") || puzzleId != null) usageAndExit("unexpected argument: " + args[i]);
                    puzzleId = args[i];
                }
            }
        }
        if (puzzleId == null) usageAndExit("missing puzzle id");

        var puzzles = new FilePuzzleStore(Path.of(puzzleDir));
        var service = new SessionService(puzzles, new FileSessionStore(Path.of(sessionDir), puzzles), Clock.systemUTC());
        try {
            var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            new PlayCli(service, puzzleId, user, json).run(in, System.out);
        } catch (IllegalArgumentException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        }
    }

    /** Play until end of input or "quit". */
    void run(BufferedReader in, PrintStream out) {
        GameState state = sessions.hydrate(puzzleId, userId);
        if (state == null) state = sessions.start(puzzleId, userId);
        printStatus(state, out);

        try {
            String line;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                switch (line) {
                    case "quit", "exit" -> {
                        return;
                    }
                    case "status" -> printStatus(sessions.hydrate(puzzleId, userId), out);
                    case "restart" -> printStatus(sessions.start(puzzleId, userId), out);
                    default -> handle(line, out);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read commands", e);
        }
    }

    private void handle(String line, PrintStream out) {
        CommandResult r = sessions.applyText(puzzleId, userId, line);
        if (json) {
            out.println(ResultCodec.toJson(r));
        } else {
            out.println(r.success() ? r.message() : "error: " + r.message());
            for (FileTarget f : r.filesCollected()) {
                out.println("  collected " + f.name());
            }
        }
        if (r.gameWon()) {
            GameReward reward = sessions.reward(puzzleId, userId);
            out.printf("Solved in %d commands (par %d): %s, score %d%n",
                    reward.commandsUsed(), reward.parScore(), reward.performance(), reward.score());
            out.println(reward.explanation());
        }
    }

    private static void printStatus(GameState s, PrintStream out) {
        int max = s.puzzle().constraints().maxCommands();
        out.printf("%s [%s] commands %d/%d, par %d, HEAD %s%n",
                s.puzzle().id(), s.status(), s.commandsUsed(), max, s.puzzle().parScore(), s.graph().head().ref());
        for (FileTarget f : s.files()) {
            out.printf("  %s %s at %s:%d%n", f.collected() ? "[x]" : "[ ]", f.name(), f.branch(), f.depth());
        }
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) usageAndExit(args[i - 1] + " requires a value");
        return args[i];
    }

    private static void usageAndExit(String msg) {
        System.err.println("error: " + msg);
        System.err.println("usage: gitty-play [--puzzle-dir dir] [--session-dir dir] [--user id] [--json] <puzzleId>");
        System.exit(1);
    }
}
