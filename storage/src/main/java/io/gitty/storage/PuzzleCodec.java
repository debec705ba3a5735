// file: src/main/java/io/gitty/storage/PuzzleCodec.java
package io.gitty.storage;

import io.gitty.core.game.CommandType;
import io.gitty.core.puzzle.Puzzle;
import io.gitty.core.puzzle.PuzzleConstraints;
import io.gitty.storage.dto.ConstraintsJson;
import io.gitty.storage.dto.PuzzleJson;

import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

/** Puzzle artifact to and from {@link PuzzleJson}. */
public final class PuzzleCodec {

    private PuzzleCodec() {
        // utility
    }

    public static PuzzleJson encode(Puzzle p) {
        var json = new PuzzleJson();
        json.id = p.id();
        json.date = p.date() == null ? null : p.date().toString();
        json.difficulty = p.difficulty();
        json.trunkBranch = p.trunkBranch();
        json.branchNames = p.branchNames();
        json.initialGraph = GraphCodec.encode(p.initialGraph());
        json.fileTargets = GraphCodec.encodeFiles(p.fileTargets());
        json.constraints = encodeConstraints(p.constraints());
        json.parScore = p.parScore();
        json.solution = CommandCodec.encodeAll(p.solution());
        return json;
    }

    public static Puzzle decode(PuzzleJson json) {
        if (json == null || json.id == null) throw new IllegalArgumentException("puzzle requires an id");
        return new Puzzle(
                json.id,
                json.date == null ? null : LocalDate.parse(json.date),
                json.difficulty,
                json.trunkBranch == null ? Puzzle.DEFAULT_TRUNK : json.trunkBranch,
                json.branchNames == null ? List.of() : json.branchNames,
                GraphCodec.decode(json.initialGraph),
                GraphCodec.decodeFiles(json.fileTargets),
                decodeConstraints(json.constraints),
                json.parScore,
                CommandCodec.decodeAll(json.solution)
        );
    }

    public static String toJson(Puzzle p) { return Json.write(encode(p)); }

    public static Puzzle fromJson(String json) { return decode(Json.read(json, PuzzleJson.class)); }

    static ConstraintsJson encodeConstraints(PuzzleConstraints c) {
        var json = new ConstraintsJson();
        json.maxCommands = c.maxCommands();
        json.maxCommits = limit(c.maxCommits());
        json.maxCheckouts = limit(c.maxCheckouts());
        json.maxConsecutiveCommits = limit(c.maxConsecutiveCommits());
        json.maxBranches = limit(c.maxBranches());
        var allowed = EnumSet.noneOf(CommandType.class);
        allowed.addAll(c.allowedCommandTypes());
        json.allowedCommandTypes = allowed.stream().map(CommandType::wireName).toList();
        return json;
    }

    static PuzzleConstraints decodeConstraints(ConstraintsJson json) {
        if (json == null) throw new IllegalArgumentException("puzzle requires constraints");
        var allowed = EnumSet.noneOf(CommandType.class);
        if (json.allowedCommandTypes != null) {
            json.allowedCommandTypes.forEach(t -> allowed.add(CommandType.fromWireName(t)));
        }
        return new PuzzleConstraints(
                json.maxCommands,
                unlimitedIfNull(json.maxCommits),
                unlimitedIfNull(json.maxCheckouts),
                unlimitedIfNull(json.maxConsecutiveCommits),
                unlimitedIfNull(json.maxBranches),
                allowed);
    }

    private static Integer limit(int value) {
        return PuzzleConstraints.isLimited(value) ? value : null;
    }

    private static int unlimitedIfNull(Integer value) {
        return value == null ? PuzzleConstraints.UNLIMITED : value;
    }
}
