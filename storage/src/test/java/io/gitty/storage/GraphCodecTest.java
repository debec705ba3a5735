package io.gitty.storage;

import io.gitty.core.CommitGraph;
import io.gitty.core.FileTarget;
import io.gitty.core.Head;
import io.gitty.core.game.Command;
import io.gitty.core.game.CommandExecutor;
import io.gitty.core.game.GameState;
import io.gitty.core.puzzle.Puzzle;
import io.gitty.core.puzzle.PuzzleConstraints;
import io.gitty.storage.dto.GraphJson;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GraphCodecTest {

    private static CommitGraph played() {
        var puzzle = new Puzzle("p", null, 1, "main", List.of("main", "feature"),
                CommitGraph.withRoot("main", 0L), List.of(new FileTarget("far", "far.txt", "main", 50, false)),
                PuzzleConstraints.commandsOnly(20), 0, List.of());
        var state = GameState.start(puzzle, 0L);
        var ex = CommandExecutor.forPlay(Clock.fixed(Instant.ofEpochMilli(1234), ZoneOffset.UTC));
        for (Command c : List.of(Command.branch("feature"), Command.checkout("feature"), Command.commit("f1"),
                Command.commit("f2"), Command.checkout("main"), Command.commit("m1"), Command.merge("feature"))) {
            assertTrue(ex.apply(state, c).success(), c.describe());
        }
        return state.graph();
    }

    @Test
    void round_trip_through_json_text_preserves_order_and_content() {
        var g = played();

        String text = Json.write(GraphCodec.encode(g));
        var back = GraphCodec.decode(Json.read(text, GraphJson.class));

        assertEquals(List.copyOf(g.commits().keySet()), List.copyOf(back.commits().keySet()));
        assertEquals(List.copyOf(g.commits().values()), List.copyOf(back.commits().values()));
        assertEquals(List.copyOf(g.branches().values()), List.copyOf(back.branches().values()));
        assertEquals(g.head(), back.head());
    }

    @Test
    void wire_shape_uses_head_and_is_detached() {
        var g = CommitGraph.withRoot("main", 0L);
        g.setHead(Head.detached(g.root().id()));

        String text = Json.write(GraphCodec.encode(g));

        assertTrue(text.contains("\"isDetached\" : true"), text);
        assertTrue(text.contains("\"head\" : \"" + g.root().id() + "\""), text);
        assertTrue(GraphCodec.decode(Json.read(text, GraphJson.class)).isDetached());
    }

    @Test
    void decoding_rejects_broken_graphs() {
        var json = GraphCodec.encode(CommitGraph.withRoot("main", 0L));
        json.branches.get("main").tipCommitId = "missing";

        assertThrows(IllegalArgumentException.class, () -> GraphCodec.decode(json));
        assertThrows(IllegalArgumentException.class, () -> GraphCodec.decode(new GraphJson()));
    }
}
