package io.gitty.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class FilePuzzleStoreTest {

    @TempDir Path dir;

    @Test
    void missing_puzzle_is_null() {
        assertNull(new FilePuzzleStore(dir).get("puzzle-2030-01-01"));
    }

    @Test
    void stored_puzzle_is_visible_to_a_new_store_instance() throws IOException {
        var p = PuzzleCodecTest.sample();
        new FilePuzzleStore(dir).put(p);

        var back = new FilePuzzleStore(dir).get(p.id());

        assertNotNull(back);
        assertEquals(p.parScore(), back.parScore());
        assertEquals(p.solution(), back.solution());
        try (var files = Files.list(dir)) {
            assertEquals(1, files.filter(f -> !f.getFileName().toString().endsWith(".tmp")).count());
        }
        assertFalse(Files.exists(dir.resolve(p.id() + ".json.tmp")));
    }

    @Test
    void unsafe_ids_stay_inside_the_directory() {
        var store = new FilePuzzleStore(dir);

        Path p = store.pathFor("../../etc/passwd");

        assertEquals(dir, p.getParent());
    }
}
