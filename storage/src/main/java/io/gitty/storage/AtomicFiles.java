// file: src/main/java/io/gitty/storage/AtomicFiles.java
package io.gitty.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Whole-file writes that readers never observe half done:
 * write "name.tmp" first, then move it over "name" with ATOMIC_MOVE.
 */
final class AtomicFiles {

    private AtomicFiles() {
        // utility
    }

    static void createDirectories(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create directory " + dir, e);
        }
    }

    static void write(Path dst, String content) {
        Path tmp = dst.resolveSibling(dst.getFileName() + ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            Files.move(tmp, dst, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + dst, e);
        }
    }

    /** File contents, or null if the file does not exist. */
    static String readIfExists(Path path) {
        if (!Files.exists(path)) return null;
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    /** Restrict a key to characters that are safe in a file name. */
    static String safeName(String key) {
        return key.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
