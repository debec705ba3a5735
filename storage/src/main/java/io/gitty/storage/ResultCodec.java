// file: src/main/java/io/gitty/storage/ResultCodec.java
package io.gitty.storage;

import io.gitty.core.game.CommandResult;
import io.gitty.storage.dto.CommandResultJson;

/** {@link CommandResult} to its response shape; failures carry no graph. */
public final class ResultCodec {

    private ResultCodec() {
        // utility
    }

    public static CommandResultJson encode(CommandResult r) {
        var json = new CommandResultJson();
        json.success = r.success();
        json.message = r.message();
        json.error = r.error() == null ? null : r.error().name();
        json.graph = r.graph() == null ? null : GraphCodec.encode(r.graph());
        json.filesCollected = GraphCodec.encodeFiles(r.filesCollected());
        json.gameWon = r.gameWon();
        return json;
    }

    public static String toJson(CommandResult r) { return Json.write(encode(r)); }
}
