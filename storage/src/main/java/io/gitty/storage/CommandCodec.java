// file: src/main/java/io/gitty/storage/CommandCodec.java
package io.gitty.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.gitty.core.game.Command;
import io.gitty.core.game.CommandType;
import io.gitty.core.game.InvalidCommandException;
import io.gitty.storage.dto.CommandJson;

import java.util.ArrayList;
import java.util.List;

/**
 * Wire command payloads to and from the typed {@link Command} union.
 * <p>
 * Shapes:
 *   {"type": "commit",   "message": "..."}   message optional
 *   {"type": "branch",   "name": "..."}
 *   {"type": "checkout", "target": "..."}
 *   {"type": "merge",    "branch": "..."}
 *   {"type": "rebase",   "onto": "..."}
 *   {"type": "undo"}
 * <p>
 * Decoding is the validation boundary: anything that does not fit one of
 * these shapes raises {@link InvalidCommandException} before it can reach
 * the executor.
 */
public final class CommandCodec {

    private CommandCodec() {
        // utility
    }

    public static CommandJson encode(Command command) {
        var json = new CommandJson();
        json.type = command.type().wireName();
        if (command instanceof Command.CommitCommand c) {
            json.message = c.message();
        } else if (command instanceof Command.BranchCommand b) {
            json.name = b.name();
        } else if (command instanceof Command.CheckoutCommand c) {
            json.target = c.target();
        } else if (command instanceof Command.MergeCommand m) {
            json.branch = m.branch();
        } else if (command instanceof Command.RebaseCommand r) {
            json.onto = r.onto();
        }
        return json;
    }

    public static Command decode(CommandJson json) {
        if (json == null) throw new InvalidCommandException("Command payload is required");
        if (json.type == null) throw new InvalidCommandException("Command type is required");
        CommandType type = CommandType.fromWireName(json.type);
        return switch (type) {
            case COMMIT -> Command.commit(json.message);
            case BRANCH -> Command.branch(require(json.name, "branch", "name"));
            case CHECKOUT -> Command.checkout(require(json.target, "checkout", "target"));
            case MERGE -> Command.merge(require(json.branch, "merge", "branch"));
            case REBASE -> Command.rebase(require(json.onto, "rebase", "onto"));
            case UNDO -> Command.undo();
        };
    }

    /** Parse and validate a raw JSON payload. */
    public static Command decode(String payload) {
        JsonNode node;
        try {
            node = Json.mapper().readTree(payload == null ? "" : payload);
        } catch (JsonProcessingException e) {
            throw new InvalidCommandException("Malformed command payload: " + e.getOriginalMessage());
        }
        if (node == null || !node.isObject()) {
            throw new InvalidCommandException("Command payload must be a JSON object");
        }
        var json = new CommandJson();
        json.type = text(node, "type");
        json.message = text(node, "message");
        json.name = text(node, "name");
        json.target = text(node, "target");
        json.branch = text(node, "branch");
        json.onto = text(node, "onto");
        return decode(json);
    }

    public static List<CommandJson> encodeAll(List<Command> commands) {
        var out = new ArrayList<CommandJson>(commands.size());
        commands.forEach(c -> out.add(encode(c)));
        return out;
    }

    public static List<Command> decodeAll(List<CommandJson> commands) {
        if (commands == null) return List.of();
        var out = new ArrayList<Command>(commands.size());
        commands.forEach(c -> out.add(decode(c)));
        return out;
    }

    private static String require(String value, String type, String field) {
        if (value == null) {
            throw new InvalidCommandException("'" + type + "' requires field '" + field + "'");
        }
        return value;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        if (!v.isTextual()) throw new InvalidCommandException("Field '" + field + "' must be a string");
        return v.asText();
    }
}
