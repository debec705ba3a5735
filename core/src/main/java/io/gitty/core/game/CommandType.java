// file: src/main/java/io/gitty/core/game/CommandType.java
package io.gitty.core.game;

/** The command vocabulary. Wire names are the lowercase tags used in JSON. */
public enum CommandType {
    COMMIT("commit"),
    BRANCH("branch"),
    CHECKOUT("checkout"),
    MERGE("merge"),
    REBASE("rebase"),
    UNDO("undo");

    private final String wireName;

    CommandType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }

    /**
     * @throws InvalidCommandException for unknown names
     */
    public static CommandType fromWireName(String name) {
        if (name != null) {
            for (CommandType t : values()) {
                if (t.wireName.equals(name)) return t;
            }
        }
        throw new InvalidCommandException("Unknown command: " + name);
    }
}
