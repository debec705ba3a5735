// file: src/main/java/io/gitty/core/game/Command.java
package io.gitty.core.game;

import java.util.Objects;

/**
 * Strongly typed command union. Wire payloads are decoded into one of these
 * before they reach the executor, so the executor never sees untyped input.
 * <p>
 * Argument presence is validated by the executor (a blank branch name is a
 * rejected command, not a programming error); only nulls are refused here.
 */
public interface Command {

    String DEFAULT_COMMIT_MESSAGE = "Commit";

    CommandType type();

    /** Command line form, e.g. {@code git merge feature}. */
    String describe();

    static Command commit(String message) { return new CommitCommand(message); }

    static Command branch(String name) { return new BranchCommand(name); }

    static Command checkout(String target) { return new CheckoutCommand(target); }

    static Command merge(String branch) { return new MergeCommand(branch); }

    static Command rebase(String onto) { return new RebaseCommand(onto); }

    static Command undo() { return UndoCommand.INSTANCE; }

    record CommitCommand(String message) implements Command {
        public CommitCommand {
            message = message == null || message.isBlank() ? DEFAULT_COMMIT_MESSAGE : message;
        }

        @Override public CommandType type() { return CommandType.COMMIT; }

        @Override public String describe() { return "git commit -m \"" + message + "\""; }
    }

    record BranchCommand(String name) implements Command {
        public BranchCommand {
            Objects.requireNonNull(name, "name");
        }

        @Override public CommandType type() { return CommandType.BRANCH; }

        @Override public String describe() { return "git branch " + name; }
    }

    record CheckoutCommand(String target) implements Command {
        public CheckoutCommand {
            Objects.requireNonNull(target, "target");
        }

        @Override public CommandType type() { return CommandType.CHECKOUT; }

        @Override public String describe() { return "git checkout " + target; }
    }

    record MergeCommand(String branch) implements Command {
        public MergeCommand {
            Objects.requireNonNull(branch, "branch");
        }

        @Override public CommandType type() { return CommandType.MERGE; }

        @Override public String describe() { return "git merge " + branch; }
    }

    record RebaseCommand(String onto) implements Command {
        public RebaseCommand {
            Objects.requireNonNull(onto, "onto");
        }

        @Override public CommandType type() { return CommandType.REBASE; }

        @Override public String describe() { return "git rebase " + onto; }
    }

    final class UndoCommand implements Command {
        static final UndoCommand INSTANCE = new UndoCommand();

        private UndoCommand() {
        }

        @Override public CommandType type() { return CommandType.UNDO; }

        @Override public String describe() { return "git undo"; }

        @Override public String toString() { return "UndoCommand[]"; }
    }
}
