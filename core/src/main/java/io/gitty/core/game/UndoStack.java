// file: src/main/java/io/gitty/core/game/UndoStack.java
package io.gitty.core.game;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded LIFO of {@link UndoSnapshot}s.
 * <p>
 * The bound is the puzzle's command limit, so within a game it is never hit;
 * if it is, the oldest snapshot is dropped.
 */
public final class UndoStack {
    private final Deque<UndoSnapshot> stack = new ArrayDeque<>();
    private final int capacity;

    public UndoStack(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
    }

    public void push(UndoSnapshot snapshot) {
        if (stack.size() >= capacity) {
            stack.removeLast();
        }
        stack.push(snapshot);
    }

    /** Most recent snapshot, removed; null when empty. */
    public UndoSnapshot pop() { return stack.poll(); }

    public UndoSnapshot peek() { return stack.peek(); }

    public boolean isEmpty() { return stack.isEmpty(); }

    public int size() { return stack.size(); }

    public int capacity() { return capacity; }

    /** Snapshots oldest first, the order persistence writes them in. */
    public List<UndoSnapshot> oldestFirst() {
        var list = new ArrayList<UndoSnapshot>(stack.size());
        stack.descendingIterator().forEachRemaining(list::add);
        return list;
    }

    /** Rebuild a stack from snapshots given oldest first. */
    public static UndoStack of(int capacity, List<UndoSnapshot> oldestFirst) {
        var s = new UndoStack(capacity);
        oldestFirst.forEach(s::push);
        return s;
    }
}
