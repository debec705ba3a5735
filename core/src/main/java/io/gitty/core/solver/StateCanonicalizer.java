// file: src/main/java/io/gitty/core/solver/StateCanonicalizer.java
package io.gitty.core.solver;

import io.gitty.core.Branch;
import io.gitty.core.Commit;
import io.gitty.core.CommitGraph;
import io.gitty.core.FileTarget;
import io.gitty.core.game.GameState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces a position to a {@link StateSignature}.
 * <p>
 * Commits are renamed to ordinals by a fixed traversal: HEAD's commit first,
 * then each branch tip in name order, breadth-first over parents in parent
 * order. Two graphs that differ only in commit ids therefore produce equal
 * signatures. Commits no ref can reach are left out; they cannot influence
 * any later move the solver considers.
 */
public final class StateCanonicalizer {

    private StateCanonicalizer() {
        // utility
    }

    public static StateSignature signature(GameState state) {
        return signature(state.graph(), state.files());
    }

    public static StateSignature signature(CommitGraph graph, List<FileTarget> files) {
        var sortedBranches = new TreeMap<String, Branch>(graph.branches());
        Map<String, Integer> ordinals = new LinkedHashMap<>();

        Commit current = graph.currentCommit();
        if (current != null) number(graph, current.id(), ordinals);
        for (Branch b : sortedBranches.values()) {
            number(graph, b.tipCommitId(), ordinals);
        }

        var branches = new ArrayList<String>(sortedBranches.size());
        for (Branch b : sortedBranches.values()) {
            branches.add(b.name() + "=" + ordinals.get(b.tipCommitId()));
        }

        String head = graph.isDetached()
                ? "D:" + ordinals.get(graph.head().ref())
                : "A:" + graph.head().ref();

        var collected = new ArrayList<String>();
        for (FileTarget f : files) {
            if (f.collected()) collected.add(f.id());
        }
        collected.sort(null);

        var shape = new ArrayList<String>(ordinals.size());
        for (String id : ordinals.keySet()) {
            Commit c = graph.commit(id);
            var sb = new StringBuilder().append(c.depth()).append('<');
            for (int i = 0; i < c.parentIds().size(); i++) {
                if (i > 0) sb.append(',');
                sb.append(ordinals.get(c.parentIds().get(i)));
            }
            sb.append('>').append(c.fileIds());
            shape.add(sb.toString());
        }
        return new StateSignature(branches, head, collected, shape);
    }

    private static void number(CommitGraph graph, String startId, Map<String, Integer> ordinals) {
        if (ordinals.containsKey(startId)) return;
        var queue = new ArrayDeque<String>();
        ordinals.put(startId, ordinals.size());
        queue.add(startId);
        while (!queue.isEmpty()) {
            Commit c = graph.commit(queue.poll());
            if (c == null) continue;
            for (String p : c.parentIds()) {
                if (!ordinals.containsKey(p)) {
                    ordinals.put(p, ordinals.size());
                    queue.add(p);
                }
            }
        }
    }
}
