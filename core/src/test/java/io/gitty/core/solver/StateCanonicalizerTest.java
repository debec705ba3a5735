package io.gitty.core.solver;

import io.gitty.core.Branch;
import io.gitty.core.Commit;
import io.gitty.core.CommitGraph;
import io.gitty.core.FileTarget;
import io.gitty.core.Head;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateCanonicalizerTest {

    private static CommitGraph line(String rootId, String childId, Head head) {
        return new CommitGraph(
                List.of(new Commit(rootId, "r", List.of(), "main", 0, 0L, List.of()),
                        new Commit(childId, "c", List.of(rootId), "main", 1, 5L, List.of("file-1"))),
                List.of(new Branch("main", childId), new Branch("feature", rootId)),
                head);
    }

    private static final List<FileTarget> FILES = List.of(new FileTarget("file-1", "a", "main", 1, true));

    @Test
    void concrete_commit_ids_do_not_matter() {
        var a = StateCanonicalizer.signature(line("aaaa", "bbbb", Head.attached("main")), FILES);
        var b = StateCanonicalizer.signature(line("1111", "2222", Head.attached("main")), FILES);

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(List.of("feature=1", "main=0"), a.branches());
        assertEquals("A:main", a.head());
    }

    @Test
    void head_position_and_collection_are_part_of_the_signature() {
        var attached = StateCanonicalizer.signature(line("r", "c", Head.attached("main")), FILES);
        var onFeature = StateCanonicalizer.signature(line("r", "c", Head.attached("feature")), FILES);
        var detached = StateCanonicalizer.signature(line("r", "c", Head.detached("c")), FILES);
        var uncollected = StateCanonicalizer.signature(line("r", "c", Head.attached("main")),
                List.of(new FileTarget("file-1", "a", "main", 1, false)));

        assertNotEquals(attached, onFeature);
        assertNotEquals(attached, detached);
        assertNotEquals(attached, uncollected);
        assertEquals("D:0", detached.head());
    }

    @Test
    void orphaned_commits_are_ignored() {
        var plain = line("r", "c", Head.attached("main"));
        var withOrphan = line("r", "c", Head.attached("main"));
        withOrphan.addCommit(new Commit("o", "orphan", List.of("r"), "feature", 1, 0L, List.of()));

        assertEquals(StateCanonicalizer.signature(plain, FILES), StateCanonicalizer.signature(withOrphan, FILES));
    }

    @Test
    void shape_distinguishes_where_files_were_committed() {
        var carried = line("r", "c", Head.attached("main"));
        var commits = new ArrayList<>(carried.commits().values());
        commits.set(1, new Commit("c", "c", List.of("r"), "main", 1, 5L, List.of()));
        var empty = new CommitGraph(commits, carried.branches().values(), carried.head());

        assertNotEquals(StateCanonicalizer.signature(carried, FILES), StateCanonicalizer.signature(empty, FILES));
    }
}
