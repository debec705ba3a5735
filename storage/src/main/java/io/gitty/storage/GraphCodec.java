// file: src/main/java/io/gitty/storage/GraphCodec.java
package io.gitty.storage;

import io.gitty.core.Branch;
import io.gitty.core.Commit;
import io.gitty.core.CommitGraph;
import io.gitty.core.FileTarget;
import io.gitty.core.Head;
import io.gitty.storage.dto.BranchJson;
import io.gitty.storage.dto.CommitJson;
import io.gitty.storage.dto.FileTargetJson;
import io.gitty.storage.dto.GraphJson;

import java.util.ArrayList;
import java.util.List;

/**
 * Graph and file-target conversion between the core model and its JSON DTOs.
 * <p>
 * Map order is preserved in both directions, so commit insertion order (which
 * prefix checkout depends on) survives a round trip. Decoding re-validates
 * every graph invariant.
 */
public final class GraphCodec {

    private GraphCodec() {
        // utility
    }

    public static GraphJson encode(CommitGraph graph) {
        var json = new GraphJson();
        for (Commit c : graph.commits().values()) {
            var cj = new CommitJson();
            cj.id = c.id();
            cj.message = c.message();
            cj.parentIds = c.parentIds();
            cj.originBranch = c.originBranch();
            cj.depth = c.depth();
            cj.timestamp = c.timestamp();
            cj.fileIds = c.fileIds();
            json.commits.put(c.id(), cj);
        }
        for (Branch b : graph.branches().values()) {
            var bj = new BranchJson();
            bj.name = b.name();
            bj.tipCommitId = b.tipCommitId();
            json.branches.put(b.name(), bj);
        }
        json.head = graph.head().ref();
        json.isDetached = graph.isDetached();
        return json;
    }

    /**
     * @throws IllegalArgumentException when the payload is incomplete or violates a graph invariant
     */
    public static CommitGraph decode(GraphJson json) {
        if (json == null || json.commits == null || json.branches == null || json.head == null) {
            throw new IllegalArgumentException("graph requires commits, branches and head");
        }
        try {
            var commits = new ArrayList<Commit>(json.commits.size());
            for (CommitJson cj : json.commits.values()) {
                commits.add(new Commit(cj.id, cj.message,
                        cj.parentIds == null ? List.of() : cj.parentIds,
                        cj.originBranch, cj.depth, cj.timestamp, cj.fileIds));
            }
            var branches = new ArrayList<Branch>(json.branches.size());
            for (var e : json.branches.entrySet()) {
                String name = e.getValue().name != null ? e.getValue().name : e.getKey();
                branches.add(new Branch(name, e.getValue().tipCommitId));
            }
            Head head = json.isDetached ? Head.detached(json.head) : Head.attached(json.head);
            return new CommitGraph(commits, branches, head);
        } catch (NullPointerException | IllegalStateException e) {
            throw new IllegalArgumentException("invalid graph: " + e.getMessage(), e);
        }
    }

    public static List<FileTargetJson> encodeFiles(List<FileTarget> files) {
        var out = new ArrayList<FileTargetJson>(files.size());
        for (FileTarget f : files) {
            var fj = new FileTargetJson();
            fj.id = f.id();
            fj.name = f.name();
            fj.branch = f.branch();
            fj.depth = f.depth();
            fj.collected = f.collected();
            out.add(fj);
        }
        return out;
    }

    public static List<FileTarget> decodeFiles(List<FileTargetJson> files) {
        if (files == null) return List.of();
        var out = new ArrayList<FileTarget>(files.size());
        for (FileTargetJson fj : files) {
            out.add(new FileTarget(fj.id, fj.name, fj.branch, fj.depth, fj.collected));
        }
        return out;
    }
}
