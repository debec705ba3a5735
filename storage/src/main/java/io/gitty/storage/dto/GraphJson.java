// file: src/main/java/io/gitty/storage/dto/GraphJson.java
package io.gitty.storage.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wire form of a commit graph.
 * {@code head} is a branch name, or a commit id when {@code isDetached} is true.
 */
public class GraphJson {
    public Map<String, CommitJson> commits = new LinkedHashMap<>();
    public Map<String, BranchJson> branches = new LinkedHashMap<>();
    public String head;
    public boolean isDetached;
}
