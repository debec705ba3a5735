// file: src/main/java/io/gitty/storage/dto/UndoSnapshotJson.java
package io.gitty.storage.dto;

import java.util.List;

public class UndoSnapshotJson {
    public GraphJson graph;
    public List<FileTargetJson> files;
    public String commandType;
    public int consecutiveCommits;
}
