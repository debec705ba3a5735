// file: src/main/java/io/gitty/storage/dto/CommitJson.java
package io.gitty.storage.dto;

import java.util.List;

public class CommitJson {
    public String id;
    public String message;
    public List<String> parentIds;
    public String originBranch;
    public int depth;
    public long timestamp;
    public List<String> fileIds;
}
