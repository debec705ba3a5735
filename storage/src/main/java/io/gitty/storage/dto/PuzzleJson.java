// file: src/main/java/io/gitty/storage/dto/PuzzleJson.java
package io.gitty.storage.dto;

import java.util.List;

public class PuzzleJson {
    public String id;
    public String date;           // ISO yyyy-MM-dd, null for archive puzzles
    public int difficulty;
    public String trunkBranch;
    public List<String> branchNames;
    public GraphJson initialGraph;
    public List<FileTargetJson> fileTargets;
    public ConstraintsJson constraints;
    public int parScore;
    public List<CommandJson> solution;
}
