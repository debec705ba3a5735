// file: src/main/java/io/gitty/storage/dto/ConstraintsJson.java
package io.gitty.storage.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** Limits left null are unlimited. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConstraintsJson {
    public int maxCommands;
    public Integer maxCommits;
    public Integer maxCheckouts;
    public Integer maxConsecutiveCommits;
    public Integer maxBranches;
    public List<String> allowedCommandTypes;
}
