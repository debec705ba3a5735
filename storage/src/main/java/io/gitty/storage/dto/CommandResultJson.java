// file: src/main/java/io/gitty/storage/dto/CommandResultJson.java
package io.gitty.storage.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommandResultJson {
    public boolean success;
    public String message;
    public String error;
    public GraphJson graph;
    public List<FileTargetJson> filesCollected;
    public boolean gameWon;
}
