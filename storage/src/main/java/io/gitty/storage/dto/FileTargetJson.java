// file: src/main/java/io/gitty/storage/dto/FileTargetJson.java
package io.gitty.storage.dto;

public class FileTargetJson {
    public String id;
    public String name;
    public String branch;
    public int depth;
    public boolean collected;
}
