// file: src/main/java/io/gitty/storage/dto/CommandJson.java
package io.gitty.storage.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/** {"type": "...", ...}; only the argument matching the type is set. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CommandJson {
    public String type;
    public String message;
    public String name;
    public String target;
    public String branch;
    public String onto;
}
