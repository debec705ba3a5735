package io.gitty.storage.dto;

public class BranchJson {
    public String name;
    public String tipCommitId;
}
