package com.arenasync.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitReference(String branch, String tag, String commit) {
    public GitReference {
        branch = branch == null ? "" : branch.strip();
        tag = tag == null ? "" : tag.strip();
        commit = commit == null ? "" : commit.strip();
    }

    public static GitReference none() {
        return new GitReference("", "", "");
    }
}
