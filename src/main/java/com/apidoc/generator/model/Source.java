package com.apidoc.generator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where an item was declared, and where that source can be browsed.
 */
@Data
@NoArgsConstructor
public class Source {

    private String id;
    private String path;
    private int startLine;
    private GitSource remote;

    /**
     * Browsable URL of the declaration line, or {@code null} when the remote
     * repository is unknown.
     */
    @JsonIgnore
    public String getRepoUrl() {
        if (remote == null) {
            return null;
        }
        String fileUrl = remote.getBrowseUrl();
        if (fileUrl == null) {
            return null;
        }
        return fileUrl + "#L" + (startLine + 1);
    }
}
