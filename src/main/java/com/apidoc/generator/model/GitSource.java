package com.apidoc.generator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Git coordinates of a source file.
 */
@Data
@NoArgsConstructor
public class GitSource {

    private String path;
    private String branch;
    private String repo;

    /**
     * Converts a {@code git@host:owner/repo.git} remote into its
     * {@code https://host/owner/repo/blob/branch/path} equivalent, assuming
     * GitHub-style URL conventions.
     */
    @JsonIgnore
    public String getBrowseUrl() {
        if (repo == null) {
            return null;
        }
        String url = repo;
        url = url.replaceFirst("^.*?@", "https://");
        url = url.replaceFirst("^(https://[^:/]*):", "$1/");
        url = url.replaceFirst("\\.git$", "");
        return url + "/blob/" + branch + "/" + path;
    }
}
