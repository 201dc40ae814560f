package com.apidoc.generator.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One top-level entry of the table of contents, usually a namespace, with
 * the UIDs of the types it contains.
 */
@Data
@NoArgsConstructor
public class TocEntry {

    @JsonProperty("uid")
    private String uid;

    private String name;
    private List<Child> items = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Child {
        @JsonProperty("uid")
        private String uid;
        private String name;
    }
}
