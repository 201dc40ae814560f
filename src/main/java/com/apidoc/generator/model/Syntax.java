package com.apidoc.generator.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Declaration details of an item: signature text, parameters and return.
 */
@Data
@NoArgsConstructor
public class Syntax {

    private String content;
    private String remarks;
    private List<Parameter> parameters = new ArrayList<>();
    private List<TypeParameter> typeParameters = new ArrayList<>();

    @JsonProperty("return")
    private ReturnValue returnValue;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Parameter {
        @JsonProperty("id")
        private String id;
        private String type;
        private String description;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TypeParameter {
        @JsonProperty("id")
        private String id;
        private String description;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReturnValue {
        private String type;
        private String description;
    }
}
