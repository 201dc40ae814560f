package com.apidoc.generator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An entity referred to by the documented code but not owned by it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Reference {

    @JsonProperty("uid")
    private String uid;

    private String name;
}
