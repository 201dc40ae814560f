package com.apidoc.generator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A manually authored "see also" entry.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LinkInfo {

    @JsonProperty("linkId")
    private String linkId;
}
