package com.apidoc.generator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An annotation applied to an item, such as a deprecation marker.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Attribute {

    public static final String OBSOLETE_TYPE = "System.ObsoleteAttribute";

    private String type;
    private List<Argument> arguments = new ArrayList<>();

    public boolean isObsoleteMarker() {
        return OBSOLETE_TYPE.equals(type);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Argument {
        private String type;
        private String value;
    }
}
