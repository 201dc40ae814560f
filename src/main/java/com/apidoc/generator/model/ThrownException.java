package com.apidoc.generator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An exception documented as thrown by an item.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ThrownException {
    private String type;
    private String description;
}
