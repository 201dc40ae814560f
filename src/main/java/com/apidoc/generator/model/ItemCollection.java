package com.apidoc.generator.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Contents of one per-UID metadata file.
 */
@Data
@NoArgsConstructor
public class ItemCollection {
    private List<Item> items = new ArrayList<>();
    private List<Reference> references = new ArrayList<>();
}
