package com.apidoc.generator.render.model;

import lombok.Value;

/**
 * A two-column table row with Markdown already formatted for a cell.
 */
@Value
public class TableRow {
    String name;
    String description;
}
