package com.apidoc.generator.render.model;

import java.util.List;

import lombok.Value;

/**
 * Child items of one type, listed under a heading such as "Methods".
 */
@Value
public class MemberGroup {
    String heading;
    List<TableRow> rows;
}
