package com.apidoc.generator.render.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Everything the item template prints, with links resolved. Optional
 * sections are {@code null} or empty when absent.
 */
@Value
@Builder
public class ItemPage {

    @NonNull
    String title;

    int weight;

    @NonNull
    String metadataLine;

    String obsoleteNotice;

    String summary;

    String syntaxContent;

    String remarks;

    @Singular
    List<String> examples;

    @Singular
    List<TableRow> typeParameters;

    @Singular
    List<TableRow> parameters;

    String returnType;

    String syntaxRemarks;

    @Singular
    List<MemberGroup> memberGroups;

    @Singular
    List<TableRow> exceptions;

    @Singular("seeAlsoEntry")
    List<String> seeAlso;

    String sourceLine;
}
