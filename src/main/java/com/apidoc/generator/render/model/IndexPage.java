package com.apidoc.generator.render.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * The landing document: every namespace, plus the items whose documentation
 * is incomplete.
 */
@Value
@Builder
public class IndexPage {

    @Singular
    List<TableRow> namespaces;

    @Singular("itemNeedingWork")
    List<String> itemsNeedingWork;
}
