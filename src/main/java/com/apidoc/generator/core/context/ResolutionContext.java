package com.apidoc.generator.core.context;

import com.apidoc.generator.link.AuthorityTable;
import com.apidoc.generator.store.ItemStore;
import com.apidoc.generator.uid.CaseSuffixIndex;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Everything path and reference resolution reads, passed explicitly so that
 * resolution can run against synthetic stores.
 */
@Getter
@Builder(toBuilder = true)
public final class ResolutionContext {

    public static final String DEFAULT_LINK_PREFIX = "/api";

    @NonNull
    private final ItemStore store;

    @NonNull
    private final CaseSuffixIndex caseSuffixes;

    @NonNull
    private final AuthorityTable authorities;

    /**
     * Prepended to output paths when linking to internal documents.
     */
    @NonNull
    @Builder.Default
    private final String linkPrefix = DEFAULT_LINK_PREFIX;

    /**
     * Hyperlink target of an internal document, given its output path.
     */
    public String internalHref(String outputPath) {
        String prefix = linkPrefix.endsWith("/") ? linkPrefix.substring(0, linkPrefix.length() - 1) : linkPrefix;
        return (prefix.isEmpty() ? "" : prefix + "/") + outputPath + ".md";
    }
}
