package com.apidoc.generator.link;

import java.util.Objects;
import java.util.Optional;

import com.apidoc.generator.core.context.ResolutionContext;
import com.apidoc.generator.model.Item;
import com.apidoc.generator.model.Reference;
import com.apidoc.generator.path.PathResolver;

/**
 * Turns identifiers found in the metadata into readable, linked references.
 *
 * Resolution order: documented items, then external authorities, then bare
 * reference records, then the raw identifier. An array suffix {@code []} is
 * removed for lookup and restored in the display text.
 */
public class ReferenceLinker {

    private static final String ARRAY_SUFFIX = "[]";
    private static final String PARAMETER_LIST = "\\(.*\\)$";

    private final ResolutionContext context;
    private final PathResolver pathResolver;

    public ReferenceLinker(ResolutionContext context) {
        this.context = context;
        this.pathResolver = new PathResolver(context);
    }

    public ResolvedReference resolve(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return ResolvedReference.builder()
                    .kind(ReferenceKind.UNRESOLVED)
                    .displayText("")
                    .build();
        }

        boolean isArray = identifier.endsWith(ARRAY_SUFFIX);
        String uid = isArray ? identifier.substring(0, identifier.length() - ARRAY_SUFFIX.length()) : identifier;
        String arrayMarker = isArray ? ARRAY_SUFFIX : "";

        Optional<Item> item = context.getStore().findItem(uid);
        if (item.isPresent()) {
            String outputPath = pathResolver.outputPath(item.get());
            return ResolvedReference.builder()
                    .kind(ReferenceKind.INTERNAL)
                    .displayText(Objects.requireNonNullElse(item.get().getName(), uid) + arrayMarker)
                    .target(outputPath)
                    .href(context.internalHref(outputPath))
                    .build();
        }

        Optional<ExternalAuthority> authority = context.getAuthorities().find(uid);
        if (authority.isPresent()) {
            String linkUid = uid.replaceFirst(PARAMETER_LIST, "");
            String url = authority.get().urlFor(linkUid);
            return ResolvedReference.builder()
                    .kind(ReferenceKind.EXTERNAL)
                    .displayText(authority.get().displayNameFor(linkUid) + arrayMarker)
                    .target(url)
                    .href(url)
                    .build();
        }

        Optional<Reference> reference = context.getStore().findReference(uid);
        if (reference.isPresent()) {
            String name = reference.get().getName() != null ? reference.get().getName() : reference.get().getUid();
            return ResolvedReference.builder()
                    .kind(ReferenceKind.REFERENCE)
                    .displayText(name + arrayMarker)
                    .build();
        }

        return ResolvedReference.builder()
                .kind(ReferenceKind.UNRESOLVED)
                .displayText(uid + arrayMarker)
                .build();
    }

    /**
     * Markdown for the identifier; see {@link ResolvedReference#toMarkdown()}.
     */
    public String link(String identifier) {
        return resolve(identifier).toMarkdown();
    }

    public PathResolver getPathResolver() {
        return pathResolver;
    }
}
