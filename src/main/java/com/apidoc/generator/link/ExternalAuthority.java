package com.apidoc.generator.link;

import java.util.Arrays;
import java.util.Map;
import java.util.stream.Collectors;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

/**
 * An external documentation site that owns every UID starting with
 * {@link #prefix}.
 *
 * The document id is the UID without its parameter list and without its
 * first {@link #segmentsToStrip} dotted segments; it replaces {@value #ID_PLACEHOLDER}
 * in {@link #urlTemplate}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExternalAuthority {

    public static final String ID_PLACEHOLDER = "{id}";

    private String name;
    private String prefix;
    private int segmentsToStrip;
    private String urlTemplate;

    /**
     * Short display names for well-known UIDs, e.g. System.String to string.
     */
    @Singular
    private Map<String, String> aliases;

    public boolean matches(String uid) {
        return uid != null && prefix != null && uid.startsWith(prefix);
    }

    /**
     * URL of the documentation page for a UID (parameter list already removed).
     */
    public String urlFor(String uid) {
        String[] segments = uid.split("\\.", -1);
        int skip = Math.min(segmentsToStrip, segments.length);
        String documentId = Arrays.stream(segments, skip, segments.length).collect(Collectors.joining("."));
        return urlTemplate.replace(ID_PLACEHOLDER, documentId);
    }

    /**
     * Alias for the UID if there is one, otherwise its last dotted segment.
     */
    public String displayNameFor(String uid) {
        if (aliases != null && aliases.containsKey(uid)) {
            return aliases.get(uid);
        }
        return uid.substring(uid.lastIndexOf('.') + 1);
    }
}
