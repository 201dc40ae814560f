package com.apidoc.generator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A documentable entity with full structured metadata. Each item that is not
 * suppressed gets its own output document.
 */
@Data
@NoArgsConstructor
public class Item {

    @JsonProperty("uid")
    private String uid;

    @JsonProperty("id")
    private String id;

    private ItemType type;
    private String name;
    private String nameWithType;
    private String fullName;
    private String namespace;
    private String parent;
    private String overload;

    private String summary;
    private String remarks;
    private List<String> example = new ArrayList<>();

    private List<String> children = new ArrayList<>();
    private List<String> inheritedMembers = new ArrayList<>();
    private List<String> assemblies = new ArrayList<>();

    private Syntax syntax;
    private List<ThrownException> exceptions = new ArrayList<>();
    private List<Attribute> attributes = new ArrayList<>();

    @JsonProperty("seealso")
    private List<LinkInfo> seeAlso = new ArrayList<>();

    private Source source;

    private boolean doNotDocument;

    /**
     * Collapsed identifier used in member file names. Assigned once the whole
     * store is known.
     */
    @JsonIgnore
    private String shortUid;

    /**
     * Title-friendly name: the parent UID joined with the last segment of the
     * full name, without parameters and without the namespace prefix.
     */
    @JsonIgnore
    public String getDisplayName() {
        if (fullName == null) {
            return null;
        }
        String withoutParameters = fullName.replaceFirst("\\(.*\\)$", "");
        String lastSegment = withoutParameters.substring(withoutParameters.lastIndexOf('.') + 1);
        String displayName = parent != null ? parent + "." + lastSegment : lastSegment;

        if (namespace != null && displayName.startsWith(namespace + ".")) {
            return displayName.substring(namespace.length() + 1);
        }
        return displayName;
    }

    /**
     * Message of the deprecation marker, if the item carries one. An empty
     * string means the item is obsolete without an explanation.
     */
    @JsonIgnore
    public Optional<String> getObsoleteMessage() {
        if (attributes == null) {
            return Optional.empty();
        }
        return attributes.stream()
                .filter(Attribute::isObsoleteMarker)
                .findFirst()
                .map(a -> a.getArguments() == null || a.getArguments().isEmpty()
                        || a.getArguments().get(0).getValue() == null
                        ? ""
                        : a.getArguments().get(0).getValue());
    }

    @JsonIgnore
    public boolean isObsolete() {
        return getObsoleteMessage().isPresent();
    }
}
