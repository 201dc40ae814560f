package com.apidoc.generator.link;

/**
 * How an identifier was resolved.
 */
public enum ReferenceKind {
    /** A documented item; links to its document. */
    INTERNAL,
    /** Owned by an external authority; links to its site. */
    EXTERNAL,
    /** Known only as a reference record; not linked. */
    REFERENCE,
    /** Unknown; rendered as the raw identifier. */
    UNRESOLVED
}
