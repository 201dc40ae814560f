package com.apidoc.generator.overwrite;

/**
 * What an overwrite document may do to a field of an existing item.
 */
public enum MergeRule {
    /** A non-blank value from the overwrite document replaces the generated one. */
    REPLACE,
    /** The field is never touched. */
    IGNORE
}
