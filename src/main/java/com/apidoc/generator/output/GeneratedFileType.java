package com.apidoc.generator.output;

/**
 * High-level categories of generated documents.
 */
public enum GeneratedFileType {
    NAMESPACE,
    ITEM,
    INDEX
}
