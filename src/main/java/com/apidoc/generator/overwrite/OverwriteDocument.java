package com.apidoc.generator.overwrite;

import com.apidoc.generator.model.Item;

import lombok.NonNull;
import lombok.Value;

/**
 * A parsed overwrite file: the partial item its header describes, with the
 * body already substituted where the header asked for it.
 */
@Value
public class OverwriteDocument {

    @NonNull
    String source;

    @NonNull
    Item partial;

    public String getUid() {
        return partial.getUid();
    }
}
