package com.apidoc.generator.uid;

import java.util.Map;

import com.apidoc.generator.model.Item;

/**
 * Case-collision suffixes for every item of a store, precomputed in one pass.
 *
 * Items whose UID is unique under case-folding get the empty suffix. The
 * suffixes describe the store at one point in time and must not be reused
 * across runs.
 */
public class CaseSuffixIndex {

    private final Map<String, String> suffixByUid;

    public CaseSuffixIndex(Map<String, String> suffixByUid) {
        this.suffixByUid = Map.copyOf(suffixByUid);
    }

    public String suffixFor(String uid) {
        if (uid == null) {
            return "";
        }
        return suffixByUid.getOrDefault(uid, "");
    }

    public String suffixFor(Item item) {
        return suffixFor(item.getUid());
    }

    /**
     * Number of items that needed a non-empty suffix.
     */
    public int collidingItemCount() {
        return suffixByUid.size();
    }
}
