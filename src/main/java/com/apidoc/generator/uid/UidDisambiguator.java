package com.apidoc.generator.uid;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.apidoc.generator.model.Item;
import com.apidoc.generator.store.ItemStore;

/**
 * Derives the identifiers that depend on the whole store: each item's short
 * UID and its case-collision suffix.
 *
 * Both are computed from whole-store groupings rather than per-item lookups,
 * so the result does not depend on the order items were loaded in.
 */
public class UidDisambiguator {
    private static final Logger log = LoggerFactory.getLogger(UidDisambiguator.class);

    /**
     * Assigns {@link Item#getShortUid()} on every item and returns the
     * case-collision suffixes.
     */
    public CaseSuffixIndex disambiguate(ItemStore store) {
        assignShortUids(store);
        return computeCaseSuffixes(store);
    }

    void assignShortUids(ItemStore store) {
        Map<String, Integer> overloadCounts = new HashMap<>();
        for (Item item : store.getItems()) {
            if (item.getOverload() != null) {
                overloadCounts.merge(item.getOverload(), 1, Integer::sum);
            }
        }

        for (Item item : store.getItems()) {
            item.setShortUid(shortUid(item, overloadCounts));
        }
    }

    private String shortUid(Item item, Map<String, Integer> overloadCounts) {
        String overload = item.getOverload();
        if (overload != null && overloadCounts.get(overload) == 1) {
            return stripTrailingMarkers(overload);
        }
        return item.getUid();
    }

    static String stripTrailingMarkers(String overload) {
        int end = overload.length();
        while (end > 0 && overload.charAt(end - 1) == '*') {
            end--;
        }
        return overload.substring(0, end);
    }

    CaseSuffixIndex computeCaseSuffixes(ItemStore store) {
        Map<String, List<String>> uidsByFoldedUid = new LinkedHashMap<>();
        for (Item item : store.getItems()) {
            uidsByFoldedUid
                    .computeIfAbsent(item.getUid().toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                    .add(item.getUid());
        }

        Map<String, String> suffixes = new HashMap<>();
        for (List<String> group : uidsByFoldedUid.values()) {
            if (group.size() < 2) {
                continue;
            }
            group.sort(Comparator.naturalOrder());
            for (int rank = 0; rank < group.size(); rank++) {
                suffixes.put(group.get(rank), Integer.toString(rank));
            }
            log.debug("Case-insensitive UID collision resolved with suffixes: {}", group);
        }

        return new CaseSuffixIndex(suffixes);
    }
}
