package com.apidoc.generator.store;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import com.apidoc.generator.model.Item;
import com.apidoc.generator.model.ItemType;
import com.apidoc.generator.model.Reference;

/**
 * All documented items and externally referenced entities of one run, keyed
 * by UID.
 *
 * The store is filled completely before anything derived from it is
 * computed, and frozen before rendering starts; once frozen, further
 * additions fail.
 */
public class ItemStore {

    private final Map<String, Item> items = new LinkedHashMap<>();
    private final Map<String, Reference> references = new LinkedHashMap<>();
    private boolean frozen;

    /**
     * Adds an item. A later item with the same UID replaces the earlier one.
     */
    public void putItem(Item item) {
        checkNotFrozen();
        if (item.getUid() == null) {
            throw new IllegalArgumentException("Item has no UID: " + item.getName());
        }
        items.put(item.getUid(), item);
    }

    public void putReference(Reference reference) {
        checkNotFrozen();
        if (reference.getUid() == null) {
            throw new IllegalArgumentException("Reference has no UID: " + reference.getName());
        }
        references.put(reference.getUid(), reference);
    }

    public Optional<Item> findItem(String uid) {
        return uid == null ? Optional.empty() : Optional.ofNullable(items.get(uid));
    }

    public Optional<Reference> findReference(String uid) {
        return uid == null ? Optional.empty() : Optional.ofNullable(references.get(uid));
    }

    boolean containsItem(String uid) {
        return uid != null && items.containsKey(uid);
    }

    public Collection<Item> getItems() {
        return Collections.unmodifiableCollection(items.values());
    }

    public Collection<Reference> getReferences() {
        return Collections.unmodifiableCollection(references.values());
    }

    /**
     * Items in ordinal UID order.
     */
    public List<Item> getItemsSortedByUid() {
        return items.values().stream()
                .sorted(Comparator.comparing(Item::getUid))
                .collect(Collectors.toList());
    }

    public List<Item> getNamespaces() {
        return getItemsSortedByUid().stream()
                .filter(i -> i.getType() == ItemType.NAMESPACE)
                .collect(Collectors.toList());
    }

    public int itemCount() {
        return items.size();
    }

    public int referenceCount() {
        return references.size();
    }

    public void freeze() {
        frozen = true;
    }

    boolean isFrozen() {
        return frozen;
    }

    public void checkNotFrozen() {
        if (frozen) {
            throw new IllegalStateException("Item store is frozen; no further changes are allowed");
        }
    }
}
