package com.apidoc.generator.overwrite;

import java.util.function.BiConsumer;
import java.util.function.Function;

import com.apidoc.generator.model.Item;

/**
 * The string fields of an {@link Item} that overwrite documents can address,
 * in the order they are merged.
 *
 * UID and overload are never merged: output paths and short UIDs are
 * computed from them before overwrites are applied. Nested structures
 * (syntax, source) and lists are not listed and so are never merged.
 */
public enum OverwriteField {
    UID("uid", Item::getUid, Item::setUid, MergeRule.IGNORE),
    ID("id", Item::getId, Item::setId, MergeRule.REPLACE),
    NAME("name", Item::getName, Item::setName, MergeRule.REPLACE),
    NAME_WITH_TYPE("nameWithType", Item::getNameWithType, Item::setNameWithType, MergeRule.REPLACE),
    FULL_NAME("fullName", Item::getFullName, Item::setFullName, MergeRule.REPLACE),
    NAMESPACE("namespace", Item::getNamespace, Item::setNamespace, MergeRule.REPLACE),
    PARENT("parent", Item::getParent, Item::setParent, MergeRule.REPLACE),
    OVERLOAD("overload", Item::getOverload, Item::setOverload, MergeRule.IGNORE),
    SUMMARY("summary", Item::getSummary, Item::setSummary, MergeRule.REPLACE),
    REMARKS("remarks", Item::getRemarks, Item::setRemarks, MergeRule.REPLACE);

    private final String propertyName;
    private final Function<Item, String> getter;
    private final BiConsumer<Item, String> setter;
    private final MergeRule rule;

    OverwriteField(String propertyName, Function<Item, String> getter, BiConsumer<Item, String> setter,
                   MergeRule rule) {
        this.propertyName = propertyName;
        this.getter = getter;
        this.setter = setter;
        this.rule = rule;
    }

    public String getPropertyName() {
        return propertyName;
    }

    public MergeRule getRule() {
        return rule;
    }

    public String get(Item item) {
        return getter.apply(item);
    }

    public void set(Item item, String value) {
        setter.accept(item, value);
    }
}
