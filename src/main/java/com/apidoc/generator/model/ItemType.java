package com.apidoc.generator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Kinds of documentable items found in the metadata.
 */
public enum ItemType {
    NAMESPACE("Namespace", "Namespaces"),
    ENUM("Enum", "Enums"),
    FIELD("Field", "Fields"),
    METHOD("Method", "Methods"),
    CLASS("Class", "Classes"),
    STRUCT("Struct", "Structs"),
    CONSTRUCTOR("Constructor", "Constructors"),
    PROPERTY("Property", "Properties"),
    DELEGATE("Delegate", "Delegates"),
    OPERATOR("Operator", "Operators"),
    INTERFACE("Interface", "Interfaces");

    private static final Set<ItemType> MEMBER_TYPES =
            EnumSet.of(CONSTRUCTOR, FIELD, METHOD, OPERATOR, PROPERTY);

    private static final Set<ItemType> RETURNING_TYPES =
            EnumSet.of(DELEGATE, OPERATOR, METHOD);

    private final String displayName;
    private final String pluralName;

    ItemType(String displayName, String pluralName) {
        this.displayName = displayName;
        this.pluralName = pluralName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getPluralName() {
        return pluralName;
    }

    /**
     * Members live inside a type and are written next to it rather than in
     * their own directory.
     */
    public boolean isMember() {
        return MEMBER_TYPES.contains(this);
    }

    /**
     * Whether a return type is shown in the syntax section. Properties
     * technically have one too, but it is not presented like a method's.
     */
    public boolean hasReturnSection() {
        return RETURNING_TYPES.contains(this);
    }
}
