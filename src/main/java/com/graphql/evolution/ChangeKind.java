package com.graphql.evolution;

import graphql.PublicApi;

/**
 * A classification of schema changes.
 */
@PublicApi
public enum ChangeKind {
    /**
     * The new API has a type the old one did not
     */
    TYPE_ADDED,
    /**
     * The new API is missing a type, or has changed its kind
     */
    TYPE_REMOVED,
    /**
     * The new API has added a field or input field
     */
    FIELD_ADDED,
    /**
     * The new API is missing a field or input field
     */
    FIELD_REMOVED,
    /**
     * The new API has changed the type of a field or input field
     */
    FIELD_TYPE_CHANGED,
    /**
     * The new API has added an enum value
     */
    ENUM_VALUE_ADDED,
    /**
     * The new API is missing an enum value
     */
    ENUM_VALUE_REMOVED,
    /**
     * The new API has added a field argument
     */
    ARGUMENT_ADDED,
    /**
     * The new API is missing a field argument
     */
    ARGUMENT_REMOVED;

    public boolean isAddition() {
        return this == TYPE_ADDED || this == FIELD_ADDED || this == ENUM_VALUE_ADDED || this == ARGUMENT_ADDED;
    }

    public boolean isRemoval() {
        return this == TYPE_REMOVED || this == FIELD_REMOVED || this == ENUM_VALUE_REMOVED || this == ARGUMENT_REMOVED;
    }
}
