package com.graphql.evolution.schema;

/**
 * Something with a name and a type reference, ie a field or an input value
 */
public interface TypedElement {

    String getName();

    TypeRef getType();
}
