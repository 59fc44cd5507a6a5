package com.graphql.evolution.schema;

import graphql.PublicApi;

import java.util.Optional;

/**
 * The kinds of named type that can be in a graphql type system
 */
@PublicApi
public enum TypeKind {

    OBJECT("OBJECT", "type"),
    INPUT_OBJECT("INPUT_OBJECT", "input"),
    INTERFACE("INTERFACE", "interface"),
    ENUM("ENUM", "enum"),
    UNION("UNION", "union"),
    SCALAR("SCALAR", "scalar");

    private final String introspectionName;
    private final String sdlKeyword;

    TypeKind(String introspectionName, String sdlKeyword) {
        this.introspectionName = introspectionName;
        this.sdlKeyword = sdlKeyword;
    }

    /**
     * @return the spelling used by the {@code kind} entry of an introspection result
     */
    public String getIntrospectionName() {
        return introspectionName;
    }

    public String getSdlKeyword() {
        return sdlKeyword;
    }

    public static Optional<TypeKind> fromIntrospectionName(String kind) {
        for (TypeKind typeKind : values()) {
            if (typeKind.introspectionName.equals(kind)) {
                return Optional.of(typeKind);
            }
        }
        return Optional.empty();
    }
}
