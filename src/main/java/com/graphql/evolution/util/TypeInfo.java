package com.graphql.evolution.util;

import com.graphql.evolution.schema.TypeRef;

/**
 * Walks the list and non null wrappers of a {@link TypeRef} one level at a time
 */
public class TypeInfo {

    public static TypeInfo typeInfo(TypeRef type) {
        return new TypeInfo(type);
    }

    private final TypeRef rawType;
    private final TypeRef.Named typeName;

    TypeInfo(TypeRef type) {
        this.rawType = type;
        while (!(type instanceof TypeRef.Named)) {
            if (type instanceof TypeRef.NonNull) {
                type = ((TypeRef.NonNull) type).getOfType();
            }
            if (type instanceof TypeRef.ListOf) {
                type = ((TypeRef.ListOf) type).getOfType();
            }
        }
        this.typeName = (TypeRef.Named) type;
    }

    public String getName() {
        return typeName.getName();
    }

    public boolean isList() {
        return rawType instanceof TypeRef.ListOf;
    }

    public boolean isNonNull() {
        return rawType instanceof TypeRef.NonNull;
    }

    public boolean isPlain() {
        return !isList() && !isNonNull();
    }

    /**
     * @param type the type reference
     *
     * @return the canonical text form, for example {@code [String!]!}
     */
    public static String getAstDesc(TypeRef type) {
        if (type instanceof TypeRef.NonNull) {
            return getAstDesc(((TypeRef.NonNull) type).getOfType()) + "!";
        }
        if (type instanceof TypeRef.ListOf) {
            return "[" + getAstDesc(((TypeRef.ListOf) type).getOfType()) + "]";
        }
        return ((TypeRef.Named) type).getName();
    }

    public TypeInfo unwrapOne() {
        if (rawType instanceof TypeRef.NonNull) {
            return typeInfo(((TypeRef.NonNull) rawType).getOfType());
        }
        if (rawType instanceof TypeRef.ListOf) {
            return typeInfo(((TypeRef.ListOf) rawType).getOfType());
        }
        return this;
    }

    @Override
    public String toString() {
        return "TypeInfo{" +
                "typename=" + getName() +
                ", nonNull=" + isNonNull() +
                ", list=" + isList() +
                '}';
    }
}
