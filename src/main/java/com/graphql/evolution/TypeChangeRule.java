package com.graphql.evolution;

import com.graphql.evolution.schema.TypeRef;
import com.graphql.evolution.util.TypeInfo;
import graphql.PublicApi;

import java.util.HashMap;
import java.util.Map;

import static com.graphql.evolution.util.TypeInfo.typeInfo;

/**
 * Decides whether changing the type of a field from one type reference to another breaks existing consumers.
 */
@PublicApi
public enum TypeChangeRule {

    /**
     * Only the base names count : the change is safe when both sit in the same scalar compatibility class.  Each of
     * String, Int, Float, Boolean and ID is a class of its own, anything else is always breaking.  Wrappers are
     * ignored, so {@code Int} to {@code Int!} is safe but so is {@code Int} to {@code [Int]}.
     */
    SCALAR_CLASS {
        @Override
        public boolean isBreaking(TypeRef oldType, TypeRef newType, boolean inputPosition) {
            String oldClass = COMPATIBILITY_CLASSES.get(typeInfo(oldType).getName());
            String newClass = COMPATIBILITY_CLASSES.get(typeInfo(newType).getName());
            return oldClass == null || !oldClass.equals(newClass);
        }
    },

    /**
     * The base names must be equal and the wrappers are compared level by level.  An output field may become
     * stricter (non null) but not looser, an input field may become looser but not stricter, and the list
     * structure may not change at all.
     */
    WRAPPER_AWARE {
        @Override
        public boolean isBreaking(TypeRef oldType, TypeRef newType, boolean inputPosition) {
            TypeInfo oldTypeInfo = typeInfo(oldType);
            TypeInfo newTypeInfo = typeInfo(newType);

            if (!oldTypeInfo.getName().equals(newTypeInfo.getName())) {
                return true;
            }

            while (true) {
                if (oldTypeInfo.isNonNull() && newTypeInfo.isNonNull()) {
                    oldTypeInfo = oldTypeInfo.unwrapOne();
                    newTypeInfo = newTypeInfo.unwrapOne();
                } else if (oldTypeInfo.isNonNull() && !newTypeInfo.isNonNull()) {
                    // outputs that could be relied on as non null now may be null
                    if (!inputPosition) {
                        return true;
                    }
                    oldTypeInfo = oldTypeInfo.unwrapOne();
                } else if (!oldTypeInfo.isNonNull() && newTypeInfo.isNonNull()) {
                    // inputs that could be left out are now mandatory
                    if (inputPosition) {
                        return true;
                    }
                    newTypeInfo = newTypeInfo.unwrapOne();
                }
                // lists
                if (oldTypeInfo.isList() != newTypeInfo.isList()) {
                    return true;
                }
                // plain
                if (oldTypeInfo.isPlain()) {
                    return !newTypeInfo.isPlain();
                }
                oldTypeInfo = oldTypeInfo.unwrapOne();
                newTypeInfo = newTypeInfo.unwrapOne();
            }
        }
    };

    private static final Map<String, String> COMPATIBILITY_CLASSES = new HashMap<>();

    static {
        COMPATIBILITY_CLASSES.put("String", "String");
        COMPATIBILITY_CLASSES.put("Int", "Int");
        COMPATIBILITY_CLASSES.put("Float", "Float");
        COMPATIBILITY_CLASSES.put("Boolean", "Boolean");
        COMPATIBILITY_CLASSES.put("ID", "ID");
    }

    /**
     * @param oldType       the type in the old schema
     * @param newType       the type in the new schema
     * @param inputPosition true for input object fields, where clients send values rather than receive them
     *
     * @return true if old consumers can break
     */
    public abstract boolean isBreaking(TypeRef oldType, TypeRef newType, boolean inputPosition);
}
