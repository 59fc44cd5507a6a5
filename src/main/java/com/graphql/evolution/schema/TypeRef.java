package com.graphql.evolution.schema;

import com.graphql.evolution.MalformedTypeRefException;
import com.graphql.evolution.util.TypeInfo;
import graphql.PublicApi;

import java.util.Objects;

import static graphql.Assert.assertNotNull;

/**
 * A reference to a type as it appears on a field or argument : a named type wrapped in any number
 * of list and non null modifiers.  There are exactly three shapes, {@link Named}, {@link ListOf} and
 * {@link NonNull}, and a non null never directly wraps another non null.
 */
@PublicApi
public abstract class TypeRef {

    TypeRef() {
    }

    public static Named named(String name) {
        return new Named(name);
    }

    public static ListOf listOf(TypeRef inner) {
        return new ListOf(inner);
    }

    public static NonNull nonNull(TypeRef inner) {
        return new NonNull(inner);
    }

    public boolean isNamed() {
        return this instanceof Named;
    }

    public boolean isList() {
        return this instanceof ListOf;
    }

    public boolean isNonNull() {
        return this instanceof NonNull;
    }

    /**
     * @return the canonical text form, eg {@code [String!]!}
     */
    @Override
    public String toString() {
        return TypeInfo.getAstDesc(this);
    }

    public static final class Named extends TypeRef {
        private final String name;

        private Named(String name) {
            this.name = assertNotNull(name, () -> "a named type needs a name");
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return name.equals(((Named) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    public static final class ListOf extends TypeRef {
        private final TypeRef ofType;

        private ListOf(TypeRef ofType) {
            this.ofType = assertNotNull(ofType, () -> "a list type needs an inner type");
        }

        public TypeRef getOfType() {
            return ofType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return ofType.equals(((ListOf) o).ofType);
        }

        @Override
        public int hashCode() {
            return Objects.hash("list", ofType);
        }
    }

    public static final class NonNull extends TypeRef {
        private final TypeRef ofType;

        private NonNull(TypeRef ofType) {
            assertNotNull(ofType, () -> "a non null type needs an inner type");
            if (ofType instanceof NonNull) {
                throw new MalformedTypeRefException(ofType.toString(), "a non null type cannot wrap another non null type");
            }
            this.ofType = ofType;
        }

        public TypeRef getOfType() {
            return ofType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return ofType.equals(((NonNull) o).ofType);
        }

        @Override
        public int hashCode() {
            return Objects.hash("nonNull", ofType);
        }
    }
}
