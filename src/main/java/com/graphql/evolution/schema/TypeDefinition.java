package com.graphql.evolution.schema;

import graphql.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static graphql.Assert.assertNotNull;

/**
 * A named type of a {@link SchemaModel}.  Each kind has its own subclass carrying only the payload that kind uses.
 */
@PublicApi
public abstract class TypeDefinition {

    private final String name;
    private final String description;

    TypeDefinition(String name, String description) {
        this.name = assertNotNull(name, () -> "a type definition needs a name");
        this.description = description;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the description or null if the type has none
     */
    public String getDescription() {
        return description;
    }

    public abstract TypeKind getKind();

    public abstract <T> T accept(TypeDefinitionVisitor<T> visitor);

    static <T> List<T> immutableCopy(List<T> list) {
        if (list == null) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "name='" + name + '\'' +
                '}';
    }
}
