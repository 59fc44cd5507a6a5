package com.graphql.evolution.schema;

import graphql.PublicApi;

import static graphql.Assert.assertNotNull;

/**
 * A field argument or an input object field.
 */
@PublicApi
public class InputValueDefinition implements TypedElement {

    private final String name;
    private final TypeRef type;
    private final String defaultValue;
    private final String description;

    public InputValueDefinition(String name, TypeRef type, String defaultValue, String description) {
        this.name = assertNotNull(name, () -> "an input value needs a name");
        this.type = assertNotNull(type, () -> "an input value needs a type");
        this.defaultValue = defaultValue;
        this.description = description;
    }

    public InputValueDefinition(String name, TypeRef type) {
        this(name, type, null, null);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public TypeRef getType() {
        return type;
    }

    /**
     * @return the default value as the literal text the schema declared it with, or null if there is none
     */
    public String getDefaultValue() {
        return defaultValue;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public String toString() {
        return "InputValueDefinition{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", defaultValue=" + defaultValue +
                '}';
    }
}
