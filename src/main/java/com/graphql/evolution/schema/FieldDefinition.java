package com.graphql.evolution.schema;

import graphql.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static graphql.Assert.assertNotNull;

/**
 * A field of an object or interface type.  Arguments keep the order the schema declared them in.
 */
@PublicApi
public class FieldDefinition implements TypedElement {

    private final String name;
    private final String description;
    private final TypeRef type;
    private final List<InputValueDefinition> arguments;
    private final boolean deprecated;
    private final String deprecationReason;

    private FieldDefinition(Builder builder) {
        this.name = assertNotNull(builder.name, () -> "a field needs a name");
        this.type = assertNotNull(builder.type, () -> String.format("field '%s' needs a type", builder.name));
        this.description = builder.description;
        this.arguments = Collections.unmodifiableList(new ArrayList<>(builder.arguments));
        this.deprecated = builder.deprecated;
        this.deprecationReason = builder.deprecationReason;
    }

    @Override
    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public TypeRef getType() {
        return type;
    }

    public List<InputValueDefinition> getArguments() {
        return arguments;
    }

    public boolean isDeprecated() {
        return deprecated;
    }

    public String getDeprecationReason() {
        return deprecationReason;
    }

    @Override
    public String toString() {
        return "FieldDefinition{" +
                "name='" + name + '\'' +
                ", type=" + type +
                ", arguments=" + arguments +
                '}';
    }

    public static Builder newFieldDefinition() {
        return new Builder();
    }

    public static FieldDefinition field(String name, TypeRef type) {
        return newFieldDefinition().name(name).type(type).build();
    }

    public static class Builder {

        String name;
        String description;
        TypeRef type;
        List<InputValueDefinition> arguments = new ArrayList<>();
        boolean deprecated;
        String deprecationReason;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder type(TypeRef type) {
            this.type = type;
            return this;
        }

        public Builder argument(InputValueDefinition argument) {
            this.arguments.add(argument);
            return this;
        }

        public Builder arguments(List<InputValueDefinition> arguments) {
            this.arguments.addAll(arguments);
            return this;
        }

        public Builder deprecated(String reason) {
            this.deprecated = true;
            this.deprecationReason = reason;
            return this;
        }

        public FieldDefinition build() {
            return new FieldDefinition(this);
        }
    }
}
