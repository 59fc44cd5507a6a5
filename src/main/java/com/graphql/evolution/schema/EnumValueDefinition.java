package com.graphql.evolution.schema;

import graphql.PublicApi;

import static graphql.Assert.assertNotNull;

@PublicApi
public class EnumValueDefinition {

    private final String name;
    private final String description;
    private final boolean deprecated;
    private final String deprecationReason;

    public EnumValueDefinition(String name, String description, boolean deprecated, String deprecationReason) {
        this.name = assertNotNull(name, () -> "an enum value needs a name");
        this.description = description;
        this.deprecated = deprecated;
        this.deprecationReason = deprecationReason;
    }

    public EnumValueDefinition(String name) {
        this(name, null, false, null);
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isDeprecated() {
        return deprecated;
    }

    public String getDeprecationReason() {
        return deprecationReason;
    }
}
