package com.graphql.evolution.schema;

import graphql.PublicApi;

import java.util.List;

@PublicApi
public class EnumTypeDefinition extends TypeDefinition {

    private final List<EnumValueDefinition> enumValueDefinitions;

    public EnumTypeDefinition(String name, String description, List<EnumValueDefinition> enumValueDefinitions) {
        super(name, description);
        this.enumValueDefinitions = immutableCopy(enumValueDefinitions);
    }

    public List<EnumValueDefinition> getEnumValueDefinitions() {
        return enumValueDefinitions;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.ENUM;
    }

    @Override
    public <T> T accept(TypeDefinitionVisitor<T> visitor) {
        return visitor.visitEnum(this);
    }
}
