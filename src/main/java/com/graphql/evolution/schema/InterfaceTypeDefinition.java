package com.graphql.evolution.schema;

import graphql.PublicApi;

import java.util.List;

@PublicApi
public class InterfaceTypeDefinition extends TypeDefinition {

    private final List<FieldDefinition> fieldDefinitions;

    public InterfaceTypeDefinition(String name, String description, List<FieldDefinition> fieldDefinitions) {
        super(name, description);
        this.fieldDefinitions = immutableCopy(fieldDefinitions);
    }

    public List<FieldDefinition> getFieldDefinitions() {
        return fieldDefinitions;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.INTERFACE;
    }

    @Override
    public <T> T accept(TypeDefinitionVisitor<T> visitor) {
        return visitor.visitInterface(this);
    }
}
