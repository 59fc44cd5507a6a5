package com.graphql.evolution.schema;

import graphql.PublicApi;

import java.util.List;

@PublicApi
public class ObjectTypeDefinition extends TypeDefinition {

    private final List<FieldDefinition> fieldDefinitions;
    private final List<String> interfaces;

    public ObjectTypeDefinition(String name, String description, List<FieldDefinition> fieldDefinitions, List<String> interfaces) {
        super(name, description);
        this.fieldDefinitions = immutableCopy(fieldDefinitions);
        this.interfaces = immutableCopy(interfaces);
    }

    public List<FieldDefinition> getFieldDefinitions() {
        return fieldDefinitions;
    }

    /**
     * @return the names of the implemented interfaces, in declaration order
     */
    public List<String> getInterfaces() {
        return interfaces;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.OBJECT;
    }

    @Override
    public <T> T accept(TypeDefinitionVisitor<T> visitor) {
        return visitor.visitObject(this);
    }
}
