package com.graphql.evolution.schema;

import graphql.PublicApi;

import java.util.List;

@PublicApi
public class InputObjectTypeDefinition extends TypeDefinition {

    private final List<InputValueDefinition> inputValueDefinitions;

    public InputObjectTypeDefinition(String name, String description, List<InputValueDefinition> inputValueDefinitions) {
        super(name, description);
        this.inputValueDefinitions = immutableCopy(inputValueDefinitions);
    }

    public List<InputValueDefinition> getInputValueDefinitions() {
        return inputValueDefinitions;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.INPUT_OBJECT;
    }

    @Override
    public <T> T accept(TypeDefinitionVisitor<T> visitor) {
        return visitor.visitInputObject(this);
    }
}
