package com.graphql.evolution.schema;

import graphql.PublicApi;

@PublicApi
public class ScalarTypeDefinition extends TypeDefinition {

    public ScalarTypeDefinition(String name, String description) {
        super(name, description);
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.SCALAR;
    }

    @Override
    public <T> T accept(TypeDefinitionVisitor<T> visitor) {
        return visitor.visitScalar(this);
    }
}
