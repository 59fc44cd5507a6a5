package com.graphql.evolution.schema;

import graphql.PublicApi;

import java.util.List;

@PublicApi
public class UnionTypeDefinition extends TypeDefinition {

    private final List<String> memberTypes;

    public UnionTypeDefinition(String name, String description, List<String> memberTypes) {
        super(name, description);
        this.memberTypes = immutableCopy(memberTypes);
    }

    /**
     * @return the names of the possible types, in declaration order
     */
    public List<String> getMemberTypes() {
        return memberTypes;
    }

    @Override
    public TypeKind getKind() {
        return TypeKind.UNION;
    }

    @Override
    public <T> T accept(TypeDefinitionVisitor<T> visitor) {
        return visitor.visitUnion(this);
    }
}
