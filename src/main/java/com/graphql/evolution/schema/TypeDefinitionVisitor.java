package com.graphql.evolution.schema;

import graphql.PublicSpi;

/**
 * One method per {@link TypeKind}.  Adding a kind means adding a method here, which every renderer and
 * comparison path then has to implement.
 *
 * @param <T> the result of a visit
 */
@PublicSpi
public interface TypeDefinitionVisitor<T> {

    T visitObject(ObjectTypeDefinition objectType);

    T visitInputObject(InputObjectTypeDefinition inputObjectType);

    T visitInterface(InterfaceTypeDefinition interfaceType);

    T visitEnum(EnumTypeDefinition enumType);

    T visitUnion(UnionTypeDefinition unionType);

    T visitScalar(ScalarTypeDefinition scalarType);
}
