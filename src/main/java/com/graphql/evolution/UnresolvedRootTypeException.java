package com.graphql.evolution;

import graphql.PublicApi;

/**
 * A root operation type name does not point at an object type of the model.
 */
@PublicApi
public class UnresolvedRootTypeException extends SchemaModelException {

    public UnresolvedRootTypeException(String operation, String typeName) {
        super(String.format("The %s root type '%s' is not an object type of the schema", operation, typeName));
    }
}
