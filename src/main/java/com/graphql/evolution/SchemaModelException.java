package com.graphql.evolution;

import graphql.GraphQLException;
import graphql.PublicApi;

/**
 * Thrown when an introspection document cannot be turned into a {@link com.graphql.evolution.schema.SchemaModel}.
 * No partial model is ever returned alongside one of these.
 */
@PublicApi
public class SchemaModelException extends GraphQLException {

    public SchemaModelException(String message) {
        super(message);
    }

    public SchemaModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
