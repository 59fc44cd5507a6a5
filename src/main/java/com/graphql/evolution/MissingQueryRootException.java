package com.graphql.evolution;

import graphql.PublicApi;

@PublicApi
public class MissingQueryRootException extends SchemaModelException {

    public MissingQueryRootException() {
        super("The introspection document does not name a query root type");
    }
}
