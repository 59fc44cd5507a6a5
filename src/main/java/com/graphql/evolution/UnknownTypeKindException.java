package com.graphql.evolution;

import graphql.PublicApi;

/**
 * A type entry declares a kind outside of the known set. The type is never silently dropped
 * since that would show up later as a bogus removal in a diff.
 */
@PublicApi
public class UnknownTypeKindException extends SchemaModelException {

    private final String typeName;
    private final String kind;

    public UnknownTypeKindException(String typeName, String kind) {
        super(String.format("Type '%s' has an unknown kind '%s'", typeName, kind));
        this.typeName = typeName;
        this.kind = kind;
    }

    public String getTypeName() {
        return typeName;
    }

    public String getKind() {
        return kind;
    }
}
