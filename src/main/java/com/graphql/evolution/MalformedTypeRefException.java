package com.graphql.evolution;

import graphql.PublicApi;

/**
 * A type reference node is missing its inner type or its name, or nests non null directly inside non null.
 */
@PublicApi
public class MalformedTypeRefException extends SchemaModelException {

    private final String location;

    public MalformedTypeRefException(String location, String format, Object... args) {
        super(String.format("Malformed type reference at '%s' : %s", location, String.format(format, args)));
        this.location = location;
    }

    /**
     * @return where in the document the bad reference was found, for example {@code User.posts(first)}
     */
    public String getLocation() {
        return location;
    }
}
