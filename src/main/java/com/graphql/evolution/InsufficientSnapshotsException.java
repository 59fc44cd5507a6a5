package com.graphql.evolution;

import graphql.GraphQLException;
import graphql.PublicApi;

@PublicApi
public class InsufficientSnapshotsException extends GraphQLException {

    public InsufficientSnapshotsException(int snapshotCount) {
        super(String.format("At least 2 schema snapshots are required to track evolution but %d were given", snapshotCount));
    }
}
