package com.graphql.evolution;

import com.graphql.evolution.introspection.SchemaModelBuilder;
import com.graphql.evolution.schema.SchemaModel;
import graphql.PublicApi;

import java.util.Map;

/**
 * The old and new schema snapshots of one diff
 */
@PublicApi
public class DiffSet {

    private final SchemaModel oldModel;
    private final SchemaModel newModel;

    private DiffSet(SchemaModel oldModel, SchemaModel newModel) {
        this.oldModel = oldModel;
        this.newModel = newModel;
    }

    public SchemaModel getOld() {
        return oldModel;
    }

    public SchemaModel getNew() {
        return newModel;
    }

    public static DiffSet diffSet(SchemaModel oldModel, SchemaModel newModel) {
        return new DiffSet(oldModel, newModel);
    }

    /**
     * @param introspectionOld the introspection result of the old schema
     * @param introspectionNew the introspection result of the new schema
     *
     * @return a diff set of the models built from both results
     */
    public static DiffSet diffSet(Map<String, Object> introspectionOld, Map<String, Object> introspectionNew) {
        SchemaModelBuilder builder = new SchemaModelBuilder();
        return new DiffSet(builder.build(introspectionOld), builder.build(introspectionNew));
    }
}
