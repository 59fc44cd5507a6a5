package com.graphql.evolution.schema;

import com.graphql.evolution.MissingQueryRootException;
import com.graphql.evolution.SchemaModelException;
import com.graphql.evolution.UnresolvedRootTypeException;
import graphql.PublicApi;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable snapshot of a schema : its named types, kept in the order they were read, and the names of its root
 * operation types.  Every root name that is present resolves to an object type of the model.
 */
@PublicApi
public class SchemaModel {

    private final Map<String, TypeDefinition> types;
    private final String queryTypeName;
    private final String mutationTypeName;
    private final String subscriptionTypeName;

    private SchemaModel(Map<String, TypeDefinition> types, String queryTypeName, String mutationTypeName, String subscriptionTypeName) {
        this.types = Collections.unmodifiableMap(types);
        this.queryTypeName = queryTypeName;
        this.mutationTypeName = mutationTypeName;
        this.subscriptionTypeName = subscriptionTypeName;
    }

    public Map<String, TypeDefinition> getTypes() {
        return types;
    }

    public List<TypeDefinition> getTypeDefinitions() {
        return new ArrayList<>(types.values());
    }

    public Optional<TypeDefinition> getType(String name) {
        return Optional.ofNullable(types.get(name));
    }

    public boolean hasType(String name) {
        return types.containsKey(name);
    }

    public String getQueryTypeName() {
        return queryTypeName;
    }

    public Optional<String> getMutationTypeName() {
        return Optional.ofNullable(mutationTypeName);
    }

    public Optional<String> getSubscriptionTypeName() {
        return Optional.ofNullable(subscriptionTypeName);
    }

    @Override
    public String toString() {
        return "SchemaModel{" +
                "query=" + queryTypeName +
                ", mutation=" + mutationTypeName +
                ", subscription=" + subscriptionTypeName +
                ", types=" + types.keySet() +
                '}';
    }

    public static Builder newSchemaModel() {
        return new Builder();
    }

    public static class Builder {

        private final Map<String, TypeDefinition> types = new LinkedHashMap<>();
        private String queryTypeName;
        private String mutationTypeName;
        private String subscriptionTypeName;

        public Builder queryTypeName(String queryTypeName) {
            this.queryTypeName = queryTypeName;
            return this;
        }

        public Builder mutationTypeName(String mutationTypeName) {
            this.mutationTypeName = mutationTypeName;
            return this;
        }

        public Builder subscriptionTypeName(String subscriptionTypeName) {
            this.subscriptionTypeName = subscriptionTypeName;
            return this;
        }

        public Builder type(TypeDefinition typeDefinition) {
            if (types.containsKey(typeDefinition.getName())) {
                throw new SchemaModelException(String.format("The type '%s' is defined more than once", typeDefinition.getName()));
            }
            types.put(typeDefinition.getName(), typeDefinition);
            return this;
        }

        public Builder types(List<? extends TypeDefinition> typeDefinitions) {
            typeDefinitions.forEach(this::type);
            return this;
        }

        public SchemaModel build() {
            if (queryTypeName == null) {
                throw new MissingQueryRootException();
            }
            checkRoot("query", queryTypeName);
            checkRoot("mutation", mutationTypeName);
            checkRoot("subscription", subscriptionTypeName);
            return new SchemaModel(new LinkedHashMap<>(types), queryTypeName, mutationTypeName, subscriptionTypeName);
        }

        private void checkRoot(String operation, String typeName) {
            if (typeName == null) {
                return;
            }
            TypeDefinition definition = types.get(typeName);
            if (definition == null || definition.getKind() != TypeKind.OBJECT) {
                throw new UnresolvedRootTypeException(operation, typeName);
            }
        }
    }
}
