package com.graphql.evolution.introspection;

import com.graphql.evolution.MalformedTypeRefException;
import com.graphql.evolution.MissingQueryRootException;
import com.graphql.evolution.SchemaModelException;
import com.graphql.evolution.UnknownTypeKindException;
import com.graphql.evolution.schema.EnumTypeDefinition;
import com.graphql.evolution.schema.EnumValueDefinition;
import com.graphql.evolution.schema.FieldDefinition;
import com.graphql.evolution.schema.InputObjectTypeDefinition;
import com.graphql.evolution.schema.InputValueDefinition;
import com.graphql.evolution.schema.InterfaceTypeDefinition;
import com.graphql.evolution.schema.ObjectTypeDefinition;
import com.graphql.evolution.schema.ScalarTypeDefinition;
import com.graphql.evolution.schema.SchemaModel;
import com.graphql.evolution.schema.TypeDefinition;
import com.graphql.evolution.schema.TypeKind;
import com.graphql.evolution.schema.TypeRef;
import com.graphql.evolution.schema.UnionTypeDefinition;
import graphql.PublicApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds a {@link SchemaModel} from an introspection result.
 * <p>
 * Both the raw http response shape {@code {data: {__schema: ...}}} and the shape an in process execution returns
 * {@code {__schema: ...}} are accepted.  Types and their fields, arguments, enum values and members keep the
 * order of the document.  Any problem fails the whole build.
 */
@PublicApi
public class SchemaModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(SchemaModelBuilder.class);

    private final TypeRefResolver typeRefResolver;

    public SchemaModelBuilder() {
        this(new TypeRefResolver());
    }

    public SchemaModelBuilder(TypeRefResolver typeRefResolver) {
        this.typeRefResolver = typeRefResolver;
    }

    public SchemaModel build(Map<String, Object> introspectionResult) {
        Map<String, Object> schema = getSchema(introspectionResult);

        String queryTypeName = getRootName(schema, "queryType");
        if (queryTypeName == null) {
            throw new MissingQueryRootException();
        }

        SchemaModel.Builder model = SchemaModel.newSchemaModel()
                .queryTypeName(queryTypeName)
                .mutationTypeName(getRootName(schema, "mutationType"))
                .subscriptionTypeName(getRootName(schema, "subscriptionType"));

        Object types = schema.get("types");
        if (!(types instanceof List)) {
            throw new SchemaModelException("The introspection result has no list of 'types'");
        }
        int skipped = 0;
        int index = 0;
        for (Object type : (List<?>) types) {
            Map<String, Object> typeDoc = asMap(type, "types[" + index + "]");
            String typeName = getString(typeDoc, "name");
            if (typeName == null) {
                throw new SchemaModelException(String.format("The type entry at index %d has no name", index));
            }
            index++;
            if (isReservedType(typeName)) {
                log.debug("Skipping reserved type '{}'", typeName);
                skipped++;
                continue;
            }
            model.type(buildType(typeName, typeDoc));
        }

        SchemaModel schemaModel = model.build();
        log.debug("Built schema model with {} types ({} reserved types skipped), query root '{}'",
                schemaModel.getTypes().size(), skipped, queryTypeName);
        return schemaModel;
    }

    private TypeDefinition buildType(String typeName, Map<String, Object> typeDoc) {
        String kindName = getString(typeDoc, "kind");
        TypeKind kind = TypeKind.fromIntrospectionName(kindName)
                .orElseThrow(() -> new UnknownTypeKindException(typeName, kindName));
        String description = getString(typeDoc, "description");

        switch (kind) {
            case OBJECT:
                return new ObjectTypeDefinition(typeName, description,
                        buildFields(typeName, typeDoc), getNames(typeName, typeDoc, "interfaces"));
            case INTERFACE:
                return new InterfaceTypeDefinition(typeName, description, buildFields(typeName, typeDoc));
            case INPUT_OBJECT:
                return new InputObjectTypeDefinition(typeName, description,
                        buildInputValues(typeName, getList(typeName, typeDoc, "inputFields")));
            case ENUM:
                return new EnumTypeDefinition(typeName, description, buildEnumValues(typeName, typeDoc));
            case UNION:
                return new UnionTypeDefinition(typeName, description, getNames(typeName, typeDoc, "possibleTypes"));
            case SCALAR:
                return new ScalarTypeDefinition(typeName, description);
            default:
                throw new UnknownTypeKindException(typeName, kindName);
        }
    }

    private List<FieldDefinition> buildFields(String typeName, Map<String, Object> typeDoc) {
        List<FieldDefinition> fields = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Map<String, Object> fieldDoc : getList(typeName, typeDoc, "fields")) {
            String fieldName = getRequiredName(typeName, fieldDoc, "field");
            String location = typeName + "." + fieldName;
            checkUnique(names, fieldName, location, "field");
            FieldDefinition.Builder field = FieldDefinition.newFieldDefinition()
                    .name(fieldName)
                    .description(getString(fieldDoc, "description"))
                    .type(resolveType(fieldDoc, location))
                    .arguments(buildInputValues(location, getList(location, fieldDoc, "args")));
            if (getBoolean(fieldDoc, "isDeprecated")) {
                field.deprecated(getString(fieldDoc, "deprecationReason"));
            }
            fields.add(field.build());
        }
        return fields;
    }

    private List<InputValueDefinition> buildInputValues(String owner, List<Map<String, Object>> valueDocs) {
        List<InputValueDefinition> inputValues = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Map<String, Object> valueDoc : valueDocs) {
            String name = getRequiredName(owner, valueDoc, "input value");
            String location = owner + "(" + name + ")";
            checkUnique(names, name, location, "input value");
            Object defaultValue = valueDoc.get("defaultValue");
            inputValues.add(new InputValueDefinition(
                    name,
                    resolveType(valueDoc, location),
                    defaultValue == null ? null : String.valueOf(defaultValue),
                    getString(valueDoc, "description")));
        }
        return inputValues;
    }

    private List<EnumValueDefinition> buildEnumValues(String typeName, Map<String, Object> typeDoc) {
        List<EnumValueDefinition> values = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (Map<String, Object> valueDoc : getList(typeName, typeDoc, "enumValues")) {
            String name = getRequiredName(typeName, valueDoc, "enum value");
            checkUnique(names, name, typeName + "." + name, "enum value");
            values.add(new EnumValueDefinition(
                    name,
                    getString(valueDoc, "description"),
                    getBoolean(valueDoc, "isDeprecated"),
                    getString(valueDoc, "deprecationReason")));
        }
        return values;
    }

    @SuppressWarnings("unchecked")
    private TypeRef resolveType(Map<String, Object> doc, String location) {
        Object type = doc.get("type");
        if (!(type instanceof Map)) {
            throw new MalformedTypeRefException(location, "there is no type");
        }
        return typeRefResolver.resolve((Map<String, Object>) type, location);
    }

    private List<String> getNames(String typeName, Map<String, Object> typeDoc, String key) {
        List<String> names = new ArrayList<>();
        for (Map<String, Object> ref : getList(typeName, typeDoc, key)) {
            names.add(getRequiredName(typeName, ref, key));
        }
        return names;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getSchema(Map<String, Object> introspectionResult) {
        if (introspectionResult == null) {
            throw new SchemaModelException("There is no introspection result");
        }
        Object data = introspectionResult.get("data");
        Object schema = data instanceof Map ? ((Map<String, Object>) data).get("__schema") : null;
        if (schema == null) {
            schema = introspectionResult.get("__schema");
        }
        if (!(schema instanceof Map)) {
            throw new SchemaModelException("The introspection result contains neither 'data.__schema' nor '__schema'");
        }
        return (Map<String, Object>) schema;
    }

    private String getRootName(Map<String, Object> schema, String key) {
        Object root = schema.get(key);
        if (root instanceof Map) {
            Object name = ((Map<?, ?>) root).get("name");
            return name instanceof String ? (String) name : null;
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> getList(String owner, Map<String, Object> doc, String key) {
        Object value = doc.get(key);
        if (value == null) {
            return Collections.emptyList();
        }
        if (!(value instanceof List)) {
            throw new SchemaModelException(String.format("'%s' of '%s' is not a list", key, owner));
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        int index = 0;
        for (Object entry : (List<Object>) value) {
            entries.add(asMap(entry, owner + "." + key + "[" + index++ + "]"));
        }
        return entries;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String location) {
        if (!(value instanceof Map)) {
            throw new SchemaModelException(String.format("Expected an object at '%s' but found '%s'", location, value));
        }
        return (Map<String, Object>) value;
    }

    private static String getRequiredName(String owner, Map<String, Object> doc, String what) {
        String name = getString(doc, "name");
        if (name == null || name.isEmpty()) {
            throw new SchemaModelException(String.format("A %s of '%s' has no name", what, owner));
        }
        return name;
    }

    private static void checkUnique(Set<String> seen, String name, String location, String what) {
        if (!seen.add(name)) {
            throw new SchemaModelException(String.format("The %s '%s' is defined more than once", what, location));
        }
    }

    private static String getString(Map<String, Object> doc, String key) {
        Object value = doc.get(key);
        return value == null ? null : String.valueOf(value);
    }

    private static boolean getBoolean(Map<String, Object> doc, String key) {
        return Boolean.TRUE.equals(doc.get(key));
    }

    private static boolean isReservedType(String typeName) {
        return typeName.startsWith("__");
    }
}
