package com.graphql.evolution.introspection;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphql.evolution.SchemaModelException;
import graphql.PublicApi;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.Map;

/**
 * Reads introspection results saved as json into the map form {@link SchemaModelBuilder} consumes.
 */
@PublicApi
public class IntrospectionReader {

    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    public Map<String, Object> read(String json) {
        try {
            return OBJECT_MAPPER.readValue(json, MAP_TYPE);
        } catch (IOException e) {
            throw new SchemaModelException("Unable to parse the introspection json : " + e.getMessage(), e);
        }
    }

    public Map<String, Object> read(Reader reader) {
        try {
            return OBJECT_MAPPER.readValue(reader, MAP_TYPE);
        } catch (IOException e) {
            throw new SchemaModelException("Unable to parse the introspection json : " + e.getMessage(), e);
        }
    }

    public Map<String, Object> read(File file) {
        if (!file.exists() || !file.canRead()) {
            throw new SchemaModelException("The introspection file is not a readable file : " + file);
        }
        try {
            return OBJECT_MAPPER.readValue(file, MAP_TYPE);
        } catch (IOException e) {
            throw new SchemaModelException("Unable to read the introspection json at " + file + " : " + e.getMessage(), e);
        }
    }

    public String toJson(Map<String, Object> introspectionResult) {
        try {
            return OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(introspectionResult);
        } catch (IOException e) {
            throw new SchemaModelException("Unable to write the introspection json : " + e.getMessage(), e);
        }
    }
}
