package com.graphql.evolution.introspection;

import graphql.PublicApi;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Knows which type names are leaf scalars : the five built in ones plus an allowlist of custom scalars.
 * Callers walking a schema use this to decide whether a type has fields of its own worth descending into.
 */
@PublicApi
public class ScalarTypes {

    private final static Set<String> BUILT_IN_SCALARS = new LinkedHashSet<>();
    private final static Set<String> DEFAULT_CUSTOM_SCALARS = new LinkedHashSet<>();

    static {
        BUILT_IN_SCALARS.add("String");
        BUILT_IN_SCALARS.add("Int");
        BUILT_IN_SCALARS.add("Float");
        BUILT_IN_SCALARS.add("Boolean");
        BUILT_IN_SCALARS.add("ID");

        DEFAULT_CUSTOM_SCALARS.add("DateTime");
        DEFAULT_CUSTOM_SCALARS.add("Date");
        DEFAULT_CUSTOM_SCALARS.add("Time");
        DEFAULT_CUSTOM_SCALARS.add("JSON");
        DEFAULT_CUSTOM_SCALARS.add("Upload");
        DEFAULT_CUSTOM_SCALARS.add("Long");
        DEFAULT_CUSTOM_SCALARS.add("Decimal");
    }

    private final Set<String> customScalars;

    private ScalarTypes(Collection<String> customScalars) {
        this.customScalars = Collections.unmodifiableSet(new LinkedHashSet<>(customScalars));
    }

    public static ScalarTypes defaultScalarTypes() {
        return new ScalarTypes(DEFAULT_CUSTOM_SCALARS);
    }

    /**
     * @param customScalars the custom scalar names to allow, replacing the default allowlist
     *
     * @return a new instance
     */
    public static ScalarTypes withCustomScalars(Collection<String> customScalars) {
        return new ScalarTypes(customScalars);
    }

    /**
     * @param names more custom scalar names
     *
     * @return a new instance allowing the current custom scalars and the given ones
     */
    public ScalarTypes andCustomScalars(String... names) {
        Set<String> combined = new LinkedHashSet<>(customScalars);
        combined.addAll(Arrays.asList(names));
        return new ScalarTypes(combined);
    }

    public static boolean isBuiltInScalar(String typeName) {
        return BUILT_IN_SCALARS.contains(typeName);
    }

    public static Set<String> getBuiltInScalars() {
        return Collections.unmodifiableSet(BUILT_IN_SCALARS);
    }

    public boolean isScalarLike(String typeName) {
        return isBuiltInScalar(typeName) || customScalars.contains(typeName);
    }

    public Set<String> getCustomScalars() {
        return customScalars;
    }
}
