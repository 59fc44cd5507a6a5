package com.graphql.evolution;

import com.graphql.evolution.schema.TypeKind;
import graphql.PublicApi;

import java.util.Optional;

/**
 * One change between two schema snapshots.  Instances are immutable and made with {@link #apiBreakage(ChangeKind)}
 * or {@link #nonBreaking(ChangeKind)}.
 */
@PublicApi
public class SchemaChange {

    private final ChangeKind kind;
    private final ChangeSeverity severity;
    private final boolean breaking;
    private final String typeName;
    private final TypeKind typeKind;
    private final String fieldName;
    private final String component;
    private final String oldType;
    private final String newType;
    private final String description;
    private final String impact;
    private final String recommendation;

    SchemaChange(Builder builder) {
        this.kind = builder.kind;
        this.severity = builder.severity;
        this.breaking = builder.breaking;
        this.typeName = builder.typeName;
        this.typeKind = builder.typeKind;
        this.fieldName = builder.fieldName;
        this.component = builder.component;
        this.oldType = builder.oldType;
        this.newType = builder.newType;
        this.description = builder.description;
        this.impact = builder.impact;
        this.recommendation = builder.recommendation;
    }

    public ChangeKind getKind() {
        return kind;
    }

    public ChangeSeverity getSeverity() {
        return severity;
    }

    public boolean isBreaking() {
        return breaking;
    }

    public String getTypeName() {
        return typeName;
    }

    public TypeKind getTypeKind() {
        return typeKind;
    }

    /**
     * @return the field or input field concerned, or null for type level changes
     */
    public String getFieldName() {
        return fieldName;
    }

    /**
     * @return the enum value or argument concerned, or null
     */
    public String getComponent() {
        return component;
    }

    /**
     * @return the old type text of a {@link ChangeKind#FIELD_TYPE_CHANGED} change, or null
     */
    public String getOldType() {
        return oldType;
    }

    /**
     * @return the new type text of a {@link ChangeKind#FIELD_TYPE_CHANGED} change, or null
     */
    public String getNewType() {
        return newType;
    }

    public String getDescription() {
        return description;
    }

    public Optional<String> getImpact() {
        return Optional.ofNullable(impact);
    }

    public Optional<String> getRecommendation() {
        return Optional.ofNullable(recommendation);
    }

    @Override
    public String toString() {
        return "SchemaChange{" +
                " description='" + description + '\'' +
                ", kind=" + kind +
                ", severity=" + severity +
                ", breaking=" + breaking +
                ", typeName='" + typeName + '\'' +
                ", typeKind=" + typeKind +
                ", fieldName=" + fieldName +
                ", component=" + component +
                '}';
    }

    /**
     * @param kind the kind of change
     *
     * @return a builder for a breaking change, {@link ChangeSeverity#CRITICAL} unless told otherwise
     */
    public static Builder apiBreakage(ChangeKind kind) {
        return new Builder().kind(kind).breaking(true).severity(ChangeSeverity.CRITICAL);
    }

    /**
     * @param kind the kind of change
     *
     * @return a builder for a non breaking change, {@link ChangeSeverity#MINOR} unless told otherwise
     */
    public static Builder nonBreaking(ChangeKind kind) {
        return new Builder().kind(kind).breaking(false).severity(ChangeSeverity.MINOR);
    }

    public static class Builder {

        ChangeKind kind;
        ChangeSeverity severity;
        boolean breaking;
        String typeName;
        TypeKind typeKind;
        String fieldName;
        String component;
        String oldType;
        String newType;
        String description;
        String impact;
        String recommendation;

        public Builder kind(ChangeKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder severity(ChangeSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder breaking(boolean breaking) {
            this.breaking = breaking;
            return this;
        }

        public Builder typeName(String typeName) {
            this.typeName = typeName;
            return this;
        }

        public Builder typeKind(TypeKind typeKind) {
            this.typeKind = typeKind;
            return this;
        }

        public Builder fieldName(String fieldName) {
            this.fieldName = fieldName;
            return this;
        }

        public Builder component(String component) {
            this.component = component;
            return this;
        }

        public Builder typeChange(String oldType, String newType) {
            this.oldType = oldType;
            this.newType = newType;
            return this;
        }

        public Builder description(String format, Object... args) {
            this.description = String.format(format, args);
            return this;
        }

        public Builder impact(String impact) {
            this.impact = impact;
            return this;
        }

        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public SchemaChange build() {
            return new SchemaChange(this);
        }
    }
}
