package com.graphql.evolution;

import com.graphql.evolution.reporting.DifferenceReporter;
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
import com.graphql.evolution.schema.TypeDefinitionVisitor;
import com.graphql.evolution.schema.TypedElement;
import com.graphql.evolution.schema.UnionTypeDefinition;
import graphql.PublicApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.graphql.evolution.ChangeKind.ARGUMENT_ADDED;
import static com.graphql.evolution.ChangeKind.ARGUMENT_REMOVED;
import static com.graphql.evolution.ChangeKind.ENUM_VALUE_ADDED;
import static com.graphql.evolution.ChangeKind.ENUM_VALUE_REMOVED;
import static com.graphql.evolution.ChangeKind.FIELD_ADDED;
import static com.graphql.evolution.ChangeKind.FIELD_REMOVED;
import static com.graphql.evolution.ChangeKind.FIELD_TYPE_CHANGED;
import static com.graphql.evolution.ChangeKind.TYPE_ADDED;
import static com.graphql.evolution.ChangeKind.TYPE_REMOVED;
import static com.graphql.evolution.SchemaChange.apiBreakage;
import static com.graphql.evolution.SchemaChange.nonBreaking;
import static com.graphql.evolution.util.TypeInfo.getAstDesc;

/**
 * Compares two {@link SchemaModel}s and classifies every difference as a {@link SchemaChange}.
 * <p>
 * The output order is fixed : removed types, then the changes inside the types both models share (in the order of
 * the old model), then added types.  Inside a type, removed and changed members come in the old order followed by
 * added members in the new order.  A type whose kind changed is reported as removed and added again.
 */
@PublicApi
public class SchemaDiff {

    public static class Options {

        final ChangeSeverity minimumSeverity;
        final TypeChangeRule typeChangeRule;

        Options(ChangeSeverity minimumSeverity, TypeChangeRule typeChangeRule) {
            this.minimumSeverity = minimumSeverity;
            this.typeChangeRule = typeChangeRule;
        }

        /**
         * @param minimumSeverity changes below this are not reported by {@link #diffSchema(DiffSet, DifferenceReporter)}
         *
         * @return new options
         */
        public Options minimumSeverity(ChangeSeverity minimumSeverity) {
            return new Options(minimumSeverity, typeChangeRule);
        }

        public Options typeChangeRule(TypeChangeRule typeChangeRule) {
            return new Options(minimumSeverity, typeChangeRule);
        }

        public static Options defaultOptions() {
            return new Options(ChangeSeverity.MINOR, TypeChangeRule.SCALAR_CLASS);
        }
    }

    private static class CallContext {
        final List<SchemaChange> changes = new ArrayList<>();
        final SchemaModel oldModel;
        final SchemaModel newModel;

        private CallContext(SchemaModel oldModel, SchemaModel newModel) {
            this.oldModel = oldModel;
            this.newModel = newModel;
        }

        void report(SchemaChange change) {
            changes.add(change);
        }
    }

    private static final Logger log = LoggerFactory.getLogger(SchemaDiff.class);

    private final Options options;

    public SchemaDiff() {
        this(Options.defaultOptions());
    }

    public SchemaDiff(Options options) {
        this.options = options;
    }

    /**
     * Reports the changes between the two snapshots of the diff set that reach the minimum severity, then
     * calls {@link DifferenceReporter#onEnd()}.
     *
     * @param diffSet            the snapshots
     * @param differenceReporter where the changes go
     */
    public void diffSchema(DiffSet diffSet, DifferenceReporter differenceReporter) {
        List<SchemaChange> changes = filter(diff(diffSet.getOld(), diffSet.getNew()), options.minimumSeverity);
        changes.forEach(differenceReporter::report);
        differenceReporter.onEnd();
    }

    public List<SchemaChange> diff(SchemaModel oldModel, SchemaModel newModel) {
        CallContext callContext = new CallContext(oldModel, newModel);

        for (TypeDefinition oldDef : oldModel.getTypes().values()) {
            if (!newModel.hasType(oldDef.getName())) {
                callContext.report(typeRemoved(oldDef).build());
            }
        }
        for (TypeDefinition oldDef : oldModel.getTypes().values()) {
            newModel.getType(oldDef.getName()).ifPresent(newDef -> checkType(callContext, oldDef, newDef));
        }
        for (TypeDefinition newDef : newModel.getTypes().values()) {
            if (!oldModel.hasType(newDef.getName())) {
                callContext.report(typeAdded(newDef).build());
            }
        }

        log.debug("Compared {} old types with {} new types and found {} changes",
                oldModel.getTypes().size(), newModel.getTypes().size(), callContext.changes.size());
        return Collections.unmodifiableList(callContext.changes);
    }

    /**
     * @param changes         the changes
     * @param minimumSeverity the lowest severity to keep
     *
     * @return the changes at or above the severity, in their original order
     */
    public static List<SchemaChange> filter(List<SchemaChange> changes, ChangeSeverity minimumSeverity) {
        return changes.stream()
                .filter(change -> change.getSeverity().isAtLeast(minimumSeverity))
                .collect(Collectors.toList());
    }

    private void checkType(CallContext callContext, TypeDefinition oldDef, TypeDefinition newDef) {
        if (oldDef.getKind() != newDef.getKind()) {
            String kindChange = String.format("The kind of '%s' changed from %s to %s", oldDef.getName(), oldDef.getKind(), newDef.getKind());
            callContext.report(typeRemoved(oldDef)
                    .description("Type '%s' was removed as %s", oldDef.getName(), oldDef.getKind())
                    .impact(kindChange)
                    .build());
            callContext.report(typeAdded(newDef)
                    .description("Type '%s' was added as %s", newDef.getName(), newDef.getKind())
                    .impact(kindChange)
                    .build());
            return;
        }

        oldDef.accept(new TypeDefinitionVisitor<Void>() {
            @Override
            public Void visitObject(ObjectTypeDefinition objectType) {
                checkFields(callContext, oldDef, objectType.getFieldDefinitions(),
                        ((ObjectTypeDefinition) newDef).getFieldDefinitions(), false);
                return null;
            }

            @Override
            public Void visitInputObject(InputObjectTypeDefinition inputObjectType) {
                checkFields(callContext, oldDef, inputObjectType.getInputValueDefinitions(),
                        ((InputObjectTypeDefinition) newDef).getInputValueDefinitions(), true);
                return null;
            }

            @Override
            public Void visitInterface(InterfaceTypeDefinition interfaceType) {
                checkFields(callContext, oldDef, interfaceType.getFieldDefinitions(),
                        ((InterfaceTypeDefinition) newDef).getFieldDefinitions(), false);
                return null;
            }

            @Override
            public Void visitEnum(EnumTypeDefinition enumType) {
                checkEnumValues(callContext, enumType, (EnumTypeDefinition) newDef);
                return null;
            }

            @Override
            public Void visitUnion(UnionTypeDefinition unionType) {
                // membership changes are not classified
                return null;
            }

            @Override
            public Void visitScalar(ScalarTypeDefinition scalarType) {
                return null;
            }
        });
    }

    private <T extends TypedElement> void checkFields(CallContext callContext, TypeDefinition oldDef, List<T> oldFieldList, List<T> newFieldList, boolean inputPosition) {
        Map<String, T> oldFields = namedMap(oldFieldList, TypedElement::getName);
        Map<String, T> newFields = namedMap(newFieldList, TypedElement::getName);

        for (Map.Entry<String, T> entry : oldFields.entrySet()) {
            String fieldName = entry.getKey();
            T newField = newFields.get(fieldName);
            if (newField == null) {
                callContext.report(apiBreakage(FIELD_REMOVED)
                        .typeName(oldDef.getName())
                        .typeKind(oldDef.getKind())
                        .fieldName(fieldName)
                        .description("Field '%s' was removed from type '%s'", fieldName, oldDef.getName())
                        .impact("Queries selecting this field will fail")
                        .recommendation("Use deprecation before removal")
                        .build());
            } else {
                checkField(callContext, oldDef, entry.getValue(), newField, inputPosition);
            }
        }

        for (Map.Entry<String, T> entry : newFields.entrySet()) {
            String fieldName = entry.getKey();
            if (!oldFields.containsKey(fieldName)) {
                callContext.report(nonBreaking(FIELD_ADDED)
                        .typeName(oldDef.getName())
                        .typeKind(oldDef.getKind())
                        .fieldName(fieldName)
                        .description("Field '%s' was added to type '%s'", fieldName, oldDef.getName())
                        .impact("New data available to clients")
                        .build());
            }
        }
    }

    private void checkField(CallContext callContext, TypeDefinition oldDef, TypedElement oldField, TypedElement newField, boolean inputPosition) {
        String oldFieldType = getAstDesc(oldField.getType());
        String newFieldType = getAstDesc(newField.getType());

        if (!oldFieldType.equals(newFieldType)) {
            boolean breaking = options.typeChangeRule.isBreaking(oldField.getType(), newField.getType(), inputPosition);
            SchemaChange.Builder change = breaking ? apiBreakage(FIELD_TYPE_CHANGED) : nonBreaking(FIELD_TYPE_CHANGED).severity(ChangeSeverity.MAJOR);
            callContext.report(change
                    .typeName(oldDef.getName())
                    .typeKind(oldDef.getKind())
                    .fieldName(oldField.getName())
                    .typeChange(oldFieldType, newFieldType)
                    .description("Field '%s' type changed from '%s' to '%s' in type '%s'", oldField.getName(), oldFieldType, newFieldType, oldDef.getName())
                    .impact(breaking ? "May cause client parsing errors" : "Client adaptation may be needed")
                    .recommendation(breaking ? "Consider adding a new field alongside the old one until clients have moved" : null)
                    .build());
        }

        if (oldField instanceof FieldDefinition) {
            checkFieldArguments(callContext, oldDef, (FieldDefinition) oldField, (FieldDefinition) newField);
        }
    }

    private void checkFieldArguments(CallContext callContext, TypeDefinition oldDef, FieldDefinition oldField, FieldDefinition newField) {
        Map<String, InputValueDefinition> oldArgs = namedMap(oldField.getArguments(), InputValueDefinition::getName);
        Map<String, InputValueDefinition> newArgs = namedMap(newField.getArguments(), InputValueDefinition::getName);

        for (String argName : oldArgs.keySet()) {
            if (!newArgs.containsKey(argName)) {
                callContext.report(apiBreakage(ARGUMENT_REMOVED)
                        .typeName(oldDef.getName())
                        .typeKind(oldDef.getKind())
                        .fieldName(oldField.getName())
                        .component(argName)
                        .description("Argument '%s' was removed from field '%s' of type '%s'", argName, oldField.getName(), oldDef.getName())
                        .impact("Queries passing this argument will fail")
                        .recommendation("Keep accepting the argument until clients stop sending it")
                        .build());
            }
        }

        for (InputValueDefinition newArg : newArgs.values()) {
            if (oldArgs.containsKey(newArg.getName())) {
                continue;
            }
            // new args MUST not be mandatory
            boolean mandatory = newArg.getType().isNonNull() && newArg.getDefaultValue() == null;
            SchemaChange.Builder change = mandatory ? apiBreakage(ARGUMENT_ADDED) : nonBreaking(ARGUMENT_ADDED);
            callContext.report(change
                    .typeName(oldDef.getName())
                    .typeKind(oldDef.getKind())
                    .fieldName(oldField.getName())
                    .component(newArg.getName())
                    .description("Argument '%s' was added to field '%s' of type '%s'", newArg.getName(), oldField.getName(), oldDef.getName())
                    .impact(mandatory ? "Queries that do not pass this required argument will fail" : "New options available to clients")
                    .recommendation(mandatory ? "Give the argument a default value or make it nullable" : null)
                    .build());
        }
    }

    private void checkEnumValues(CallContext callContext, EnumTypeDefinition oldDef, EnumTypeDefinition newDef) {
        Map<String, EnumValueDefinition> oldValues = namedMap(oldDef.getEnumValueDefinitions(), EnumValueDefinition::getName);
        Map<String, EnumValueDefinition> newValues = namedMap(newDef.getEnumValueDefinitions(), EnumValueDefinition::getName);

        for (String valueName : oldValues.keySet()) {
            if (!newValues.containsKey(valueName)) {
                callContext.report(apiBreakage(ENUM_VALUE_REMOVED)
                        .typeName(oldDef.getName())
                        .typeKind(oldDef.getKind())
                        .component(valueName)
                        .description("Enum value '%s' was removed from enum '%s'", valueName, oldDef.getName())
                        .impact("Clients sending or expecting this value will fail")
                        .recommendation("Deprecate the value before removal")
                        .build());
            }
        }
        for (String valueName : newValues.keySet()) {
            if (!oldValues.containsKey(valueName)) {
                callContext.report(nonBreaking(ENUM_VALUE_ADDED)
                        .typeName(oldDef.getName())
                        .typeKind(oldDef.getKind())
                        .component(valueName)
                        .description("Enum value '%s' was added to enum '%s'", valueName, oldDef.getName())
                        .impact("Clients may receive a value they do not know yet")
                        .build());
            }
        }
    }

    private static SchemaChange.Builder typeRemoved(TypeDefinition oldDef) {
        return apiBreakage(TYPE_REMOVED)
                .typeName(oldDef.getName())
                .typeKind(oldDef.getKind())
                .description("Type '%s' was removed", oldDef.getName())
                .impact("All queries using this type will fail")
                .recommendation("Ensure no clients are using this type before removal");
    }

    private static SchemaChange.Builder typeAdded(TypeDefinition newDef) {
        return nonBreaking(TYPE_ADDED)
                .typeName(newDef.getName())
                .typeKind(newDef.getKind())
                .description("Type '%s' was added", newDef.getName())
                .impact("New functionality available to clients");
    }

    private static <T> Map<String, T> namedMap(List<T> listOfNamedThings, Function<T, String> nameFunc) {
        Map<String, T> map = new LinkedHashMap<>();
        listOfNamedThings.forEach(thing -> map.putIfAbsent(nameFunc.apply(thing), thing));
        return map;
    }
}
