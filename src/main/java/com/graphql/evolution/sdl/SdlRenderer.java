package com.graphql.evolution.sdl;

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
import com.graphql.evolution.schema.UnionTypeDefinition;
import graphql.PublicApi;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static com.graphql.evolution.util.TypeInfo.getAstDesc;

/**
 * Renders a {@link SchemaModel} as schema definition language text.
 * <p>
 * The layout is fixed : a header line, one member per line indented by two spaces and a closing brace on its own
 * line, with no trailing newline.  So {@code type User { id: ID! posts: [Post] }} comes out as
 * <pre>
 * type User {
 *   id: ID!
 *   posts: [Post]
 * }
 * </pre>
 * Types, fields and values are never re-ordered.
 */
@PublicApi
public class SdlRenderer {

    public static class Options {

        final boolean includeDescriptions;
        final boolean includeDeprecations;

        Options(boolean includeDescriptions, boolean includeDeprecations) {
            this.includeDescriptions = includeDescriptions;
            this.includeDeprecations = includeDeprecations;
        }

        public Options includeDescriptions() {
            return new Options(true, includeDeprecations);
        }

        public Options includeDeprecations() {
            return new Options(includeDescriptions, true);
        }

        public static Options defaultOptions() {
            return new Options(false, false);
        }
    }

    private static final String INDENT = "  ";

    private final Options options;

    public SdlRenderer() {
        this(Options.defaultOptions());
    }

    public SdlRenderer(Options options) {
        this.options = options;
    }

    public String renderSchema(SchemaModel schemaModel) {
        List<String> blocks = new ArrayList<>();
        if (!hasConventionalRoots(schemaModel)) {
            blocks.add(renderSchemaDefinition(schemaModel));
        }
        for (TypeDefinition typeDefinition : schemaModel.getTypes().values()) {
            blocks.add(renderType(typeDefinition));
        }
        return String.join("\n\n", blocks);
    }

    public String renderType(TypeDefinition typeDefinition) {
        String sdl = typeDefinition.accept(new TypeDefinitionVisitor<String>() {
            @Override
            public String visitObject(ObjectTypeDefinition objectType) {
                String header = header(objectType);
                if (!objectType.getInterfaces().isEmpty()) {
                    header += " implements " + String.join(" & ", objectType.getInterfaces());
                }
                return header + body(objectType.getFieldDefinitions().stream()
                        .map(SdlRenderer.this::renderFieldWithMetadata)
                        .collect(Collectors.toList()));
            }

            @Override
            public String visitInputObject(InputObjectTypeDefinition inputObjectType) {
                return header(inputObjectType) + body(inputObjectType.getInputValueDefinitions().stream()
                        .map(inputValue -> describe(inputValue.getDescription(), INDENT) + INDENT + renderInputValue(inputValue))
                        .collect(Collectors.toList()));
            }

            @Override
            public String visitInterface(InterfaceTypeDefinition interfaceType) {
                return header(interfaceType) + body(interfaceType.getFieldDefinitions().stream()
                        .map(SdlRenderer.this::renderFieldWithMetadata)
                        .collect(Collectors.toList()));
            }

            @Override
            public String visitEnum(EnumTypeDefinition enumType) {
                return header(enumType) + body(enumType.getEnumValueDefinitions().stream()
                        .map(SdlRenderer.this::renderEnumValue)
                        .collect(Collectors.toList()));
            }

            @Override
            public String visitUnion(UnionTypeDefinition unionType) {
                if (unionType.getMemberTypes().isEmpty()) {
                    return header(unionType);
                }
                return header(unionType) + " = " + String.join(" | ", unionType.getMemberTypes());
            }

            @Override
            public String visitScalar(ScalarTypeDefinition scalarType) {
                return header(scalarType);
            }
        });
        return describe(typeDefinition.getDescription(), "") + sdl;
    }

    /**
     * @param fieldDefinition the field
     *
     * @return {@code name(arg: Type = default, ...): ReturnType}
     */
    public String renderField(FieldDefinition fieldDefinition) {
        StringBuilder sb = new StringBuilder(fieldDefinition.getName());
        if (!fieldDefinition.getArguments().isEmpty()) {
            sb.append("(");
            sb.append(fieldDefinition.getArguments().stream()
                    .map(this::renderInputValue)
                    .collect(Collectors.joining(", ")));
            sb.append(")");
        }
        sb.append(": ").append(getAstDesc(fieldDefinition.getType()));
        return sb.toString();
    }

    public String renderInputValue(InputValueDefinition inputValue) {
        String sdl = inputValue.getName() + ": " + getAstDesc(inputValue.getType());
        if (inputValue.getDefaultValue() != null) {
            sdl += " = " + inputValue.getDefaultValue();
        }
        return sdl;
    }

    private String renderFieldWithMetadata(FieldDefinition fieldDefinition) {
        String line = INDENT + renderField(fieldDefinition);
        if (fieldDefinition.isDeprecated()) {
            line += deprecation(fieldDefinition.getDeprecationReason());
        }
        return describe(fieldDefinition.getDescription(), INDENT) + line;
    }

    private String renderEnumValue(EnumValueDefinition enumValue) {
        String line = INDENT + enumValue.getName();
        if (enumValue.isDeprecated()) {
            line += deprecation(enumValue.getDeprecationReason());
        }
        return describe(enumValue.getDescription(), INDENT) + line;
    }

    private String renderSchemaDefinition(SchemaModel schemaModel) {
        List<String> lines = new ArrayList<>();
        lines.add(INDENT + "query: " + schemaModel.getQueryTypeName());
        schemaModel.getMutationTypeName().ifPresent(name -> lines.add(INDENT + "mutation: " + name));
        schemaModel.getSubscriptionTypeName().ifPresent(name -> lines.add(INDENT + "subscription: " + name));
        return "schema" + body(lines);
    }

    private String deprecation(String reason) {
        if (!options.includeDeprecations) {
            return "";
        }
        if (reason == null) {
            return " @deprecated";
        }
        return " @deprecated(reason: \"" + escape(reason) + "\")";
    }

    private String describe(String description, String indent) {
        if (!options.includeDescriptions || description == null || description.isEmpty()) {
            return "";
        }
        String text = description.replace("\"\"\"", "\\\"\"\"");
        if (text.endsWith("\"")) {
            // a quote right before the closing delimiter would end the block early
            return indent + "\"\"\"" + text + "\n" + indent + "\"\"\"\n";
        }
        return indent + "\"\"\"" + text + "\"\"\"\n";
    }

    private static String header(TypeDefinition typeDefinition) {
        return typeDefinition.getKind().getSdlKeyword() + " " + typeDefinition.getName();
    }

    private static String body(List<String> lines) {
        StringBuilder sb = new StringBuilder(" {\n");
        for (String line : lines) {
            sb.append(line).append("\n");
        }
        return sb.append("}").toString();
    }

    private static boolean hasConventionalRoots(SchemaModel schemaModel) {
        return "Query".equals(schemaModel.getQueryTypeName())
                && schemaModel.getMutationTypeName().map("Mutation"::equals).orElse(true)
                && schemaModel.getSubscriptionTypeName().map("Subscription"::equals).orElse(true);
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
