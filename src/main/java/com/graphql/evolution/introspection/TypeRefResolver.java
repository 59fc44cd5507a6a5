package com.graphql.evolution.introspection;

import com.graphql.evolution.MalformedTypeRefException;
import com.graphql.evolution.schema.TypeRef;
import com.graphql.evolution.util.TypeInfo;
import graphql.PublicApi;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.graphql.evolution.util.TypeInfo.typeInfo;

/**
 * Turns the nested {@code kind / name / ofType} type references of an introspection result into {@link TypeRef}s
 * and back again.
 * <p>
 * Introspection queries usually only ask for a fixed number of {@code ofType} levels but nothing here assumes
 * a limit, the wrappers are walked until the named type is reached.
 */
@PublicApi
public class TypeRefResolver {

    static final String NON_NULL = "NON_NULL";
    static final String LIST = "LIST";

    private final ScalarTypes scalarTypes;

    public TypeRefResolver() {
        this(ScalarTypes.defaultScalarTypes());
    }

    public TypeRefResolver(ScalarTypes scalarTypes) {
        this.scalarTypes = scalarTypes;
    }

    public TypeRef resolve(Map<String, Object> typeDoc) {
        return resolve(typeDoc, "type reference");
    }

    /**
     * @param typeDoc  the introspection type reference
     * @param location where the reference sits, used in error messages
     *
     * @return the resolved type reference
     *
     * @throws MalformedTypeRefException if a wrapper has no inner type or a named type has no name
     */
    public TypeRef resolve(Map<String, Object> typeDoc, String location) {
        // outermost wrapper first
        Deque<String> wrappers = new ArrayDeque<>();
        Object node = typeDoc;
        while (true) {
            if (!(node instanceof Map)) {
                throw new MalformedTypeRefException(location, "expected a type node but found '%s'", node);
            }
            Map<?, ?> typeNode = (Map<?, ?>) node;
            Object kind = typeNode.get("kind");
            if (NON_NULL.equals(kind) || LIST.equals(kind)) {
                if (NON_NULL.equals(kind) && NON_NULL.equals(wrappers.peek())) {
                    throw new MalformedTypeRefException(location, "a non null type cannot wrap another non null type");
                }
                Object ofType = typeNode.get("ofType");
                if (ofType == null) {
                    throw new MalformedTypeRefException(location, "the %s type has no ofType", kind);
                }
                wrappers.push((String) kind);
                node = ofType;
            } else {
                Object name = typeNode.get("name");
                if (!(name instanceof String) || ((String) name).isEmpty()) {
                    throw new MalformedTypeRefException(location, "the named type of kind '%s' has no name", kind);
                }
                TypeRef typeRef = TypeRef.named((String) name);
                while (!wrappers.isEmpty()) {
                    typeRef = NON_NULL.equals(wrappers.pop()) ? TypeRef.nonNull(typeRef) : TypeRef.listOf(typeRef);
                }
                return typeRef;
            }
        }
    }

    /**
     * Parses canonical wrapper text such as {@code [[Int!]]!} into a type reference.
     *
     * @param typeText the text form
     *
     * @return the type reference
     *
     * @throws MalformedTypeRefException if the text is not a canonical type reference
     */
    public TypeRef parse(String typeText) {
        if (typeText == null || typeText.isEmpty()) {
            throw new MalformedTypeRefException(String.valueOf(typeText), "the type text is empty");
        }
        int length = typeText.length();
        int pos = 0;
        int listDepth = 0;
        while (pos < length && typeText.charAt(pos) == '[') {
            listDepth++;
            pos++;
        }
        int nameStart = pos;
        if (pos < length && isNameStart(typeText.charAt(pos))) {
            pos++;
            while (pos < length && isNamePart(typeText.charAt(pos))) {
                pos++;
            }
        }
        if (pos == nameStart) {
            throw new MalformedTypeRefException(typeText, "expected a type name at position %d", pos);
        }
        TypeRef typeRef = TypeRef.named(typeText.substring(nameStart, pos));
        if (pos < length && typeText.charAt(pos) == '!') {
            typeRef = TypeRef.nonNull(typeRef);
            pos++;
        }
        while (listDepth > 0) {
            if (pos >= length || typeText.charAt(pos) != ']') {
                throw new MalformedTypeRefException(typeText, "expected ']' at position %d", pos);
            }
            typeRef = TypeRef.listOf(typeRef);
            listDepth--;
            pos++;
            if (pos < length && typeText.charAt(pos) == '!') {
                typeRef = TypeRef.nonNull(typeRef);
                pos++;
            }
        }
        if (pos != length) {
            throw new MalformedTypeRefException(typeText, "unexpected text '%s'", typeText.substring(pos));
        }
        return typeRef;
    }

    /**
     * The reverse of {@link #resolve(Map)}.  Named leaves are given the kind {@code SCALAR} when they are scalar like
     * and {@code OBJECT} otherwise, since a type reference on its own does not know the kind of the type it names.
     *
     * @param typeRef the type reference
     *
     * @return an introspection shaped type reference
     */
    public Map<String, Object> toDocument(TypeRef typeRef) {
        Map<String, Object> node = new LinkedHashMap<>();
        if (typeRef instanceof TypeRef.NonNull) {
            node.put("kind", NON_NULL);
            node.put("name", null);
            node.put("ofType", toDocument(((TypeRef.NonNull) typeRef).getOfType()));
        } else if (typeRef instanceof TypeRef.ListOf) {
            node.put("kind", LIST);
            node.put("name", null);
            node.put("ofType", toDocument(((TypeRef.ListOf) typeRef).getOfType()));
        } else {
            String name = ((TypeRef.Named) typeRef).getName();
            node.put("kind", isScalarLike(name) ? "SCALAR" : "OBJECT");
            node.put("name", name);
            node.put("ofType", null);
        }
        return node;
    }

    public String baseName(TypeRef typeRef) {
        return typeInfo(typeRef).getName();
    }

    public String render(TypeRef typeRef) {
        return TypeInfo.getAstDesc(typeRef);
    }

    public boolean isScalarLike(String typeName) {
        return scalarTypes.isScalarLike(typeName);
    }

    private static boolean isNameStart(char c) {
        return c == '_' || (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isNamePart(char c) {
        return isNameStart(c) || (c >= '0' && c <= '9');
    }
}
