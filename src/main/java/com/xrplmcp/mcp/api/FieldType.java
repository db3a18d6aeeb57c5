package com.xrplmcp.mcp.api;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Type descriptor of a model field. Only the members relevant to {@link #kind()} are set:
 * {@code scalar} for primitives, {@code enumConstants} for enums, {@code fields} for nested
 * models, {@code candidates} for unions and {@code element} for sequences.
 */
public record FieldType(
    FieldKind kind,
    Class<?> javaType,
    ScalarType scalar,
    List<EnumConstant> enumConstants,
    List<FieldSchema> fields,
    List<FieldType> candidates,
    FieldType element
) {

    public static FieldType primitive(Class<?> javaType, ScalarType scalar) {
        return new FieldType(FieldKind.PRIMITIVE, javaType, scalar, List.of(), List.of(), List.of(), null);
    }

    public static FieldType enumOf(Class<?> javaType, List<EnumConstant> constants) {
        return new FieldType(FieldKind.ENUM, javaType, null, List.copyOf(constants), List.of(), List.of(), null);
    }

    public static FieldType model(Class<?> javaType, List<FieldSchema> fields) {
        return new FieldType(FieldKind.MODEL, javaType, null, List.of(), List.copyOf(fields), List.of(), null);
    }

    public static FieldType union(List<FieldType> candidates) {
        return new FieldType(FieldKind.UNION, Object.class, null, List.of(), List.of(), List.copyOf(candidates), null);
    }

    public static FieldType sequence(Class<?> javaType, FieldType element) {
        return new FieldType(FieldKind.SEQUENCE, javaType, null, List.of(), List.of(), List.of(), element);
    }

    public static FieldType opaque(Class<?> javaType) {
        return new FieldType(FieldKind.OPAQUE, javaType, null, List.of(), List.of(), List.of(), null);
    }

    /** Legal constant names of an enum field, in declaration order; empty for other kinds. */
    public List<String> enumValues() {
        return enumConstants.stream().map(EnumConstant::name).toList();
    }

    public Optional<EnumConstant> matchEnum(Object value) {
        return enumConstants.stream().filter(c -> c.matches(value)).findFirst();
    }

    /**
     * Short human-readable form, e.g. {@code list<Memo>} or {@code IssuedCurrencyAmount | string}.
     */
    public String describe() {
        return switch (kind) {
            case PRIMITIVE -> scalar.jsonSchemaType();
            case ENUM -> "enum " + javaType.getSimpleName();
            case MODEL -> javaType.getSimpleName();
            case UNION -> candidates.stream().map(FieldType::describe).collect(Collectors.joining(" | "));
            case SEQUENCE -> "list<" + element.describe() + ">";
            case OPAQUE -> "object";
        };
    }
}
