package com.nsmctl.commandline.descriptor;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Declared type of a parameter or config field, as far as the command line cares about it.
 *
 * Scalars are {@code string}, {@code integer}, {@code float} and {@code boolean}; {@code optional<T>}
 * and {@code list<T>} wrap another type.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SemanticType {

    public enum Kind {
        STRING, INTEGER, FLOAT, BOOLEAN, OPTIONAL, LIST
    }

    private static final SemanticType STRING = new SemanticType(Kind.STRING, null);
    private static final SemanticType INTEGER = new SemanticType(Kind.INTEGER, null);
    private static final SemanticType FLOAT = new SemanticType(Kind.FLOAT, null);
    private static final SemanticType BOOLEAN = new SemanticType(Kind.BOOLEAN, null);

    @NonNull
    Kind kind;

    /**
     * Wrapped type for {@link Kind#OPTIONAL} and {@link Kind#LIST}; null for scalars.
     */
    SemanticType elementType;

    public static SemanticType string() {
        return STRING;
    }

    public static SemanticType integer() {
        return INTEGER;
    }

    public static SemanticType floating() {
        return FLOAT;
    }

    public static SemanticType bool() {
        return BOOLEAN;
    }

    public static SemanticType optional(@NonNull SemanticType elementType) {
        return new SemanticType(Kind.OPTIONAL, elementType);
    }

    public static SemanticType list(@NonNull SemanticType elementType) {
        return new SemanticType(Kind.LIST, elementType);
    }

    public boolean isOptional() {
        return kind == Kind.OPTIONAL;
    }

    /**
     * The type with any {@code optional<...>} wrapper removed.
     */
    public SemanticType unwrapOptional() {
        SemanticType current = this;
        while (current.kind == Kind.OPTIONAL) {
            current = current.elementType;
        }
        return current;
    }

    public boolean isBoolean() {
        return unwrapOptional().kind == Kind.BOOLEAN;
    }

    public boolean isList() {
        return unwrapOptional().kind == Kind.LIST;
    }

    /**
     * Innermost scalar kind: {@code optional<list<integer>>} yields {@link Kind#INTEGER}.
     */
    public Kind scalarKind() {
        SemanticType current = this;
        while (current.elementType != null) {
            current = current.elementType;
        }
        return current.kind;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case OPTIONAL -> "optional<" + elementType + ">";
            case LIST -> "list<" + elementType + ">";
            default -> kind.name().toLowerCase();
        };
    }
}
