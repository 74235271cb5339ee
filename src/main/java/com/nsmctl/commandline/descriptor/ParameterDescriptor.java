package com.nsmctl.commandline.descriptor;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One named, typed input to a constructor or an operation.
 *
 * Pure structure only.
 */
@Value
@Builder(toBuilder = true)
public class ParameterDescriptor {

    /**
     * Declared name (snake_case); unique within its owning signature.
     */
    @NonNull
    String name;

    /**
     * Declared type. A null type means the declaration carried no type information.
     */
    SemanticType type;

    /**
     * Declaration-time default; presence of a non-empty default makes the parameter optional.
     */
    Object defaultValue;

    @NonNull
    @Builder.Default
    String description = "";

    /**
     * Reserved parameters collide with dispatch keys and never become flags.
     */
    boolean reserved;

    public boolean isTyped() {
        return type != null;
    }

    public static ParameterDescriptor of(String name, SemanticType type) {
        return ParameterDescriptor.builder().name(name).type(type).build();
    }

    public static ParameterDescriptor of(String name, SemanticType type, String description) {
        return ParameterDescriptor.builder().name(name).type(type).description(description).build();
    }
}
