package com.nsmctl.commandline.config;

import java.util.function.BiConsumer;
import java.util.function.Function;

import com.nsmctl.commandline.descriptor.ParameterDescriptor;
import com.nsmctl.commandline.descriptor.SemanticType;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Typed accessor pair for one named field of a config object.
 */
@Getter
public final class ConfigField<C> {

    private final String name;
    private final SemanticType type;
    private final String description;
    @Getter(AccessLevel.NONE)
    private final Function<C, ?> getter;
    @Getter(AccessLevel.NONE)
    private final BiConsumer<C, Object> setter;

    ConfigField(String name, SemanticType type, String description, Function<C, ?> getter,
            BiConsumer<C, Object> setter) {
        this.name = name;
        this.type = type;
        this.description = description == null ? "" : description;
        this.getter = getter;
        this.setter = setter;
    }

    public Object read(C config) {
        return getter.apply(config);
    }

    public void write(C config, Object value) {
        setter.accept(config, value);
    }

    /**
     * Same field seen as a parameter, so it can be mapped to a flag.
     */
    public ParameterDescriptor toParameter() {
        return ParameterDescriptor.builder()
                .name(name)
                .type(type)
                .description(description)
                .build();
    }
}
