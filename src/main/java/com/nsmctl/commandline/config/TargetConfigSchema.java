package com.nsmctl.commandline.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

import com.nsmctl.commandline.descriptor.DocComment;
import com.nsmctl.commandline.descriptor.SemanticType;

/**
 * Closed, ordered set of fields a {@link TargetConfigInterface} may read and write on a config type.
 */
public final class TargetConfigSchema<C extends TargetConfig> {

    private final List<ConfigField<C>> fields;

    private TargetConfigSchema(List<ConfigField<C>> fields) {
        this.fields = List.copyOf(fields);
    }

    public static <C extends TargetConfig> Builder<C> builder() {
        return new Builder<>();
    }

    public List<ConfigField<C>> getFields() {
        return fields;
    }

    public Optional<ConfigField<C>> find(String name) {
        return fields.stream().filter(f -> f.getName().equals(name)).findFirst();
    }

    public static final class Builder<C extends TargetConfig> {
        private final List<ConfigField<C>> fields = new ArrayList<>();
        private DocComment documentation = DocComment.empty();

        private Builder() {
        }

        /**
         * Documentation whose {@code @param} tags describe fields declared without a description.
         * Must be set before the fields it describes.
         */
        public Builder<C> documentation(String text) {
            this.documentation = DocComment.parse(text);
            return this;
        }

        public Builder<C> stringField(String name, Function<C, String> getter, BiConsumer<C, String> setter) {
            return stringField(name, null, getter, setter);
        }

        public Builder<C> stringField(String name, String description, Function<C, String> getter,
                BiConsumer<C, String> setter) {
            return add(name, SemanticType.string(), description, getter,
                    (c, v) -> setter.accept(c, v == null ? null : v.toString()));
        }

        public Builder<C> integerField(String name, Function<C, Integer> getter, BiConsumer<C, Integer> setter) {
            return integerField(name, null, getter, setter);
        }

        public Builder<C> integerField(String name, String description, Function<C, Integer> getter,
                BiConsumer<C, Integer> setter) {
            return add(name, SemanticType.integer(), description, getter,
                    (c, v) -> setter.accept(c, v == null ? null : toInteger(v)));
        }

        public Builder<C> floatField(String name, String description, Function<C, Double> getter,
                BiConsumer<C, Double> setter) {
            return add(name, SemanticType.floating(), description, getter,
                    (c, v) -> setter.accept(c, v == null ? null : toDouble(v)));
        }

        public Builder<C> booleanField(String name, String description, Function<C, Boolean> getter,
                BiConsumer<C, Boolean> setter) {
            return add(name, SemanticType.bool(), description, getter,
                    (c, v) -> setter.accept(c, v instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(v))));
        }

        public Builder<C> stringListField(String name, String description, Function<C, List<String>> getter,
                BiConsumer<C, List<String>> setter) {
            return add(name, SemanticType.list(SemanticType.string()), description, getter,
                    (c, v) -> setter.accept(c, v instanceof Collection<?> values
                            ? values.stream().map(String::valueOf).toList()
                            : List.of(String.valueOf(v))));
        }

        private Builder<C> add(String name, SemanticType type, String description, Function<C, ?> getter,
                BiConsumer<C, Object> setter) {
            if (fields.stream().anyMatch(f -> f.getName().equals(name))) {
                throw new IllegalArgumentException("Field '" + name + "' declared twice");
            }
            String resolved = description != null ? description : documentation.describe(name).orElse("");
            fields.add(new ConfigField<>(name, type, resolved, getter, setter));
            return this;
        }

        public TargetConfigSchema<C> build() {
            return new TargetConfigSchema<>(fields);
        }

        private static Integer toInteger(Object value) {
            if (value instanceof Number n) {
                return n.intValue();
            }
            return Integer.valueOf(value.toString().trim());
        }

        private static Double toDouble(Object value) {
            if (value instanceof Number n) {
                return n.doubleValue();
            }
            return Double.valueOf(value.toString().trim());
        }
    }
}
