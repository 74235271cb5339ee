package com.nsmctl.commandline.descriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Static declaration of a type that can be turned into a command interface.
 *
 * Each level of a type hierarchy is its own {@code TargetType}: it declares its constructor
 * parameters, the operations defined at that level and, optionally, the parent type whose
 * operations it inherits. Redefining an operation name on a derived type overrides the parent's.
 */
@Getter
public class TargetType<T> {

    private final String name;
    private final DocComment documentation;
    @Getter(AccessLevel.NONE)
    private final TargetType<? super T> parent;
    private final List<ParameterDescriptor> constructorParameters;
    private final DocComment constructorDocumentation;
    @Getter(AccessLevel.NONE)
    private final TargetFactory<T> factory;
    private final List<OperationDeclaration<T>> operations;

    private TargetType(Builder<T> builder) {
        this.name = builder.name;
        this.documentation = builder.documentation;
        this.parent = builder.parent;
        this.constructorParameters = List.copyOf(builder.constructorParameters);
        this.constructorDocumentation = builder.constructorDocumentation;
        this.factory = builder.factory;
        this.operations = List.copyOf(builder.operations);
    }

    public Optional<TargetType<? super T>> getParentType() {
        return Optional.ofNullable(parent);
    }

    /**
     * Empty for types that only contribute operations to derived types.
     */
    public Optional<TargetFactory<T>> getFactory() {
        return Optional.ofNullable(factory);
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    public static final class Builder<T> {
        private final String name;
        private DocComment documentation = DocComment.empty();
        private TargetType<? super T> parent;
        private final List<ParameterDescriptor> constructorParameters = new ArrayList<>();
        private DocComment constructorDocumentation = DocComment.empty();
        private TargetFactory<T> factory;
        private final List<OperationDeclaration<T>> operations = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<T> documentation(String text) {
            this.documentation = DocComment.parse(text);
            return this;
        }

        public Builder<T> extending(TargetType<? super T> parent) {
            this.parent = parent;
            return this;
        }

        public Builder<T> constructorParameter(ParameterDescriptor parameter) {
            constructorParameters.add(parameter);
            return this;
        }

        public Builder<T> constructorParameter(String name, SemanticType type) {
            return constructorParameter(ParameterDescriptor.of(name, type));
        }

        public Builder<T> constructorParameter(String name, SemanticType type, Object defaultValue) {
            return constructorParameter(
                    ParameterDescriptor.builder().name(name).type(type).defaultValue(defaultValue).build());
        }

        /**
         * Documentation whose {@code @param} tags describe the constructor parameters.
         */
        public Builder<T> constructorDocumentation(String text) {
            this.constructorDocumentation = DocComment.parse(text);
            return this;
        }

        public Builder<T> factory(TargetFactory<T> factory) {
            this.factory = factory;
            return this;
        }

        public Builder<T> operation(OperationDeclaration<T> operation) {
            operations.add(operation);
            return this;
        }

        public TargetType<T> build() {
            return new TargetType<>(this);
        }
    }
}
