package com.nsmctl.commandline.descriptor;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Static declaration of one operation on a target type: its parameters, its documentation
 * and the code that runs it.
 */
@Getter
public class OperationDeclaration<T> {

    private final String name;
    private final List<ParameterDescriptor> parameters;
    private final DocComment documentation;
    private final OperationInvoker<T> invoker;

    private OperationDeclaration(Builder<T> builder) {
        this.name = builder.name;
        this.parameters = List.copyOf(builder.parameters);
        this.documentation = builder.documentation;
        this.invoker = builder.invoker;
    }

    public static <T> Builder<T> builder(String name) {
        return new Builder<>(name);
    }

    public static final class Builder<T> {
        private final String name;
        private final List<ParameterDescriptor> parameters = new ArrayList<>();
        private DocComment documentation = DocComment.empty();
        private OperationInvoker<T> invoker;

        private Builder(String name) {
            this.name = name;
        }

        public Builder<T> parameter(ParameterDescriptor parameter) {
            parameters.add(parameter);
            return this;
        }

        public Builder<T> parameter(String name, SemanticType type) {
            return parameter(ParameterDescriptor.of(name, type));
        }

        public Builder<T> parameter(String name, SemanticType type, Object defaultValue) {
            return parameter(ParameterDescriptor.builder().name(name).type(type).defaultValue(defaultValue).build());
        }

        public Builder<T> documentation(String text) {
            this.documentation = DocComment.parse(text);
            return this;
        }

        public Builder<T> invoker(OperationInvoker<T> invoker) {
            this.invoker = invoker;
            return this;
        }

        public OperationDeclaration<T> build() {
            if (invoker == null) {
                throw new IllegalStateException("Operation '" + name + "' declares no invoker");
            }
            return new OperationDeclaration<>(this);
        }
    }
}
