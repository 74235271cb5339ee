package com.nsmctl.commandline.descriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.nsmctl.commandline.exception.CommandSynthesisException;
import com.nsmctl.commandline.iface.ParsedArguments;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * Flattened view of a target type: its constructor ("base parameters") and every operation visible on it,
 * with derived definitions already merged over inherited ones.
 *
 * Built once by {@link DescriptorExtractor}; immutable afterwards.
 */
@Getter
public class TargetDescriptor<T> {

    public static final String CONSTRUCTOR_NAME = "<init>";

    private final String name;
    private final String summary;
    private final OperationDescriptor constructor;
    private final Map<String, OperationDescriptor> operations;

    @Getter(AccessLevel.NONE)
    private final TargetFactory<T> factory;
    @Getter(AccessLevel.NONE)
    private final Map<String, OperationInvoker<? super T>> invokers;

    TargetDescriptor(String name, String summary, OperationDescriptor constructor,
            Map<String, OperationDescriptor> operations, TargetFactory<T> factory,
            Map<String, OperationInvoker<? super T>> invokers) {
        this.name = name;
        this.summary = summary;
        this.constructor = constructor;
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
        this.factory = factory;
        this.invokers = Map.copyOf(invokers);
    }

    public List<ParameterDescriptor> getBaseParameters() {
        return constructor.getParameters();
    }

    public Optional<OperationDescriptor> findOperation(String operationName) {
        return Optional.ofNullable(operations.get(operationName));
    }

    public boolean hasOperation(String operationName) {
        return operations.containsKey(operationName);
    }

    public T instantiate(ParsedArguments constructorArguments) throws Exception {
        return factory.create(constructorArguments);
    }

    public Object invoke(String operationName, T target, ParsedArguments operationArguments) throws Exception {
        OperationInvoker<? super T> invoker = invokers.get(operationName);
        if (invoker == null) {
            throw new CommandSynthesisException("No operation '" + operationName + "' on " + name);
        }
        return invoker.invoke(target, operationArguments);
    }
}
