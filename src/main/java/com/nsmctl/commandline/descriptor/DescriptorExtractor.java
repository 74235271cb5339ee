package com.nsmctl.commandline.descriptor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.nsmctl.commandline.exception.CommandSynthesisException;
import com.nsmctl.commandline.exception.MissingTypeAnnotationException;

/**
 * Turns a {@link TargetType} declaration chain into a {@link TargetDescriptor}.
 *
 * Operations are collected from the most-derived type up to the root; the first declaration seen for a name
 * wins, so a derived type's redefinition shadows the inherited signature. Only the most-derived type's own
 * constructor is used.
 *
 * Pure read of declarations; no side effects.
 */
public class DescriptorExtractor {

    private static final Logger log = LoggerFactory.getLogger(DescriptorExtractor.class);

    private final Set<String> reservedNames;

    public DescriptorExtractor() {
        this(ReservedNames.DEFAULTS);
    }

    public DescriptorExtractor(Set<String> reservedNames) {
        this.reservedNames = Set.copyOf(reservedNames);
    }

    public <T> TargetDescriptor<T> extract(TargetType<T> type) {
        TargetFactory<T> factory = type.getFactory()
                .orElseThrow(() -> new CommandSynthesisException(
                        "Target type '" + type.getName() + "' declares no factory and cannot be instantiated"));

        OperationDescriptor constructor = extractConstructor(type);

        Map<String, OperationDescriptor> operations = new LinkedHashMap<>();
        Map<String, OperationInvoker<? super T>> invokers = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        collectOperations(type, seen, operations, invokers);

        log.debug("Extracted {}: {} base parameter(s), operations {}", type.getName(),
                constructor.getParameters().size(), operations.keySet());

        return new TargetDescriptor<>(type.getName(), type.getDocumentation().getSummary(), constructor,
                operations, factory, invokers);
    }

    private <T> OperationDescriptor extractConstructor(TargetType<T> type) {
        List<String> untyped = new ArrayList<>();
        List<ParameterDescriptor> parameters = new ArrayList<>();
        for (ParameterDescriptor declared : type.getConstructorParameters()) {
            if (!declared.isTyped()) {
                untyped.add(declared.getName());
                continue;
            }
            parameters.add(resolve(declared, type.getConstructorDocumentation()));
        }
        if (!untyped.isEmpty()) {
            throw new MissingTypeAnnotationException(type.getName(), untyped);
        }
        return OperationDescriptor.builder()
                .name(TargetDescriptor.CONSTRUCTOR_NAME)
                .parameters(parameters)
                .summary(type.getConstructorDocumentation().getSummary())
                .build();
    }

    private <T> void collectOperations(TargetType<? super T> level, Set<String> seen,
            Map<String, OperationDescriptor> operations, Map<String, OperationInvoker<? super T>> invokers) {
        for (OperationDeclaration<? super T> declaration : level.getOperations()) {
            String operationName = declaration.getName();
            if (TargetDescriptor.CONSTRUCTOR_NAME.equals(operationName) || seen.contains(operationName)) {
                continue;
            }

            List<String> untyped = declaration.getParameters().stream()
                    .filter(p -> !p.isTyped())
                    .map(ParameterDescriptor::getName)
                    .toList();
            if (!untyped.isEmpty()) {
                // Not recorded, so an inherited definition of the same name can still be used
                log.warn("Skipping operation {}.{}: no type declared for {}", level.getName(), operationName, untyped);
                continue;
            }

            List<ParameterDescriptor> parameters = declaration.getParameters().stream()
                    .map(p -> resolve(p, declaration.getDocumentation()))
                    .toList();
            operations.put(operationName, OperationDescriptor.builder()
                    .name(operationName)
                    .parameters(parameters)
                    .summary(declaration.getDocumentation().getSummary())
                    .build());
            invokers.put(operationName, declaration.getInvoker());
            seen.add(operationName);
            log.debug("Recorded operation {} from {}", operationName, level.getName());
        }

        level.getParentType().ifPresent(parent -> this.<T>collectOperations(parent, seen, operations, invokers));
    }

    private ParameterDescriptor resolve(ParameterDescriptor declared, DocComment documentation) {
        String description = declared.getDescription();
        if (description.isEmpty()) {
            description = documentation.describe(declared.getName()).orElse("");
        }
        return declared.toBuilder()
                .description(description)
                .reserved(declared.isReserved() || reservedNames.contains(declared.getName()))
                .build();
    }
}
