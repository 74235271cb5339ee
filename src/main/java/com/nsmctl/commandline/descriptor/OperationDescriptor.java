package com.nsmctl.commandline.descriptor;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A named operation (or constructor) with its ordered parameter list.
 */
@Value
@Builder(toBuilder = true)
public class OperationDescriptor {

    @NonNull
    String name;

    @Singular
    List<ParameterDescriptor> parameters;

    @NonNull
    @Builder.Default
    String summary = "";

    public boolean hasParameters() {
        return !parameters.isEmpty();
    }

    public List<String> parameterNames() {
        return parameters.stream().map(ParameterDescriptor::getName).toList();
    }
}
