package com.nsmctl.commandline.iface;

import java.util.Map;
import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Settings fixed when an interface is built.
 */
@Value
@Builder(toBuilder = true)
public class InterfaceOptions {

    /**
     * Display name of the interface, e.g. "Kibana Install".
     */
    @NonNull
    String name;

    /**
     * When null, the target type's documentation summary is used.
     */
    String description;

    /**
     * Externally supplied defaults by parameter name (e.g. fixed install paths). A non-empty
     * default overrides the declared one and makes the flag optional.
     */
    @Singular("defaultValue")
    Map<String, Object> defaults;

    /**
     * Names excluded from flag generation in addition to the built-in dispatch keys.
     */
    @Singular
    Set<String> reservedNames;

    /**
     * Print the operation's return value after dispatch.
     */
    boolean printResult;

    public static InterfaceOptions named(String name) {
        return InterfaceOptions.builder().name(name).build();
    }
}
