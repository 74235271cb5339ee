package com.nsmctl.commandline.descriptor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names used internally for dispatch control. A parameter carrying one of these names is never exposed as a flag.
 */
public final class ReservedNames {

    /**
     * Positional selector of a multiple-responsibility interface.
     */
    public static final String ACTION = "action";

    /**
     * Sub-command chosen inside a command suite.
     */
    public static final String SUB_INTERFACE = "sub_interface";

    public static final Set<String> DEFAULTS = Set.of(ACTION, SUB_INTERFACE);

    private ReservedNames() {
        // Constants holder
    }

    public static Set<String> with(Set<String> additional) {
        Set<String> names = new LinkedHashSet<>(DEFAULTS);
        if (additional != null) {
            names.addAll(additional);
        }
        return Set.copyOf(names);
    }
}
