package com.nsmctl.commandline.util;

/**
 * Conversions between declared parameter names and their command-line spelling.
 */
public class NamingUtil {

    private static final String FLAG_PREFIX = "--";

    private NamingUtil() {
        // Utility class
    }

    /**
     * {@code node_name} becomes {@code --node-name}.
     */
    public static String toFlagName(String parameterName) {
        return FLAG_PREFIX + toHyphenated(parameterName);
    }

    /**
     * Operation and option names are shown to users with hyphens instead of underscores.
     */
    public static String toHyphenated(String name) {
        if (name == null) {
            return null;
        }
        return name.replace('_', '-');
    }

    /**
     * Reverses {@link #toHyphenated(String)} so an action token resolves back to its operation.
     */
    public static String toUnderscored(String token) {
        if (token == null) {
            return null;
        }
        return token.replace('-', '_');
    }

    /**
     * Strips the leading dashes from a flag, then converts it back to the parameter name.
     */
    public static String toParameterName(String flag) {
        if (flag == null) {
            return null;
        }
        String bare = flag;
        while (bare.startsWith("-")) {
            bare = bare.substring(1);
        }
        return toUnderscored(bare);
    }
}
