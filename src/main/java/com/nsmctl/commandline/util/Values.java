package com.nsmctl.commandline.util;

import java.util.Collection;
import java.util.Map;

import lombok.experimental.UtilityClass;

/**
 * Truthiness rule shared by flag derivation (is a default "present"?) and config mutation
 * (is an input value "supplied"?).
 *
 * null, false, zero, empty strings and empty collections are all considered absent.
 */
@UtilityClass
public class Values {

    public boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0d;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    public boolean isFalsy(Object value) {
        return !isTruthy(value);
    }

    /**
     * Display form used in reports: absent values render as {@code N/A}.
     */
    public Object orNotAvailable(Object value) {
        return isTruthy(value) ? value : "N/A";
    }
}
