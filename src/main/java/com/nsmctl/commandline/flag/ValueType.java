package com.nsmctl.commandline.flag;

/**
 * Scalar type a flag's value(s) are coerced to. {@link #NONE} marks a zero-argument toggle.
 */
public enum ValueType {
    STRING(String.class),
    INTEGER(Integer.class),
    FLOAT(Double.class),
    NONE(boolean.class);

    private final Class<?> javaType;

    ValueType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType() {
        return javaType;
    }
}
