package com.nsmctl.commandline.iface;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Value bag produced by parsing: parameter name to parsed value, in grammar order.
 *
 * Absent optional flags are present with their default (possibly null); toggles are always a Boolean.
 */
@EqualsAndHashCode
@ToString
public final class ParsedArguments {

    private static final ParsedArguments EMPTY = new ParsedArguments(Map.of());

    private final Map<String, Object> values;

    public ParsedArguments(Map<String, ?> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static ParsedArguments empty() {
        return EMPTY;
    }

    public static ParsedArguments of(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/value pairs");
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            values.put((String) namesAndValues[i], namesAndValues[i + 1]);
        }
        return new ParsedArguments(values);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Object get(String name) {
        return values.get(name);
    }

    public String getString(String name) {
        Object value = values.get(name);
        return value == null ? null : value.toString();
    }

    public Integer getInteger(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.intValue();
        }
        return Integer.valueOf(value.toString());
    }

    public Double getDouble(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return Double.valueOf(value.toString());
    }

    /**
     * Missing or null toggles read as false.
     */
    public boolean getBoolean(String name) {
        Object value = values.get(name);
        if (value instanceof Boolean b) {
            return b;
        }
        return value != null && Boolean.parseBoolean(value.toString());
    }

    /**
     * Multi-value flag read as a list; a single value reads as a one-element list, a missing one as empty.
     *
     * @throws ClassCastException if an element is not of {@code elementType}
     */
    public <E> List<E> getList(String name, Class<E> elementType) {
        Object value = values.get(name);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> c) {
            return c.stream().map(elementType::cast).toList();
        }
        return List.of(elementType.cast(value));
    }

    public Set<String> names() {
        return values.keySet();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public ParsedArguments filter(Predicate<String> nameFilter) {
        Map<String, Object> kept = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            if (nameFilter.test(name)) {
                kept.put(name, value);
            }
        });
        return new ParsedArguments(kept);
    }

    public ParsedArguments with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new ParsedArguments(copy);
    }

    public ParsedArguments without(Collection<String> names) {
        return filter(name -> !names.contains(name));
    }
}
