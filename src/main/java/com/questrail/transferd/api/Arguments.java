package com.questrail.transferd.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arguments
 * -----------------------------------------------------------------------------
 * Positional and named arguments of one call, with typed accessors.
 *
 * <p>Each accessor takes both a position and a name: a value is looked up
 * positionally first and then by name, so clients may use either style.
 * Type mismatches and missing required values raise an
 * {@code InvalidArguments} fault.</p>
 */
public final class Arguments
{
    private static final Arguments EMPTY = new Arguments(List.of(), Map.of());

    private final List<Object> positional;
    private final Map<String, Object> named;

    public Arguments(List<Object> positional, Map<String, Object> named) {
        this.positional = positional == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(positional));
        this.named = named == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(named));
    }

    public static Arguments empty() {
        return EMPTY;
    }

    public List<Object> positional() {
        return positional;
    }

    public Map<String, Object> named() {
        return named;
    }

    public Optional<Object> find(int index, String name) {
        if (index >= 0 && index < positional.size()) {
            return Optional.ofNullable(positional.get(index));
        }
        return Optional.ofNullable(named.get(name));
    }

    public String requireString(int index, String name) {
        return optionalString(index, name)
                .orElseThrow(() -> FaultException.invalidArguments("missing argument '" + name + "'"));
    }

    public Optional<String> optionalString(int index, String name) {
        return find(index, name).map(v -> cast(v, String.class, name));
    }

    public long requireLong(int index, String name) {
        Object value = find(index, name)
                .orElseThrow(() -> FaultException.invalidArguments("missing argument '" + name + "'"));
        Number number = cast(value, Number.class, name);
        if (number.doubleValue() != Math.rint(number.doubleValue())) {
            throw FaultException.invalidArguments("argument '" + name + "' must be an integer");
        }
        return number.longValue();
    }

    public boolean optionalBoolean(int index, String name, boolean defaultValue) {
        return find(index, name).map(v -> cast(v, Boolean.class, name)).orElse(defaultValue);
    }

    public List<String> requireStringList(int index, String name) {
        Object value = find(index, name)
                .orElseThrow(() -> FaultException.invalidArguments("missing argument '" + name + "'"));
        if (value instanceof String single) {
            return List.of(single);
        }
        List<?> list = cast(value, List.class, name);
        List<String> out = new ArrayList<>(list.size());
        for (Object element : list) {
            out.add(cast(element, String.class, name));
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> optionalMap(int index, String name) {
        return find(index, name)
                .map(v -> (Map<String, Object>) cast(v, Map.class, name))
                .orElse(Map.of());
    }

    private static <T> T cast(Object value, Class<T> type, String name) {
        if (!type.isInstance(value)) {
            throw FaultException.invalidArguments("argument '" + name + "' must be of type "
                    + type.getSimpleName().toLowerCase() + ", got "
                    + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        return type.cast(value);
    }

    @Override
    public String toString() {
        return "Arguments[positional=" + positional + ", named=" + named + "]";
    }
}
