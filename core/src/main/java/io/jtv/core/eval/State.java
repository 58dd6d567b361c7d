package io.jtv.core.eval;

import io.jtv.core.error.UnboundVariableException;
import io.jtv.core.number.NumericValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Program state σ: a mutable mapping from variable name to value, owned by a single execution.
 * Iteration order is first-assignment order.
 */
public final class State {

    private final Map<String, NumericValue> values;

    private State(Map<String, NumericValue> values) {
        this.values = values;
    }

    public static State empty() {
        return new State(new LinkedHashMap<>());
    }

    public static State of(Map<String, ? extends NumericValue> values) {
        return new State(new LinkedHashMap<>(values));
    }

    public Optional<NumericValue> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Reads a variable.
     *
     * @throws UnboundVariableException if {@code name} has no value
     */
    public NumericValue lookup(String name) {
        NumericValue value = values.get(name);
        if (value == null) {
            throw new UnboundVariableException(name);
        }
        return value;
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public void set(String name, NumericValue value) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(value, "value must not be null");
        values.put(name, value);
    }

    public void remove(String name) {
        values.remove(name);
    }

    /** Sets {@code name} back to {@code previous}, or removes it when there was no previous value. */
    public void restore(String name, Optional<NumericValue> previous) {
        if (previous.isPresent()) {
            values.put(name, previous.get());
        } else {
            values.remove(name);
        }
    }

    public State copy() {
        return new State(new LinkedHashMap<>(values));
    }

    /** Immutable view of the current bindings. */
    public Map<String, NumericValue> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public int size() {
        return values.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof State that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "State" + values;
    }
}
