package io.jtv.core.types;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Typing context Γ: variable name → static type. Immutable; {@link #bind} returns a new environment.
 *
 * <p>A variable whose assigned expression failed to type is kept as <em>unknown</em> so that later
 * reads do not report a second, cascading error.
 */
public final class TypeEnv {

    private static final TypeEnv EMPTY = new TypeEnv(Map.of(), Set.of());

    private final Map<String, Type> vars;
    private final Set<String> unknown;

    private TypeEnv(Map<String, Type> vars, Set<String> unknown) {
        this.vars = vars;
        this.unknown = unknown;
    }

    public static TypeEnv empty() {
        return EMPTY;
    }

    public static TypeEnv of(Map<String, Type> bindings) {
        return new TypeEnv(Collections.unmodifiableMap(new LinkedHashMap<>(bindings)), Set.of());
    }

    public Optional<Type> lookup(String name) {
        return Optional.ofNullable(vars.get(name));
    }

    /** Bound, but its type could not be determined because of an earlier error. */
    public boolean isUnknown(String name) {
        return unknown.contains(name);
    }

    public boolean isBound(String name) {
        return vars.containsKey(name) || unknown.contains(name);
    }

    public TypeEnv bind(String name, Type type) {
        Objects.requireNonNull(type, "type must not be null");
        Map<String, Type> next = new LinkedHashMap<>(vars);
        next.put(name, type);
        Set<String> nextUnknown = unknown;
        if (unknown.contains(name)) {
            nextUnknown = new HashSet<>(unknown);
            nextUnknown.remove(name);
            nextUnknown = Collections.unmodifiableSet(nextUnknown);
        }
        return new TypeEnv(Collections.unmodifiableMap(next), nextUnknown);
    }

    public TypeEnv bindUnknown(String name) {
        Map<String, Type> next = new LinkedHashMap<>(vars);
        next.remove(name);
        Set<String> nextUnknown = new HashSet<>(unknown);
        nextUnknown.add(name);
        return new TypeEnv(Collections.unmodifiableMap(next), Collections.unmodifiableSet(nextUnknown));
    }

    /** Removes {@code name}, or restores the binding it had in {@code outer}. */
    public TypeEnv restore(String name, TypeEnv outer) {
        if (outer.vars.containsKey(name)) {
            return bind(name, outer.vars.get(name));
        }
        if (outer.unknown.contains(name)) {
            return bindUnknown(name);
        }
        Map<String, Type> next = new LinkedHashMap<>(vars);
        next.remove(name);
        Set<String> nextUnknown = new HashSet<>(unknown);
        nextUnknown.remove(name);
        return new TypeEnv(Collections.unmodifiableMap(next), Collections.unmodifiableSet(nextUnknown));
    }

    /** Bound variable names with a known type. */
    public Map<String, Type> bindings() {
        return vars;
    }

    Set<String> unknownNames() {
        return unknown;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypeEnv that)) return false;
        return vars.equals(that.vars) && unknown.equals(that.unknown);
    }

    @Override
    public int hashCode() {
        return Objects.hash(vars, unknown);
    }

    @Override
    public String toString() {
        return "TypeEnv" + vars;
    }
}
