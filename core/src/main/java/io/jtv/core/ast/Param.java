package io.jtv.core.ast;

import io.jtv.core.types.Type;
import java.util.Objects;

/**
 * A typed function parameter.
 *
 * @param name parameter name, bound in the callee's fresh scope
 * @param type declared type; arguments are coerced to it on call
 */
public record Param(String name, Type type) {
    public Param {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }
}
