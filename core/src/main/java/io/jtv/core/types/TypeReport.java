package io.jtv.core.types;

import io.jtv.core.ast.DataExpr;
import io.jtv.core.error.TypeCheckException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of type checking a program: either a type-annotated tree (every Data expression node
 * mapped to its inferred type) or a non-empty list of errors.
 *
 * <p>Immutable.
 */
public final class TypeReport {

    private final List<TypeCheckException> errors;
    private final Map<String, FunctionSignature> signatures;
    private final TypeEnv finalEnv;
    private final Map<DataExpr, Type> annotations;

    TypeReport(
            List<TypeCheckException> errors,
            Map<String, FunctionSignature> signatures,
            TypeEnv finalEnv,
            IdentityHashMap<DataExpr, Type> annotations) {
        this.errors = List.copyOf(errors);
        this.signatures = Collections.unmodifiableMap(new LinkedHashMap<>(signatures));
        this.finalEnv = finalEnv;
        this.annotations = Collections.unmodifiableMap(new IdentityHashMap<>(annotations));
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    /** All type errors, in the order they were found. */
    public List<TypeCheckException> errors() {
        return errors;
    }

    /** Declared function signatures, by name. */
    public Map<String, FunctionSignature> signatures() {
        return signatures;
    }

    /** Variable types after the last top-level statement. */
    public TypeEnv finalEnv() {
        return finalEnv;
    }

    /** The inferred type of a Data expression node of the checked program (identity lookup). */
    public Optional<Type> typeOf(DataExpr expr) {
        return Optional.ofNullable(annotations.get(expr));
    }
}
