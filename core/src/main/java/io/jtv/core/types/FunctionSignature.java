package io.jtv.core.types;

import io.jtv.core.ast.ControlStmt;
import io.jtv.core.ast.Param;
import io.jtv.core.ast.Purity;
import java.util.List;
import java.util.Objects;

/**
 * Callable interface of a declared function, as seen by callers.
 *
 * @param name       function name
 * @param params     parameter types, in order
 * @param returnType declared return type ({@link Type#UNIT} if none)
 * @param purity     declared purity annotation
 */
public record FunctionSignature(String name, List<Type> params, Type returnType, Purity purity) {

    public FunctionSignature {
        Objects.requireNonNull(name, "name must not be null");
        params = List.copyOf(params);
        Objects.requireNonNull(returnType, "returnType must not be null");
        Objects.requireNonNull(purity, "purity must not be null");
    }

    public static FunctionSignature of(ControlStmt.FunctionDecl decl) {
        return new FunctionSignature(
                decl.name(), decl.params().stream().map(Param::type).toList(), decl.returnType(), decl.purity());
    }

    public int arity() {
        return params.size();
    }
}
