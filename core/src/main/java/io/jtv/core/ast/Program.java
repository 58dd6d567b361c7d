package io.jtv.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * A complete program as produced by the external parser: one top-level statement, usually a
 * {@link ControlStmt.Sequence}. Immutable.
 *
 * @param id   identifier used in logs and results (file name, REPL cell id)
 * @param body the top-level statement
 */
public record Program(String id, ControlStmt body) {

    public Program {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }

    public static Program of(ControlStmt... statements) {
        return new Program("<anonymous>", ControlStmt.sequence(statements));
    }

    /** All function declarations in the program, in source order, wherever they are nested. */
    public List<ControlStmt.FunctionDecl> functions() {
        return AstAnalysis.functionDecls(body);
    }
}
