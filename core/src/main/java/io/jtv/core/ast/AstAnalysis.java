package io.jtv.core.ast;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Structural queries over the syntax tree shared by the type checker, the purity checker and the
 * reversible subsystem: free variables, embedded calls, statement and expression walks.
 */
public final class AstAnalysis {

    private AstAnalysis() {
        // utility class
    }

    /** Variables read by {@code expr}, in first-occurrence order. Call arguments are included. */
    public static Set<String> freeVariables(DataExpr expr) {
        Set<String> out = new LinkedHashSet<>();
        collectFreeVariables(expr, out);
        return out;
    }

    /** Returns {@code true} if {@code name} is read anywhere in {@code expr}. */
    public static boolean occursFree(String name, DataExpr expr) {
        return freeVariables(expr).contains(name);
    }

    private static void collectFreeVariables(DataExpr expr, Set<String> out) {
        if (expr instanceof DataExpr.VariableRef v) {
            out.add(v.name());
        } else if (expr instanceof DataExpr.Addition a) {
            collectFreeVariables(a.left(), out);
            collectFreeVariables(a.right(), out);
        } else if (expr instanceof DataExpr.Negation n) {
            collectFreeVariables(n.operand(), out);
        } else if (expr instanceof DataExpr.PureCall c) {
            c.args().forEach(arg -> collectFreeVariables(arg, out));
        }
    }

    /** Every {@link DataExpr.PureCall} inside {@code expr}, outermost first. */
    public static List<DataExpr.PureCall> pureCalls(DataExpr expr) {
        List<DataExpr.PureCall> out = new ArrayList<>();
        collectPureCalls(expr, out);
        return out;
    }

    private static void collectPureCalls(DataExpr expr, List<DataExpr.PureCall> out) {
        if (expr instanceof DataExpr.Addition a) {
            collectPureCalls(a.left(), out);
            collectPureCalls(a.right(), out);
        } else if (expr instanceof DataExpr.Negation n) {
            collectPureCalls(n.operand(), out);
        } else if (expr instanceof DataExpr.PureCall c) {
            out.add(c);
            c.args().forEach(arg -> collectPureCalls(arg, out));
        }
    }

    /**
     * Visits {@code root} and every statement nested in it, pre-order.
     *
     * @param intoFunctions whether to descend into {@link ControlStmt.FunctionDecl} bodies
     */
    public static void forEachStatement(ControlStmt root, boolean intoFunctions, Consumer<ControlStmt> visitor) {
        // Right-nested sequences are walked iteratively; program length does not grow the stack.
        while (root instanceof ControlStmt.Sequence s) {
            visitor.accept(s);
            forEachStatement(s.first(), intoFunctions, visitor);
            root = s.second();
        }
        visitor.accept(root);
        if (root instanceof ControlStmt.If i) {
            forEachStatement(i.thenBranch(), intoFunctions, visitor);
            forEachStatement(i.elseBranch(), intoFunctions, visitor);
        } else if (root instanceof ControlStmt.While w) {
            forEachStatement(w.body(), intoFunctions, visitor);
        } else if (root instanceof ControlStmt.ForRange f) {
            forEachStatement(f.body(), intoFunctions, visitor);
        } else if (root instanceof ControlStmt.FunctionDecl d && intoFunctions) {
            forEachStatement(d.body(), true, visitor);
        }
    }

    /** Data expressions held directly by {@code stmt} (not by nested statements). */
    public static List<DataExpr> ownExpressions(ControlStmt stmt) {
        List<DataExpr> out = new ArrayList<>();
        if (stmt instanceof ControlStmt.Assign a) {
            out.add(a.value());
        } else if (stmt instanceof ControlStmt.If i) {
            collectConditionExpressions(i.condition(), out);
        } else if (stmt instanceof ControlStmt.While w) {
            collectConditionExpressions(w.condition(), out);
        } else if (stmt instanceof ControlStmt.ForRange f) {
            out.add(f.start());
            out.add(f.end());
        } else if (stmt instanceof ControlStmt.Return r) {
            out.add(r.value());
        } else if (stmt instanceof ControlStmt.Print p) {
            out.add(p.value());
        } else if (stmt instanceof ControlStmt.ReverseBlock b) {
            b.ops().forEach(op -> out.add(op.value()));
        } else if (stmt instanceof ControlStmt.CallStmt c) {
            out.addAll(c.args());
        }
        return out;
    }

    private static void collectConditionExpressions(Condition condition, List<DataExpr> out) {
        if (condition instanceof Condition.Truthy t) {
            out.add(t.expr());
        } else if (condition instanceof Condition.Comparison c) {
            out.add(c.left());
            out.add(c.right());
        } else if (condition instanceof Condition.Logical l) {
            collectConditionExpressions(l.left(), out);
            collectConditionExpressions(l.right(), out);
        } else if (condition instanceof Condition.Not n) {
            collectConditionExpressions(n.operand(), out);
        }
    }

    /** Every Data expression under {@code root}, including those nested in function bodies. */
    public static List<DataExpr> allExpressions(ControlStmt root) {
        List<DataExpr> out = new ArrayList<>();
        forEachStatement(root, true, stmt -> out.addAll(ownExpressions(stmt)));
        return out;
    }

    /** All function declarations under {@code root}, in source order. */
    public static List<ControlStmt.FunctionDecl> functionDecls(ControlStmt root) {
        List<ControlStmt.FunctionDecl> out = new ArrayList<>();
        forEachStatement(root, true, stmt -> {
            if (stmt instanceof ControlStmt.FunctionDecl d) {
                out.add(d);
            }
        });
        return out;
    }

    /** All reverse blocks under {@code root}, including those in function bodies. */
    public static List<ControlStmt.ReverseBlock> reverseBlocks(ControlStmt root) {
        List<ControlStmt.ReverseBlock> out = new ArrayList<>();
        forEachStatement(root, true, stmt -> {
            if (stmt instanceof ControlStmt.ReverseBlock b) {
                out.add(b);
            }
        });
        return out;
    }
}
