package io.jtv.core.types;

import io.jtv.core.ast.Condition;
import io.jtv.core.ast.ControlStmt;
import io.jtv.core.ast.DataExpr;
import io.jtv.core.ast.Param;
import io.jtv.core.ast.Program;
import io.jtv.core.ast.ReversibleOp;
import io.jtv.core.error.TypeCheckException;
import io.jtv.core.number.Intrinsic;
import io.jtv.core.number.NumericKind;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Syntax-directed, flow-sensitive type checker.
 *
 * <ul>
 * <li>{@link #infer} computes the type of a Data expression; addition yields the least upper bound
 * of its operands in the coercion lattice.
 * <li>{@link #check} threads an environment through a statement: assignments rebind, branches
 * merge by join, loops are iterated until the environment is stable.
 * <li>{@link #checkProgram} does both for a whole program, collecting every error instead of
 * stopping at the first.
 * </ul>
 *
 * <p>Function bodies see only their parameters. Not thread-safe; use one instance per check.
 */
public final class TypeChecker {

    private static final Logger LOG = LoggerFactory.getLogger(TypeChecker.class);

    /** Upper bound on loop re-checks; the lattice has height 3 so this is never reached in practice. */
    private static final int MAX_LOOP_PASSES = 16;

    private final Map<String, FunctionSignature> signatures = new LinkedHashMap<>();
    private final IdentityHashMap<DataExpr, Type> annotations = new IdentityHashMap<>();

    /** Where a statement is checked: the enclosing function, or the top level. */
    private record Scope(String function, Type expectedReturn) {
        static final Scope TOP_LEVEL = new Scope(null, null);

        boolean inFunction() {
            return function != null;
        }
    }

    public TypeChecker() {}

    /** A checker that resolves calls against the given signatures (used for REPL-style checks). */
    public TypeChecker(Map<String, FunctionSignature> signatures) {
        this.signatures.putAll(signatures);
    }

    // ── Public contract ──

    /**
     * Type checks a complete program: registers every function declaration, checks each function
     * body, then the top-level statement.
     */
    public TypeReport checkProgram(Program program) {
        signatures.clear();
        annotations.clear();
        List<TypeCheckException> errors = new ArrayList<>();

        List<ControlStmt.FunctionDecl> functions = program.functions();
        for (ControlStmt.FunctionDecl decl : functions) {
            if (signatures.containsKey(decl.name()) || Intrinsic.byName(decl.name()).isPresent()) {
                errors.add(TypeCheckException.duplicateFunction(decl.name()));
                continue;
            }
            signatures.put(decl.name(), FunctionSignature.of(decl));
        }
        for (ControlStmt.FunctionDecl decl : functions) {
            checkFunction(decl, errors);
        }
        TypeEnv finalEnv = checkStmt(program.body(), TypeEnv.empty(), Scope.TOP_LEVEL, errors);

        LOG.debug(
                "Type check complete: program={}, functions={}, errors={}",
                program.id(),
                functions.size(),
                errors.size());
        return new TypeReport(errors, signatures, finalEnv, annotations);
    }

    /**
     * Infers the type of {@code expr} under {@code env}.
     *
     * @throws TypeCheckException the first error found
     */
    public Type infer(DataExpr expr, TypeEnv env) {
        List<TypeCheckException> errors = new ArrayList<>();
        Optional<Type> type = inferExpr(expr, env, errors);
        if (!errors.isEmpty()) {
            throw errors.get(0);
        }
        return type.orElseThrow();
    }

    /**
     * Checks a top-level statement and returns the environment after it.
     *
     * @throws TypeCheckException the first error found
     */
    public TypeEnv check(ControlStmt stmt, TypeEnv env) {
        List<TypeCheckException> errors = new ArrayList<>();
        TypeEnv out = checkStmt(stmt, env, Scope.TOP_LEVEL, errors);
        if (!errors.isEmpty()) {
            throw errors.get(0);
        }
        return out;
    }

    // ── Functions ──

    private void checkFunction(ControlStmt.FunctionDecl decl, List<TypeCheckException> errors) {
        TypeEnv env = TypeEnv.empty();
        Set<String> seen = new HashSet<>();
        for (Param param : decl.params()) {
            if (!seen.add(param.name())) {
                errors.add(new TypeCheckException(
                        TypeCheckException.Kind.DUPLICATE_FUNCTION,
                        "Function '" + decl.name() + "' declares parameter '" + param.name() + "' twice",
                        decl.name()));
            }
            if (param.type() == Type.UNIT) {
                errors.add(TypeCheckException.mismatch("numeric parameter type", "UNIT", param.name()));
            }
            env = env.bind(param.name(), param.type());
        }
        checkStmt(decl.body(), env, new Scope(decl.name(), decl.returnType()), errors);
        if (decl.returnType() != Type.UNIT && !definitelyReturns(decl.body())) {
            errors.add(TypeCheckException.mismatch(
                    decl.returnType().name(), "a path without return", decl.name()));
        }
    }

    /** Conservative: loops may run zero times, so only straight-line and two-armed returns count. */
    static boolean definitelyReturns(ControlStmt stmt) {
        if (stmt instanceof ControlStmt.Return) {
            return true;
        } else if (stmt instanceof ControlStmt.Sequence s) {
            return definitelyReturns(s.first()) || definitelyReturns(s.second());
        } else if (stmt instanceof ControlStmt.If i) {
            return definitelyReturns(i.thenBranch()) && definitelyReturns(i.elseBranch());
        }
        return false;
    }

    // ── Statements ──

    private TypeEnv checkStmt(ControlStmt stmt, TypeEnv env, Scope scope, List<TypeCheckException> errors) {
        if (stmt instanceof ControlStmt.Skip || stmt instanceof ControlStmt.FunctionDecl) {
            return env;
        } else if (stmt instanceof ControlStmt.Assign a) {
            return bindResult(a.target(), inferExpr(a.value(), env, errors), env, errors);
        } else if (stmt instanceof ControlStmt.Sequence s) {
            return checkStmt(s.second(), checkStmt(s.first(), env, scope, errors), scope, errors);
        } else if (stmt instanceof ControlStmt.If i) {
            checkCondition(i.condition(), env, errors);
            TypeEnv thenEnv = checkStmt(i.thenBranch(), env, scope, errors);
            TypeEnv elseEnv = checkStmt(i.elseBranch(), env, scope, errors);
            return merge(thenEnv, elseEnv, errors);
        } else if (stmt instanceof ControlStmt.While w) {
            return checkLoop(env, errors, (entry, sink) -> {
                checkCondition(w.condition(), entry, sink);
                return checkStmt(w.body(), entry, scope, sink);
            });
        } else if (stmt instanceof ControlStmt.ForRange f) {
            return checkForRange(f, env, scope, errors);
        } else if (stmt instanceof ControlStmt.Return r) {
            checkReturn(r, env, scope, errors);
            return env;
        } else if (stmt instanceof ControlStmt.Print p) {
            inferExpr(p.value(), env, errors)
                    .filter(t -> t == Type.UNIT)
                    .ifPresent(t -> errors.add(TypeCheckException.mismatch("printable numeric value", "UNIT")));
            return env;
        } else if (stmt instanceof ControlStmt.ReverseBlock b) {
            TypeEnv current = env;
            for (ReversibleOp op : b.ops()) {
                current = checkReversibleOp(op, current, errors);
            }
            return current;
        } else if (stmt instanceof ControlStmt.CallStmt c) {
            inferCall(c.name(), c.args(), env, errors);
            return env;
        }
        throw new IllegalStateException("Unhandled statement: " + stmt.getClass().getSimpleName());
    }

    private TypeEnv bindResult(String target, Optional<Type> type, TypeEnv env, List<TypeCheckException> errors) {
        if (type.isEmpty()) {
            return env.bindUnknown(target);
        }
        if (type.get() == Type.UNIT) {
            errors.add(TypeCheckException.mismatch("numeric value", "UNIT", target));
            return env.bindUnknown(target);
        }
        return env.bind(target, type.get());
    }

    private void checkReturn(ControlStmt.Return r, TypeEnv env, Scope scope, List<TypeCheckException> errors) {
        Optional<Type> type = inferExpr(r.value(), env, errors);
        if (type.isEmpty() || !scope.inFunction()) {
            return;
        }
        Type expected = scope.expectedReturn();
        if (expected == Type.UNIT || !type.get().coercesTo(expected)) {
            errors.add(TypeCheckException.mismatch(expected.name(), type.get().name(), scope.function()));
        }
    }

    private TypeEnv checkForRange(
            ControlStmt.ForRange f, TypeEnv env, Scope scope, List<TypeCheckException> errors) {
        requireInteger(f.start(), env, errors);
        requireInteger(f.end(), env, errors);
        TypeEnv after = checkLoop(env, errors, (entry, sink) -> {
            TypeEnv inner = checkStmt(f.body(), entry.bind(f.variable(), Type.INTEGER), scope, sink);
            return inner.restore(f.variable(), entry);
        });
        return after.restore(f.variable(), env);
    }

    private void requireInteger(DataExpr bound, TypeEnv env, List<TypeCheckException> errors) {
        inferExpr(bound, env, errors)
                .filter(t -> t != Type.INTEGER)
                .ifPresent(t -> errors.add(TypeCheckException.mismatch("INTEGER range bound", t.name())));
    }

    /**
     * Iterates a loop body until the entry environment stops widening, then checks it once more
     * reporting errors. Variables first bound inside the body are not visible after the loop.
     */
    private TypeEnv checkLoop(
            TypeEnv env,
            List<TypeCheckException> errors,
            BiFunction<TypeEnv, List<TypeCheckException>, TypeEnv> body) {
        TypeEnv entry = env;
        for (int pass = 0; pass < MAX_LOOP_PASSES; pass++) {
            TypeEnv out = body.apply(entry, new ArrayList<>());
            TypeEnv widened = widen(entry, out, null);
            if (widened.equals(entry)) {
                break;
            }
            entry = widened;
        }
        TypeEnv out = body.apply(entry, errors);
        widen(entry, out, errors);
        return entry;
    }

    /** Joins loop-carried types of {@code out} into {@code entry}, keeping only {@code entry}'s names. */
    private static TypeEnv widen(TypeEnv entry, TypeEnv out, List<TypeCheckException> errors) {
        TypeEnv result = entry;
        for (Map.Entry<String, Type> binding : entry.bindings().entrySet()) {
            String name = binding.getKey();
            if (out.isUnknown(name)) {
                result = result.bindUnknown(name);
                continue;
            }
            Optional<Type> carried = out.lookup(name);
            if (carried.isEmpty()) {
                continue;
            }
            Optional<Type> joined = Type.join(binding.getValue(), carried.get());
            if (joined.isPresent()) {
                result = result.bind(name, joined.get());
            } else if (errors != null) {
                errors.add(TypeCheckException.mismatch(
                        binding.getValue().name(), carried.get().name(), name));
            }
        }
        return result;
    }

    /** Environment after a two-armed branch: names bound in both arms, at the join of their types. */
    private static TypeEnv merge(TypeEnv a, TypeEnv b, List<TypeCheckException> errors) {
        TypeEnv result = TypeEnv.empty();
        for (Map.Entry<String, Type> binding : a.bindings().entrySet()) {
            String name = binding.getKey();
            if (b.isUnknown(name)) {
                result = result.bindUnknown(name);
                continue;
            }
            Optional<Type> other = b.lookup(name);
            if (other.isEmpty()) {
                continue;
            }
            Optional<Type> joined = Type.join(binding.getValue(), other.get());
            if (joined.isPresent()) {
                result = result.bind(name, joined.get());
            } else {
                errors.add(TypeCheckException.mismatch(binding.getValue().name(), other.get().name(), name));
                result = result.bindUnknown(name);
            }
        }
        for (String name : a.unknownNames()) {
            if (b.isBound(name)) {
                result = result.bindUnknown(name);
            }
        }
        return result;
    }

    private TypeEnv checkReversibleOp(ReversibleOp op, TypeEnv env, List<TypeCheckException> errors) {
        Optional<Type> valueType = inferExpr(op.value(), env, errors);
        if (env.isUnknown(op.target())) {
            return env;
        }
        Optional<Type> targetType = env.lookup(op.target());
        if (targetType.isEmpty()) {
            errors.add(TypeCheckException.unboundVariable(op.target()));
            return env.bindUnknown(op.target());
        }
        if (valueType.isEmpty()) {
            return env.bindUnknown(op.target());
        }
        Optional<Type> joined = Type.join(targetType.get(), valueType.get());
        if (joined.isEmpty()) {
            errors.add(TypeCheckException.mismatch(targetType.get().name(), valueType.get().name(), op.target()));
            return env.bindUnknown(op.target());
        }
        return env.bind(op.target(), joined.get());
    }

    // ── Conditions ──

    private void checkCondition(Condition condition, TypeEnv env, List<TypeCheckException> errors) {
        if (condition instanceof Condition.Truthy t) {
            inferExpr(t.expr(), env, errors)
                    .filter(type -> type == Type.UNIT || type == Type.SYMBOLIC)
                    .ifPresent(type -> errors.add(
                            TypeCheckException.mismatch("non-symbolic numeric condition", type.name())));
        } else if (condition instanceof Condition.Comparison c) {
            Optional<Type> left = inferExpr(c.left(), env, errors);
            Optional<Type> right = inferExpr(c.right(), env, errors);
            if (left.isEmpty() || right.isEmpty()) {
                return;
            }
            Optional<Type> joined = Type.join(left.get(), right.get());
            if (joined.isEmpty() || joined.get() == Type.UNIT) {
                errors.add(TypeCheckException.mismatch(
                        "comparable operands for '" + c.op().symbol() + "'", left.get() + " and " + right.get()));
            } else if (c.op().isOrdering()
                    && !joined.get().kind().map(NumericKind::isOrdered).orElse(false)) {
                errors.add(TypeCheckException.mismatch(
                        "ordered operands for '" + c.op().symbol() + "'", left.get() + " and " + right.get()));
            }
        } else if (condition instanceof Condition.Logical l) {
            checkCondition(l.left(), env, errors);
            checkCondition(l.right(), env, errors);
        } else if (condition instanceof Condition.Not n) {
            checkCondition(n.operand(), env, errors);
        }
    }

    // ── Expressions ──

    /** Empty when an error was recorded (or a variable's type is unknown from an earlier error). */
    private Optional<Type> inferExpr(DataExpr expr, TypeEnv env, List<TypeCheckException> errors) {
        Optional<Type> type = inferUnannotated(expr, env, errors);
        type.ifPresent(t -> annotations.put(expr, t));
        return type;
    }

    private Optional<Type> inferUnannotated(DataExpr expr, TypeEnv env, List<TypeCheckException> errors) {
        if (expr instanceof DataExpr.IntegerLiteral) {
            return Optional.of(Type.INTEGER);
        } else if (expr instanceof DataExpr.FloatLiteral) {
            return Optional.of(Type.FLOAT);
        } else if (expr instanceof DataExpr.RationalLiteral) {
            return Optional.of(Type.RATIONAL);
        } else if (expr instanceof DataExpr.ComplexLiteral) {
            return Optional.of(Type.COMPLEX);
        } else if (expr instanceof DataExpr.SymbolicLiteral) {
            return Optional.of(Type.SYMBOLIC);
        } else if (expr instanceof DataExpr.VariableRef v) {
            Optional<Type> bound = env.lookup(v.name());
            if (bound.isEmpty() && !env.isUnknown(v.name())) {
                errors.add(TypeCheckException.unboundVariable(v.name()));
            }
            return bound;
        } else if (expr instanceof DataExpr.Addition a) {
            Optional<Type> left = inferExpr(a.left(), env, errors);
            Optional<Type> right = inferExpr(a.right(), env, errors);
            if (left.isEmpty() || right.isEmpty()) {
                return Optional.empty();
            }
            Optional<Type> joined = Type.join(left.get(), right.get());
            if (joined.isEmpty() || joined.get() == Type.UNIT) {
                errors.add(TypeCheckException.mismatch(
                        "operand compatible with " + left.get(), right.get().name()));
                return Optional.empty();
            }
            return joined;
        } else if (expr instanceof DataExpr.Negation n) {
            Optional<Type> operand = inferExpr(n.operand(), env, errors);
            if (operand.isPresent() && !operand.get().isNumeric()) {
                errors.add(TypeCheckException.mismatch("signed numeric type", operand.get().name()));
                return Optional.empty();
            }
            return operand;
        } else if (expr instanceof DataExpr.PureCall c) {
            return inferCall(c.name(), c.args(), env, errors);
        }
        throw new IllegalStateException("Unhandled expression: " + expr.getClass().getSimpleName());
    }

    private Optional<Type> inferCall(
            String name, List<DataExpr> args, TypeEnv env, List<TypeCheckException> errors) {
        List<Optional<Type>> argTypes = new ArrayList<>(args.size());
        for (DataExpr arg : args) {
            argTypes.add(inferExpr(arg, env, errors));
        }

        Optional<Intrinsic> intrinsic = Intrinsic.byName(name);
        if (intrinsic.isPresent()) {
            if (args.size() != 1) {
                errors.add(TypeCheckException.arity(name, 1, args.size()));
                return Optional.empty();
            }
            Optional<Type> arg = argTypes.get(0);
            if (arg.isPresent()
                    && !arg.get().kind().map(intrinsic.get()::accepts).orElse(false)) {
                errors.add(TypeCheckException.mismatch("INTEGER, FLOAT or RATIONAL", arg.get().name(), name));
            }
            return Optional.of(Type.of(intrinsic.get().result()));
        }

        FunctionSignature signature = signatures.get(name);
        if (signature == null) {
            errors.add(TypeCheckException.unboundFunction(name));
            return Optional.empty();
        }
        if (signature.arity() != args.size()) {
            errors.add(TypeCheckException.arity(name, signature.arity(), args.size()));
            return Optional.of(signature.returnType());
        }
        for (int i = 0; i < args.size(); i++) {
            Optional<Type> arg = argTypes.get(i);
            Type expected = signature.params().get(i);
            if (arg.isPresent() && !arg.get().coercesTo(expected)) {
                errors.add(TypeCheckException.mismatch(expected.name(), arg.get().name(), name));
            }
        }
        return Optional.of(signature.returnType());
    }
}
