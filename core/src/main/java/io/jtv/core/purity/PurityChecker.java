package io.jtv.core.purity;

import io.jtv.core.ast.AstAnalysis;
import io.jtv.core.ast.ControlStmt;
import io.jtv.core.ast.DataExpr;
import io.jtv.core.ast.Program;
import io.jtv.core.ast.Purity;
import io.jtv.core.error.PurityException;
import io.jtv.core.number.Intrinsic;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers the purity level of every function and checks it against the declared annotation.
 *
 * <p>Levels are computed as a least fixed point over the call graph: every function starts at
 * {@link Purity#TOTAL} and is relaxed to the join of its local level and its callees' current
 * levels until nothing changes. Mutual recursion and forward references therefore resolve to the
 * smallest consistent level. The chain has height three, so the iteration terminates after at most
 * {@code 2 × functions + 1} rounds.
 */
public final class PurityChecker {

    private static final Logger LOG = LoggerFactory.getLogger(PurityChecker.class);

    /** What a function body does by itself, ignoring callees. */
    private record LocalEffects(boolean loops, boolean prints, Set<String> callees) {

        Purity level() {
            if (prints) {
                return Purity.IMPURE;
            }
            return loops ? Purity.PURE : Purity.TOTAL;
        }
    }

    /** Checks every function declaration and every Data-context call of {@code program}. */
    public PurityReport check(Program program) {
        Map<String, ControlStmt.FunctionDecl> functions = new LinkedHashMap<>();
        for (ControlStmt.FunctionDecl decl : program.functions()) {
            functions.putIfAbsent(decl.name(), decl);
        }

        Map<String, LocalEffects> effects = new LinkedHashMap<>();
        functions.forEach((name, decl) -> effects.put(name, localEffects(decl.body())));
        Map<String, Purity> levels = solve(effects);

        List<PurityException> errors = new ArrayList<>();
        for (ControlStmt.FunctionDecl decl : functions.values()) {
            checkAnnotation(decl, effects.get(decl.name()), levels.get(decl.name()), errors);
        }
        checkDataContextCalls(program, functions, levels, errors);

        LOG.debug("Purity check complete: program={}, levels={}, errors={}", program.id(), levels, errors.size());
        return new PurityReport(levels, errors);
    }

    /**
     * Checks one declaration in isolation, treating its callees as having the given levels.
     *
     * @throws PurityException if the body needs more than the declared level
     */
    public Purity checkPurity(ControlStmt.FunctionDecl decl, Map<String, Purity> calleeLevels) {
        LocalEffects local = localEffects(decl.body());
        Purity level = local.level();
        for (String callee : local.callees()) {
            Purity calleeLevel = calleeLevels.get(callee);
            if (calleeLevel != null) {
                level = level.join(calleeLevel);
            }
        }
        List<PurityException> errors = new ArrayList<>();
        checkAnnotation(decl, local, level, errors);
        if (!errors.isEmpty()) {
            throw errors.get(0);
        }
        return level;
    }

    // ── Fixed point ──

    private static Map<String, Purity> solve(Map<String, LocalEffects> effects) {
        Map<String, Purity> levels = new LinkedHashMap<>();
        effects.keySet().forEach(name -> levels.put(name, Purity.TOTAL));
        boolean changed = true;
        int rounds = 0;
        while (changed) {
            changed = false;
            rounds++;
            for (Map.Entry<String, LocalEffects> entry : effects.entrySet()) {
                Purity next = entry.getValue().level();
                for (String callee : entry.getValue().callees()) {
                    Purity calleeLevel = levels.get(callee);
                    if (calleeLevel != null) {
                        next = next.join(calleeLevel);
                    }
                }
                if (next != levels.get(entry.getKey())) {
                    levels.put(entry.getKey(), next);
                    changed = true;
                }
            }
        }
        LOG.trace("Purity fixed point reached after {} round(s)", rounds);
        return levels;
    }

    private static LocalEffects localEffects(ControlStmt body) {
        boolean[] loops = {false};
        boolean[] prints = {false};
        Set<String> callees = new LinkedHashSet<>();
        AstAnalysis.forEachStatement(body, false, stmt -> {
            if (stmt instanceof ControlStmt.While || stmt instanceof ControlStmt.ForRange) {
                loops[0] = true;
            } else if (stmt instanceof ControlStmt.Print) {
                prints[0] = true;
            } else if (stmt instanceof ControlStmt.CallStmt c) {
                addCallee(c.name(), callees);
            }
            for (DataExpr expr : AstAnalysis.ownExpressions(stmt)) {
                AstAnalysis.pureCalls(expr).forEach(call -> addCallee(call.name(), callees));
            }
        });
        return new LocalEffects(loops[0], prints[0], callees);
    }

    private static void addCallee(String name, Set<String> callees) {
        // intrinsics are total and never escalate the caller
        if (Intrinsic.byName(name).isEmpty()) {
            callees.add(name);
        }
    }

    // ── Violations ──

    private static void checkAnnotation(
            ControlStmt.FunctionDecl decl, LocalEffects local, Purity computed, List<PurityException> errors) {
        Purity declared = decl.purity();
        if (declared == Purity.TOTAL && local.loops()) {
            errors.add(PurityException.loopInTotal(decl.name()));
        } else if (declared != Purity.IMPURE && local.prints()) {
            errors.add(PurityException.ioInPure(decl.name(), declared));
        } else if (!computed.satisfies(declared)) {
            errors.add(PurityException.annotationTooOptimistic(decl.name(), computed, declared));
        }
    }

    private static void checkDataContextCalls(
            Program program,
            Map<String, ControlStmt.FunctionDecl> functions,
            Map<String, Purity> levels,
            List<PurityException> errors) {
        Set<String> reported = new LinkedHashSet<>();
        for (DataExpr expr : AstAnalysis.allExpressions(program.body())) {
            for (DataExpr.PureCall call : AstAnalysis.pureCalls(expr)) {
                ControlStmt.FunctionDecl callee = functions.get(call.name());
                if (callee == null) {
                    continue;
                }
                // an impure annotation is honoured even when the body would allow less
                Purity effective = callee.purity().join(levels.get(call.name()));
                if (effective == Purity.IMPURE && reported.add(call.name())) {
                    errors.add(PurityException.impureCallInDataContext(call.name()));
                }
            }
        }
    }
}
