package io.jtv.core.reversible;

import io.jtv.core.ast.AstAnalysis;
import io.jtv.core.ast.ControlStmt;
import io.jtv.core.ast.ReversibleOp;
import io.jtv.core.error.ReversibilityException;
import java.util.ArrayList;
import java.util.List;

/**
 * Static precondition of reverse blocks: the target of {@code x += e} or {@code x -= e} must not
 * occur free in {@code e}, otherwise the captured amount would not determine the inverse.
 */
public final class ReversibilityChecker {

    private ReversibilityChecker() {
        // utility class
    }

    /** Every violation in every reverse block under {@code root}, function bodies included. */
    public static List<ReversibilityException> check(ControlStmt root) {
        List<ReversibilityException> errors = new ArrayList<>();
        for (ControlStmt.ReverseBlock block : AstAnalysis.reverseBlocks(root)) {
            collect(block, errors);
        }
        return errors;
    }

    /**
     * @throws ReversibilityException for the first offending operation of {@code block}
     */
    public static void requireReversible(ControlStmt.ReverseBlock block) {
        List<ReversibilityException> errors = new ArrayList<>();
        collect(block, errors);
        if (!errors.isEmpty()) {
            throw errors.get(0);
        }
    }

    private static void collect(ControlStmt.ReverseBlock block, List<ReversibilityException> errors) {
        for (ReversibleOp op : block.ops()) {
            if (AstAnalysis.occursFree(op.target(), op.value())) {
                errors.add(new ReversibilityException(op.target()));
            }
        }
    }
}
