package io.jtv.core.engine;

import io.jtv.core.error.ReversibilityException;
import io.jtv.core.error.StaticCheckException;
import io.jtv.core.purity.PurityReport;
import io.jtv.core.types.TypeReport;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Combined outcome of the static checks: types, purity and reversibility. A program runs only when
 * {@link #isAccepted()}.
 */
public final class CheckReport {

    private final String programId;
    private final TypeReport types;
    private final PurityReport purity;
    private final List<ReversibilityException> reversibility;

    CheckReport(String programId, TypeReport types, PurityReport purity, List<ReversibilityException> reversibility) {
        this.programId = Objects.requireNonNull(programId, "programId must not be null");
        this.types = Objects.requireNonNull(types, "types must not be null");
        this.purity = Objects.requireNonNull(purity, "purity must not be null");
        this.reversibility = List.copyOf(reversibility);
    }

    public String programId() {
        return programId;
    }

    public TypeReport types() {
        return types;
    }

    public PurityReport purity() {
        return purity;
    }

    public List<ReversibilityException> reversibility() {
        return reversibility;
    }

    public boolean isAccepted() {
        return types.isSuccess() && purity.isSuccess() && reversibility.isEmpty();
    }

    /** Every static error: type errors first, then purity, then reversibility. */
    public List<StaticCheckException> errors() {
        List<StaticCheckException> all = new ArrayList<>(types.errors());
        all.addAll(purity.errors());
        all.addAll(reversibility);
        return List.copyOf(all);
    }
}
