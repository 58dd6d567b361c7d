package io.jtv.core.purity;

import io.jtv.core.ast.Purity;
import io.jtv.core.error.PurityException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computed purity levels for every declared function, plus the violations found against their
 * annotations and in Data-context calls. Immutable.
 */
public final class PurityReport {

    private final Map<String, Purity> levels;
    private final List<PurityException> errors;

    PurityReport(Map<String, Purity> levels, List<PurityException> errors) {
        this.levels = Collections.unmodifiableMap(new LinkedHashMap<>(levels));
        this.errors = List.copyOf(errors);
    }

    public boolean isSuccess() {
        return errors.isEmpty();
    }

    public List<PurityException> errors() {
        return errors;
    }

    /** The least level each function's body needs, by function name. */
    public Map<String, Purity> levels() {
        return levels;
    }

    public Optional<Purity> levelOf(String function) {
        return Optional.ofNullable(levels.get(function));
    }
}
