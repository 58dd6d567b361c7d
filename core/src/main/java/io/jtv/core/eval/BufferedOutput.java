package io.jtv.core.eval;

import io.jtv.core.spi.OutputSink;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Collects printed values in memory. Not thread-safe. */
public final class BufferedOutput implements OutputSink {

    private final List<String> lines = new ArrayList<>();

    @Override
    public void emit(String text) {
        lines.add(text);
    }

    /** Printed values so far, in order. */
    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }
}
