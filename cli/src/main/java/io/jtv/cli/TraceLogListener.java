package io.jtv.cli;

import io.jtv.core.reversible.TraceEntry;
import io.jtv.core.spi.ExecutionListener;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs the trace of every executed reverse block ({@code --trace}). */
final class TraceLogListener implements ExecutionListener {

    private static final Logger LOG = LoggerFactory.getLogger(TraceLogListener.class);

    @Override
    public void onReverseBlockExecuted(ReverseBlockExecutedEvent event) {
        LOG.info(
                "Reverse block: program_id={}, updates=[{}]",
                event.programId(),
                event.trace().entries().stream().map(TraceEntry::toString).collect(Collectors.joining(", ")));
    }

    @Override
    public void onExecutionFailed(ExecutionFailedEvent event) {
        LOG.info("Run aborted: program_id={}, urn={}, duration_ms={}", event.programId(), event.errorUrn(), event.durationMs());
    }
}
