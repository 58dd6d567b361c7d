package io.jtv.core.spi;

/**
 * Destination for {@code print} output. Each call receives the textual form of one printed value,
 * in program order.
 */
@FunctionalInterface
public interface OutputSink {

    void emit(String text);
}
