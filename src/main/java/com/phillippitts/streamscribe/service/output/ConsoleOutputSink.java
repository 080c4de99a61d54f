package com.phillippitts.streamscribe.service.output;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Writes each result message on its own line to standard output.
 * Logs go to standard error, so transcripts can be piped separately.
 */
public class ConsoleOutputSink implements OutputSink {

    private final PrintStream out;

    public ConsoleOutputSink() {
        this(System.out);
    }

    public ConsoleOutputSink(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void accept(String message) {
        out.println(message);
        out.flush();
    }
}
