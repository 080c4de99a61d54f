package com.phillippitts.streamscribe.service.output;

/**
 * Destination for result messages, one at a time in receipt order.
 * Implementations are expected to be fast; the receiver applies no backpressure.
 */
@FunctionalInterface
public interface OutputSink {

    void accept(String message);
}
