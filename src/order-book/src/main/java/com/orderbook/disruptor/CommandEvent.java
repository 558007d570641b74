package com.orderbook.disruptor;

import com.orderbook.command.Command;

/**
 * Pre-allocated mutable event object in the Disruptor ring buffer.
 *
 * Fields are public for zero-overhead access on the processing path.
 */
public class CommandEvent {

    public long receivedNanos;     // System.nanoTime() when published to the ring
    public long lineNumber;
    public Command command;

    /**
     * Reset all fields to defaults once the event has been processed.
     */
    public void clear() {
        receivedNanos = 0;
        lineNumber = 0;
        command = null;
    }
}
