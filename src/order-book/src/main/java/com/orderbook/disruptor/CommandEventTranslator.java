package com.orderbook.disruptor;

import com.lmax.disruptor.EventTranslatorTwoArg;
import com.orderbook.command.Command;

/**
 * Copies a parsed command and its input line number into a claimed ring buffer slot.
 */
public final class CommandEventTranslator implements EventTranslatorTwoArg<CommandEvent, Command, Long> {

    public static final CommandEventTranslator INSTANCE = new CommandEventTranslator();

    private CommandEventTranslator() {
    }

    @Override
    public void translateTo(CommandEvent event, long sequence, Command command, Long lineNumber) {
        event.receivedNanos = System.nanoTime();
        event.lineNumber = lineNumber;
        event.command = command;
    }
}
