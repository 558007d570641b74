package com.orderbook.disruptor;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for pre-allocating CommandEvent instances in the ring buffer.
 */
public class CommandEventFactory implements EventFactory<CommandEvent> {

    @Override
    public CommandEvent newInstance() {
        return new CommandEvent();
    }
}
