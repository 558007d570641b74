package com.orderbook.command;

/**
 * One instruction to the order book. The set of commands is closed: every consumer
 * implements {@link Visitor}, so adding a command kind fails compilation until each
 * consumer handles it.
 */
public interface Command {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitNewOrder(NewOrder command);

        R visitCancelOrder(CancelOrder command);

        R visitFlushBook(FlushBook command);
    }
}
