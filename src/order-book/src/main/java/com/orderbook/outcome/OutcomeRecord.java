package com.orderbook.outcome;

/**
 * Result emitted by the book for a command. A single command yields zero or more records,
 * in the order they must be written.
 */
public interface OutcomeRecord {

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitAck(Ack ack);

        R visitTrade(Trade trade);

        R visitCancelled(Cancelled cancelled);

        R visitFlushed(Flushed flushed);

        R visitRejected(Rejected rejected);

        R visitTopOfBook(TopOfBook topOfBook);
    }
}
