package com.orderbook.command;

/** Discard every resting order. */
public record FlushBook() implements Command {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitFlushBook(this);
    }
}
