package com.orderbook.domain;

/**
 * Raised when a command cannot be applied because of caller input: bad price or quantity,
 * a reused identifier, or an identifier that is not live. The book is left untouched.
 */
public class OrderRejectedException extends Exception {

    private final OrderId orderId;
    private final RejectReason reason;

    public OrderRejectedException(OrderId orderId, RejectReason reason) {
        super(reason.label() + (orderId != null ? ": " + orderId.value() : ""));
        this.orderId = orderId;
        this.reason = reason;
    }

    /** Identifier the command referred to, or null when it carried none. */
    public OrderId getOrderId() {
        return orderId;
    }

    public RejectReason getReason() {
        return reason;
    }
}
