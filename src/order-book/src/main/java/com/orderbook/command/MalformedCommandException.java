package com.orderbook.command;

/**
 * Input line that cannot be turned into a {@link Command}. Raised by the parser only;
 * the order book never sees malformed input.
 */
public class MalformedCommandException extends Exception {

    private final long lineNumber;

    public MalformedCommandException(long lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public long getLineNumber() {
        return lineNumber;
    }
}
