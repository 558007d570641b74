package com.orderbook.command;

import com.orderbook.domain.OrderId;
import com.orderbook.domain.Price;
import com.orderbook.domain.Side;

/**
 * Parses the comma-separated command format, one command per line:
 *
 * <pre>
 *   N, &lt;id&gt;, &lt;B|S&gt;, &lt;price&gt;, &lt;quantity&gt;
 *   C, &lt;id&gt;
 *   F
 * </pre>
 *
 * Fields are trimmed. Blank lines and lines starting with '#' carry no command.
 * Price and quantity are signed so that non-positive values reach the processor,
 * which rejects them.
 */
public class CommandParser {

    private static final char COMMENT = '#';

    /**
     * @return the command, or null if the line is blank or a comment
     */
    public Command parse(String line, long lineNumber) throws MalformedCommandException {
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.charAt(0) == COMMENT) {
            return null;
        }

        String[] fields = trimmed.split(",", -1);
        for (int i = 0; i < fields.length; i++) {
            fields[i] = fields[i].trim();
        }

        switch (fields[0].toUpperCase()) {
            case "N":
                expectFields(fields, 5, lineNumber);
                return new NewOrder(
                        orderId(fields[1], lineNumber),
                        side(fields[2], lineNumber),
                        new Price(number(fields[3], "price", lineNumber)),
                        number(fields[4], "quantity", lineNumber));
            case "C":
                expectFields(fields, 2, lineNumber);
                return new CancelOrder(orderId(fields[1], lineNumber));
            case "F":
                expectFields(fields, 1, lineNumber);
                return new FlushBook();
            default:
                throw new MalformedCommandException(lineNumber, "unknown command type '" + fields[0] + "'");
        }
    }

    private static void expectFields(String[] fields, int expected, long lineNumber)
            throws MalformedCommandException {
        if (fields.length != expected) {
            throw new MalformedCommandException(lineNumber,
                    "command '" + fields[0] + "' takes " + expected + " fields, got " + fields.length);
        }
    }

    private static OrderId orderId(String field, long lineNumber) throws MalformedCommandException {
        if (field.isEmpty()) {
            throw new MalformedCommandException(lineNumber, "empty order identifier");
        }
        return new OrderId(field);
    }

    private static Side side(String field, long lineNumber) throws MalformedCommandException {
        try {
            return Side.fromCode(field);
        } catch (IllegalArgumentException e) {
            throw new MalformedCommandException(lineNumber, e.getMessage());
        }
    }

    private static long number(String field, String name, long lineNumber) throws MalformedCommandException {
        try {
            return Long.parseLong(field);
        } catch (NumberFormatException e) {
            throw new MalformedCommandException(lineNumber, "invalid " + name + " '" + field + "'");
        }
    }
}
