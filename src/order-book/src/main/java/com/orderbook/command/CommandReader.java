package com.orderbook.command;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;

/**
 * Reads commands line by line and hands each one, in input order, to a {@link Listener}.
 *
 * Malformed lines are logged and skipped, or abort the read in strict mode.
 */
public class CommandReader {

    private static final Logger logger = LoggerFactory.getLogger(CommandReader.class);

    /** Receives parsed commands. Returning false stops the read. */
    public interface Listener {
        boolean onCommand(Command command, long lineNumber);
    }

    private final CommandParser parser;
    private final boolean strict;
    private long malformedLines;

    public CommandReader(CommandParser parser, boolean strict) {
        this.parser = parser;
        this.strict = strict;
    }

    /**
     * Read until end of input or until the listener asks to stop.
     *
     * @return number of commands delivered
     * @throws IOException if the source cannot be read
     * @throws MalformedCommandException in strict mode, for the first malformed line
     */
    public long readAll(BufferedReader reader, Listener listener) throws IOException, MalformedCommandException {
        long lineNumber = 0;
        long delivered = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            Command command;
            try {
                command = parser.parse(line, lineNumber);
            } catch (MalformedCommandException e) {
                if (strict) {
                    throw e;
                }
                malformedLines++;
                logger.warn("Skipping malformed command: {}", e.getMessage());
                continue;
            }
            if (command == null) {
                continue;
            }
            delivered++;
            if (!listener.onCommand(command, lineNumber)) {
                logger.warn("Reading stopped by consumer at line {}", lineNumber);
                break;
            }
        }
        return delivered;
    }

    public long getMalformedLines() {
        return malformedLines;
    }
}
