package com.orderbook.publishing;

import com.orderbook.outcome.OutcomeRecord;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes outcome records, one per line, in the order they are given.
 *
 * Output is buffered by the underlying writer; {@link #flush()} is called by the consumer
 * at the end of each batch so records are not held back while input is idle. The writer
 * is never closed here; it belongs to the caller.
 */
public class OutcomePublisher {

    private final Writer writer;
    private final OutcomeFormatter formatter;
    private long recordsWritten;

    public OutcomePublisher(Writer writer, OutcomeFormatter formatter) {
        this.writer = writer;
        this.formatter = formatter;
    }

    public void publish(List<OutcomeRecord> records) throws IOException {
        for (OutcomeRecord record : records) {
            writer.write(formatter.format(record));
            writer.write('\n');
            recordsWritten++;
        }
    }

    public void flush() throws IOException {
        writer.flush();
    }

    public long getRecordsWritten() {
        return recordsWritten;
    }
}
