package com.orderbook.publishing;

import com.orderbook.outcome.OutcomeRecord;

/**
 * Renders one outcome record as a single line, without the line terminator.
 */
public interface OutcomeFormatter {
    String format(OutcomeRecord record);
}
