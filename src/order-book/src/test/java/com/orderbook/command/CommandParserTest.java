package com.orderbook.command;

import com.orderbook.domain.OrderId;
import com.orderbook.domain.Price;
import com.orderbook.domain.Side;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class CommandParserTest {

    private final CommandParser parser = new CommandParser();

    @Test
    void parsesNewOrderWithWhitespace() throws MalformedCommandException {
        Command command = parser.parse("  N , ord-1,  B, 100 , 10 ", 1);

        assertEquals(new NewOrder(new OrderId("ord-1"), Side.BUY, new Price(100), 10), command);
    }

    @Test
    void parsesLowerCaseTypeAndSide() throws MalformedCommandException {
        assertEquals(new NewOrder(new OrderId("7"), Side.SELL, new Price(99), 6),
                parser.parse("n,7,s,99,6", 1));
    }

    @Test
    void keepsNonPositiveNumbersForTheProcessorToReject() throws MalformedCommandException {
        assertEquals(new NewOrder(new OrderId("x"), Side.BUY, new Price(-1), 0),
                parser.parse("N, x, B, -1, 0", 1));
    }

    @Test
    void parsesCancelAndFlush() throws MalformedCommandException {
        assertEquals(new CancelOrder(new OrderId("42")), parser.parse("C, 42", 1));
        assertEquals(new FlushBook(), parser.parse("F", 1));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "# a comment", "   # indented comment"})
    void blankAndCommentLinesCarryNoCommand(String line) throws MalformedCommandException {
        assertNull(parser.parse(line, 1));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "X, 1",
            "N, 1, B, 100",
            "N, 1, B, 100, 10, extra",
            "N, 1, Q, 100, 10",
            "N, , B, 100, 10",
            "N, 1, B, 1.5, 10",
            "N, 1, B, 100, ten",
            "C",
            "C, ",
            "F, 1"
    })
    void rejectsMalformedLines(String line) {
        MalformedCommandException e = assertThrows(MalformedCommandException.class,
                () -> parser.parse(line, 12));
        assertEquals(12, e.getLineNumber());
        assertTrue(e.getMessage().startsWith("line 12"), e.getMessage());
    }
}
