package com.orderbook.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.orderbook.command.Command;
import com.orderbook.command.CommandReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static net.logstash.logback.argument.StructuredArguments.keyValue;

/**
 * Hands parsed commands from the reading thread to the single processing thread through
 * a Disruptor ring buffer. Commands are processed strictly in the order they are published.
 *
 * Single producer: only the thread that reads input may call {@link #onCommand}.
 */
public class CommandPipeline implements CommandReader.Listener {

    private static final Logger logger = LoggerFactory.getLogger(CommandPipeline.class);

    private final Disruptor<CommandEvent> disruptor;
    private final CommandEventHandler handler;
    private RingBuffer<CommandEvent> ringBuffer;
    private long published;

    public CommandPipeline(CommandEventHandler handler, int ringBufferSize) {
        this.handler = handler;
        this.disruptor = new Disruptor<>(
                new CommandEventFactory(),
                ringBufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(handler);
    }

    /**
     * Start the processing thread and return once it is running.
     */
    public void start() {
        ringBuffer = disruptor.start();
        try {
            handler.awaitStarted();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            disruptor.halt();
            throw new IllegalStateException("Interrupted while starting the command pipeline", e);
        }
        logger.info("Command pipeline started",
                keyValue("event", "PIPELINE_STARTED"),
                keyValue("ringBufferSize", ringBuffer.getBufferSize()));
    }

    /**
     * Publish one command. Blocks while the ring buffer is full.
     *
     * @return false once the processing thread has halted, telling the reader to stop
     */
    @Override
    public boolean onCommand(Command command, long lineNumber) {
        if (handler.isHalted()) {
            return false;
        }
        ringBuffer.publishEvent(CommandEventTranslator.INSTANCE, command, lineNumber);
        published++;
        return true;
    }

    /**
     * Wait until every published command has been processed, then stop the processing thread.
     */
    public void shutdown() {
        disruptor.shutdown();
        logger.info("Command pipeline stopped",
                keyValue("event", "PIPELINE_STOPPED"),
                keyValue("published", published),
                keyValue("halted", handler.isHalted()));
    }

    public long getPublished() {
        return published;
    }
}
