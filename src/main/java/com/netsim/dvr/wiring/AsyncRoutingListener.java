package com.netsim.dvr.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.netsim.dvr.api.ConvergenceResult;
import com.netsim.dvr.api.RoutingListener;
import com.netsim.dvr.api.RoutingTable;
import com.netsim.dvr.util.ErrorRateLimiter;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Moves {@link RoutingListener} callbacks off the controller thread.
 *
 * Every callback is published into an LMAX Disruptor ring buffer and replayed
 * on a single consumer thread against the delegate, in publication order. The
 * controller only pays for claiming a slot, so a slow display (console, web
 * socket) cannot stretch a round.
 *
 * Key Responsibilities:
 * 1. Publishing: one ring buffer slot per callback, single producer (the
 * controller thread).
 * 2. Dispatch: {@link RoutingEventHandler} calls the delegate; exceptions are
 * logged (throttled) and the consumer keeps running.
 * 3. Shutdown: {@link #close()} waits until every published event has been
 * handled, then stops the consumer thread.
 */
public final class AsyncRoutingListener implements RoutingListener, AutoCloseable {
    private static final Logger log = LogManager.getLogger(AsyncRoutingListener.class);

    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final Disruptor<RoutingEvent> disruptor;
    private final RingBuffer<RoutingEvent> ringBuffer;
    private volatile boolean closed;

    public AsyncRoutingListener(RoutingListener delegate) {
        this(delegate, DEFAULT_BUFFER_SIZE);
    }

    /**
     * @param bufferSize ring size, must be a power of two.
     */
    public AsyncRoutingListener(RoutingListener delegate, int bufferSize) {
        this.disruptor = new Disruptor<>(
                RoutingEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.SINGLE,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new RoutingEventHandler(delegate));
        this.ringBuffer = disruptor.start();
    }

    @Override
    public void onInitialTable(String nodeId, RoutingTable table) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setInitialTable(nodeId, table);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void onRoundStart(int round) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setRoundStart(round);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void onTableChanged(int round, String nodeId, RoutingTable table) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setTableChanged(round, nodeId, table);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void onRoundEnd(int round, int changedNodes) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setRoundEnd(round, changedNodes);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void onRunComplete(ConvergenceResult result) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setRunComplete(result);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    private long claim() {
        if (closed) {
            log.debug("Listener closed, event dropped");
            return -1;
        }
        return ringBuffer.next();
    }

    /** Events published but not yet handled. */
    public long backlog() {
        return ringBuffer.getBufferSize() - ringBuffer.remainingCapacity();
    }

    /**
     * Drains the ring buffer and stops the consumer thread. Events published
     * afterwards are dropped.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        disruptor.shutdown();
        log.debug("Async routing listener stopped");
    }

    /**
     * Replays ring buffer events against the delegate.
     */
    static final class RoutingEventHandler implements EventHandler<RoutingEvent> {
        private final RoutingListener delegate;
        private final ErrorRateLimiter errors = new ErrorRateLimiter(log, 1000);

        RoutingEventHandler(RoutingListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onEvent(RoutingEvent event, long sequence, boolean endOfBatch) {
            try {
                switch (event.type()) {
                    case INITIAL_TABLE -> delegate.onInitialTable(event.nodeId(), event.table());
                    case ROUND_START -> delegate.onRoundStart(event.round());
                    case TABLE_CHANGED -> delegate.onTableChanged(event.round(), event.nodeId(), event.table());
                    case ROUND_END -> delegate.onRoundEnd(event.round(), event.changedNodes());
                    case RUN_COMPLETE -> delegate.onRunComplete(event.result());
                }
            } catch (RuntimeException e) {
                errors.log("Routing listener failed on " + event.type() + " event", e);
            } finally {
                event.clear();
            }
        }
    }
}
