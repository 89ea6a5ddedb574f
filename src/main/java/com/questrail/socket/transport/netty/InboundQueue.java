package com.questrail.socket.transport.netty;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * InboundQueue
 * -----------------------------------------------------------------------------
 * Bridge between a Netty channel (producer, on the event loop) and one blocking
 * reader thread.
 *
 * <p>The channel runs with auto-read disabled. When the reader finds the queue
 * empty it runs {@code demand}, which asks the channel for one more read, and
 * then blocks. Inbound data therefore never outruns the reader by more than
 * one read cycle.</p>
 *
 * <p>Items are {@code byte[]} chunks, a {@link Throwable} (delivered once to the
 * reader) or the end marker, which stays at the head once reached so every
 * later read also sees end of stream.</p>
 */
final class InboundQueue
{
    private static final Object END = new Object();

    private final BlockingQueue<Object> items = new LinkedBlockingQueue<>();
    private final Runnable demand;

    // reader-thread state
    private byte[] current;
    private int position;

    private volatile boolean ended;

    InboundQueue(Runnable demand) {
        this.demand = demand;
    }

    void offer(byte[] chunk) {
        if (chunk.length > 0) {
            items.add(chunk);
        }
    }

    void fail(Throwable cause) {
        items.add(cause);
    }

    void end() {
        if (!ended) {
            ended = true;
            items.add(END);
        }
    }

    boolean isEnded() {
        return ended;
    }

    /**
     * @return bytes copied, or {@code -1} at end of stream
     */
    int read(byte[] dst, int offset, int length, Duration timeout) throws IOException {
        if (length == 0) {
            return 0;
        }

        if (current == null) {
            Object item = items.poll();
            if (item == null) {
                demand.run();
                item = take(timeout);
            }

            if (item == END) {
                items.add(END);
                return -1;
            }
            if (item instanceof Throwable) {
                throw NettyTransports.toIOException((Throwable) item);
            }

            current = (byte[]) item;
            position = 0;
        }

        int n = Math.min(length, current.length - position);
        System.arraycopy(current, position, dst, offset, n);
        position += n;
        if (position >= current.length) {
            current = null;
        }
        return n;
    }

    private Object take(Duration timeout) throws IOException {
        try {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                return items.take();
            }
            Object item = items.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
            if (item == null) {
                throw new SocketTimeoutException("read timed out after " + timeout.toMillis() + " ms");
            }
            return item;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for data");
        }
    }
}
