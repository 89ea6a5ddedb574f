package com.questrail.socket.transport.netty;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InboundQueueTest {

    private final AtomicInteger demands = new AtomicInteger();
    private final InboundQueue queue = new InboundQueue(demands::incrementAndGet);

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void chunkIsServedAcrossSmallReads() throws Exception {
        queue.offer(bytes("abcdef"));
        byte[] dst = new byte[4];

        assertEquals(4, queue.read(dst, 0, 4, null));
        assertEquals("abcd", new String(dst, StandardCharsets.UTF_8));
        assertEquals(2, queue.read(dst, 0, 4, null));
        assertEquals("ef", new String(dst, 0, 2, StandardCharsets.UTF_8));
        assertEquals(0, demands.get(), "buffered data needs no demand");
    }

    @Test
    void emptyQueueDemandsThenTimesOut() {
        assertThrows(SocketTimeoutException.class, () -> queue.read(new byte[4], 0, 4, Duration.ofMillis(50)));

        assertEquals(1, demands.get());
    }

    @Test
    void endIsSticky() throws Exception {
        queue.offer(bytes("x"));
        queue.end();
        queue.end();

        assertEquals(1, queue.read(new byte[4], 0, 4, null));
        assertEquals(-1, queue.read(new byte[4], 0, 4, null));
        assertEquals(-1, queue.read(new byte[4], 0, 4, null));
        assertTrue(queue.isEnded());
    }

    @Test
    void failureIsDeliveredOnceAsIOException() throws Exception {
        queue.fail(new IllegalStateException("decoder broke"));
        queue.end();

        IOException e = assertThrows(IOException.class, () -> queue.read(new byte[4], 0, 4, null));
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(-1, queue.read(new byte[4], 0, 4, null));
    }

    @Test
    void zeroLengthReadReturnsImmediately() throws Exception {
        assertEquals(0, queue.read(new byte[4], 0, 0, Duration.ofMillis(1)));
        assertEquals(0, demands.get());
    }

    @Test
    void emptyChunksAreDropped() throws Exception {
        queue.offer(new byte[0]);
        queue.end();

        assertEquals(-1, queue.read(new byte[4], 0, 4, null));
    }
}
