package com.picotree.infra;

import com.picotree.core.LongKeyIndex;
import com.picotree.core.RedBlackChecker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class IndexServerTest {

    private IndexServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void shouldApplyPutsFromManyProducers() throws InterruptedException {
        final int producers = 4;
        final int perProducer = 2_000;
        RecordingLogger logger = new RecordingLogger();
        server = new IndexServer(new LongKeyIndex(producers * perProducer), 1024, logger);

        CountDownLatch start = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int p = 0; p < producers; p++) {
            final long base = (long) p * perProducer;
            Thread t = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                for (int i = 0; i < perProducer; i++) {
                    server.submit(base + i, base + i);
                }
            });
            threads.add(t);
            t.start();
        }
        start.countDown();
        for (Thread t : threads) {
            t.join();
        }

        assertTrue(server.awaitApplied(producers * perProducer, 10, TimeUnit.SECONDS), "Consumer fell behind");

        LongKeyIndex index = server.getIndex();
        assertEquals(producers * perProducer, index.size());
        assertEquals(0, index.first().key);
        assertEquals(producers * perProducer - 1, index.last().key);
        assertTrue(RedBlackChecker.isValid(index.tree()));
        assertEquals(0, server.rejected());
        assertTrue(logger.contains("Index server started, ring size=1024"));
    }

    @Test
    void shouldRejectPutsOnceThePoolIsFull() {
        RecordingLogger logger = new RecordingLogger();
        server = new IndexServer(new LongKeyIndex(2), 64, logger);

        server.submit(1, 10);
        server.submit(2, 20);
        server.submit(3, 30);
        server.submit(1, 11);

        assertTrue(server.awaitApplied(4, 5, TimeUnit.SECONDS));
        assertEquals(1, server.rejected());
        assertEquals(4, server.applied());
        assertEquals(11, server.getIndex().valueOr(1, -1));
        assertFalse(server.getIndex().containsKey(3));
        assertTrue(logger.contains("put rejected=3"));
    }

    @Test
    void shouldTimeOutWhenNothingArrives() {
        server = new IndexServer(new LongKeyIndex(1), 64, new RecordingLogger());

        assertFalse(server.awaitApplied(1, 50, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldRejectRingSizeThatIsNotAPowerOfTwo() {
        assertThrows(IllegalArgumentException.class,
                () -> new IndexServer(new LongKeyIndex(1), 1000, new RecordingLogger()));
    }
}
