package com.picotree.infra.benchmark;

import com.picotree.infra.RecordingLogger;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TreeBenchmarkTest {

    @Test
    void ascendingRunProducesValidBalancedTree() {
        RecordingLogger logger = new RecordingLogger();
        TreeBenchmark.Result result = TreeBenchmark.run(1024, true, 1L, logger);

        assertEquals(1024, result.count);
        assertTrue(result.valid);
        assertTrue(result.height <= 20, "Height " + result.height);
        assertTrue(logger.contains("ascending inserts=1024"));
        assertTrue(logger.contains("tree valid"));
    }

    @Test
    void randomRunProducesValidTree() {
        RecordingLogger logger = new RecordingLogger();
        TreeBenchmark.Result result = TreeBenchmark.run(10_000, false, 7L, logger);

        assertTrue(result.valid);
        assertTrue(result.height <= 2 * Math.log(10_001) / Math.log(2));
        assertTrue(logger.contains("random inserts=10000"));
    }

    @Test
    void emptyRunIsValid() {
        TreeBenchmark.Result result = TreeBenchmark.run(0, false, 1L, new RecordingLogger());

        assertTrue(result.valid);
        assertEquals(0, result.height);
        assertEquals(0, result.nanosPerInsert());
    }

    @Test
    void negativeCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TreeBenchmark.run(-1, true, 1L, new RecordingLogger()));
    }

    @Test
    void countArgumentFallsBackToDefaultWhenInvalid() {
        assertEquals(TreeBenchmark.DEFAULT_COUNT, TreeBenchmark.parseCount(new String[0]));
        assertEquals(TreeBenchmark.DEFAULT_COUNT, TreeBenchmark.parseCount(new String[] { "abc" }));
        assertEquals(TreeBenchmark.DEFAULT_COUNT, TreeBenchmark.parseCount(new String[] { "-5", "-ascending" }));
        assertEquals(0, TreeBenchmark.parseCount(new String[] { "0" }));
        assertEquals(500, TreeBenchmark.parseCount(new String[] { "500", "-random" }));
    }
}
