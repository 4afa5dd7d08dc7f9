package com.picotree.infra.benchmark;

import com.picotree.core.LongEntry;
import com.picotree.core.RedBlackChecker;
import com.picotree.core.RedBlackTree;
import com.picotree.infra.logging.ChronicleLogger;
import com.picotree.infra.logging.ConsoleLogger;
import com.picotree.infra.logging.Logger;

import java.util.Random;

/**
 * Insertion Benchmark.
 * <p>
 * Usage: {@code TreeBenchmark [count] [-ascending|-random]}
 * </p>
 * <p>
 * Events go to the console, or to a Chronicle Queue when
 * {@code -Dpicotree.log.dir=<dir>} is set.
 * </p>
 */
public class TreeBenchmark {

    public static final String LOG_DIR_PROPERTY = "picotree.log.dir";

    static final int DEFAULT_COUNT = 1_000_000;
    private static final long SEED = 42L;

    public static final class Result {
        public final int count;
        public final long elapsedNanos;
        public final int height;
        public final boolean valid;

        Result(int count, long elapsedNanos, int height, boolean valid) {
            this.count = count;
            this.elapsedNanos = elapsedNanos;
            this.height = height;
            this.valid = valid;
        }

        public long nanosPerInsert() {
            return count == 0 ? 0 : elapsedNanos / count;
        }
    }

    public static void main(String[] args) {
        int count = parseCount(args);
        boolean ascending = args.length > 1 && "-ascending".equals(args[1]);

        String logDir = System.getProperty(LOG_DIR_PROPERTY);
        if (logDir != null) {
            try (ChronicleLogger logger = new ChronicleLogger(logDir)) {
                run(count, ascending, SEED, logger);
                System.out.println("Events written to: " + logger.path());
            }
        } else {
            run(count, ascending, SEED, new ConsoleLogger("bench"));
        }
    }

    /**
     * @return The count from the first argument, or the default when it is
     *         missing, not a number, or negative.
     */
    static int parseCount(String[] args) {
        if (args.length == 0) {
            return DEFAULT_COUNT;
        }
        try {
            int count = Integer.parseInt(args[0]);
            if (count >= 0) {
                return count;
            }
        } catch (NumberFormatException e) {
            // fall through to the default
        }
        System.err.println("Invalid count '" + args[0] + "', defaulting to " + DEFAULT_COUNT);
        return DEFAULT_COUNT;
    }

    /**
     * Inserts {@code count} entries into an unchecked tree, then validates it once.
     */
    public static Result run(int count, boolean ascending, long seed, Logger logger) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        logger.log(ascending ? "ascending inserts" : "random inserts", count);

        // Pre-allocate outside the timed loop.
        LongEntry[] entries = new LongEntry[count];
        Random random = new Random(seed);
        for (int i = 0; i < count; i++) {
            entries[i] = new LongEntry();
            entries[i].key = ascending ? i : random.nextLong();
            entries[i].value = i;
        }

        RedBlackTree<LongEntry> tree = new RedBlackTree<>((a, b) -> Long.compare(a.key, b.key), false);

        long start = System.nanoTime();
        for (int i = 0; i < count; i++) {
            tree.insert(entries[i]);
        }
        long elapsed = System.nanoTime() - start;

        Result result = new Result(count, elapsed, tree.height(), RedBlackChecker.isValid(tree));

        logger.log("ns per insert", result.nanosPerInsert());
        logger.log("height", result.height);
        logger.log(result.valid ? "tree valid" : "tree INVALID");
        return result;
    }
}
