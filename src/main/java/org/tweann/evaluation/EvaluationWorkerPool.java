package org.tweann.evaluation;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * Fixed set of evaluation threads that split one batch at a time into contiguous chunks.
 * <p>
 * With parallelism P the pool owns P-1 parked daemon threads; the thread calling
 * {@link #dispatch(int, ChunkTask)} evaluates chunk 0 itself and then parks until the others report
 * back. A batch is published by bumping a volatile round counter, which also tells a worker a real
 * wakeup from a spurious one.
 * <p>
 * {@code dispatch} is single-caller. {@link #shutdown()} may be called from any thread, any number of
 * times.
 */
public class EvaluationWorkerPool {

    /**
     * Work over the half-open index range {@code [fromInclusive, toExclusive)}.
     */
    @FunctionalInterface
    public interface ChunkTask {
        void run(int fromInclusive, int toExclusive);
    }

    private final Thread[] helpers;
    private final int parallelism;

    private volatile int round;
    private volatile int batchSize;
    private volatile ChunkTask batchTask;
    private volatile Thread caller;
    private volatile boolean stopped;
    private final AtomicInteger finishedHelpers = new AtomicInteger();
    private final AtomicInteger startedHelpers = new AtomicInteger();
    private final AtomicReference<Throwable> helperFailure = new AtomicReference<>();

    /**
     * @param parallelism Threads working on a batch, the dispatching thread included; at least 1.
     * @throws IllegalArgumentException if parallelism &lt; 1
     */
    public EvaluationWorkerPool(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be >= 1, got " + parallelism);
        }
        this.parallelism = parallelism;
        this.helpers = new Thread[parallelism - 1];
        for (int i = 0; i < helpers.length; i++) {
            int chunk = i + 1;
            Thread helper = new Thread(() -> helperLoop(chunk), "evaluation-worker-" + chunk);
            helper.setDaemon(true);
            helpers[i] = helper;
            helper.start();
        }
        // A helper that has not read the initial round yet would miss the first batch.
        while (startedHelpers.get() < helpers.length) {
            Thread.onSpinWait();
        }
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * Runs {@code task} over {@code [0, size)} and returns once every chunk is done.
     * <p>
     * A failure in any chunk is rethrown after all chunks have finished; a helper's failure wins over
     * the caller's, which is attached as suppressed. An interrupt that arrives while the caller waits
     * for the helpers does not cut the wait short; it is restored before returning.
     *
     * @throws IllegalStateException if the pool has been shut down
     */
    public void dispatch(int size, ChunkTask task) {
        if (stopped) {
            throw new IllegalStateException("Evaluation worker pool has been shut down");
        }
        if (size <= 0) {
            return;
        }

        batchSize = size;
        batchTask = task;
        caller = Thread.currentThread();
        helperFailure.set(null);
        finishedHelpers.set(0);
        round++;
        for (Thread helper : helpers) {
            LockSupport.unpark(helper);
        }

        Throwable callerFailure = null;
        try {
            runChunk(0, size, task);
        } catch (Throwable t) {
            callerFailure = t;
        }

        boolean interrupted = false;
        while (finishedHelpers.get() < helpers.length) {
            LockSupport.park(this);
            // park returns at once while the flag is set
            if (Thread.interrupted()) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        Throwable failure = helperFailure.get();
        if (failure != null && callerFailure != null) {
            failure.addSuppressed(callerFailure);
        } else if (failure == null) {
            failure = callerFailure;
        }
        if (failure instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (failure instanceof Error error) {
            throw error;
        }
        if (failure != null) {
            throw new RuntimeException("Evaluation chunk failed", failure);
        }
    }

    /**
     * Stops the helpers and waits up to five seconds for each to exit.
     */
    public void shutdown() {
        stopped = true;
        for (Thread helper : helpers) {
            LockSupport.unpark(helper);
        }
        for (Thread helper : helpers) {
            try {
                helper.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void runChunk(int chunk, int size, ChunkTask task) {
        int chunkLength = (size + parallelism - 1) / parallelism;
        int from = chunk * chunkLength;
        if (from < size) {
            task.run(from, Math.min(from + chunkLength, size));
        }
    }

    private void helperLoop(int chunk) {
        int seenRound = round;
        startedHelpers.incrementAndGet();

        while (true) {
            LockSupport.park(this);
            if (stopped) {
                return;
            }
            int current = round;
            if (current == seenRound) {
                continue;
            }
            seenRound = current;

            try {
                runChunk(chunk, batchSize, batchTask);
            } catch (Throwable t) {
                helperFailure.compareAndSet(null, t);
            }
            finishedHelpers.incrementAndGet();
            LockSupport.unpark(caller);
        }
    }
}
