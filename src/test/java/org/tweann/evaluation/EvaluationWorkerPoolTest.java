package org.tweann.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicIntegerArray;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class EvaluationWorkerPoolTest {

    private EvaluationWorkerPool pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown();
        }
    }

    @Test
    void dispatchCoversEveryItem() {
        pool = new EvaluationWorkerPool(4);
        int[] data = new int[37];

        pool.dispatch(data.length, (from, to) -> {
            for (int i = from; i < to; i++) {
                data[i] = i + 1;
            }
        });

        for (int i = 0; i < data.length; i++) {
            assertThat(data[i]).isEqualTo(i + 1);
        }
    }

    @Test
    void singleThreadPoolRunsOnCaller() {
        pool = new EvaluationWorkerPool(1);
        Set<String> threads = ConcurrentHashMap.newKeySet();

        pool.dispatch(10, (from, to) -> threads.add(Thread.currentThread().getName()));

        assertThat(threads).containsExactly(Thread.currentThread().getName());
        assertThat(pool.getParallelism()).isEqualTo(1);
    }

    @Test
    void interruptedCallerStillWaitsForHelpers() {
        pool = new EvaluationWorkerPool(2);
        AtomicBoolean helperDone = new AtomicBoolean();

        try {
            pool.dispatch(2, (from, to) -> {
                if (from == 0) {
                    Thread.currentThread().interrupt();
                    return;
                }
                try {
                    Thread.sleep(200);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                helperDone.set(true);
            });

            assertThat(helperDone).isTrue();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void workUsesAllThreads() {
        pool = new EvaluationWorkerPool(3);
        Set<String> threads = ConcurrentHashMap.newKeySet();

        pool.dispatch(30, (from, to) -> threads.add(Thread.currentThread().getName()));

        assertThat(threads).hasSize(3)
                .contains("evaluation-worker-1", "evaluation-worker-2", Thread.currentThread().getName());
    }

    @Test
    void dispatchWithZeroSizeSkipsTask() {
        pool = new EvaluationWorkerPool(2);

        pool.dispatch(0, (from, to) -> {
            throw new AssertionError("Should not be called");
        });
    }

    @Test
    void workerExceptionPropagatesAfterBarrier() {
        pool = new EvaluationWorkerPool(4);
        AtomicIntegerArray done = new AtomicIntegerArray(4);

        assertThatThrownBy(() -> pool.dispatch(4, (from, to) -> {
            done.set(from, 1);
            if (from == 2) {
                throw new IllegalStateException("Worker failure");
            }
        })).isInstanceOf(IllegalStateException.class).hasMessageContaining("Worker failure");

        for (int i = 0; i < 4; i++) {
            assertThat(done.get(i)).isEqualTo(1);
        }
    }

    @Test
    void repeatedDispatchesDoNotDeadlock() {
        pool = new EvaluationWorkerPool(4);
        AtomicIntegerArray counters = new AtomicIntegerArray(50);

        for (int round = 0; round < 500; round++) {
            pool.dispatch(counters.length(), (from, to) -> {
                for (int i = from; i < to; i++) {
                    counters.incrementAndGet(i);
                }
            });
        }

        for (int i = 0; i < counters.length(); i++) {
            assertThat(counters.get(i)).isEqualTo(500);
        }
    }

    @Test
    void shutdownIsIdempotentAndRejectsFurtherWork() {
        pool = new EvaluationWorkerPool(3);
        pool.shutdown();
        pool.shutdown();

        assertThatThrownBy(() -> pool.dispatch(1, (from, to) -> { }))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void constructorRejectsNonPositiveParallelism() {
        assertThatThrownBy(() -> new EvaluationWorkerPool(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
