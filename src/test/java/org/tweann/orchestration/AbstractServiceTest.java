package org.tweann.orchestration;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tweann.orchestration.api.IService;
import org.tweann.orchestration.api.OperationalError;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class AbstractServiceTest {

    private Config config;

    @BeforeEach
    void setUp() {
        config = ConfigFactory.empty();
    }

    private static class TestService extends AbstractService {
        private final CountDownLatch latch = new CountDownLatch(1);
        private final AtomicBoolean wasInterrupted = new AtomicBoolean(false);
        volatile boolean isRunning = false;

        protected TestService(String name, Config options) {
            super(name, options);
        }

        @Override
        protected void run() throws InterruptedException {
            isRunning = true;
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    checkPause();
                    Thread.sleep(10);
                }
            } catch (InterruptedException e) {
                wasInterrupted.set(true);
                Thread.currentThread().interrupt();
            } finally {
                latch.countDown();
                isRunning = false;
            }
        }

        void fail(String code) {
            recordError(code, "Something went wrong", "details");
        }

        public boolean wasInterrupted() {
            return wasInterrupted.get();
        }

        public void awaitTermination() throws InterruptedException {
            latch.await(5, TimeUnit.SECONDS);
        }
    }

    @Test
    void serviceStartsAndStopsCorrectly() throws InterruptedException {
        TestService service = new TestService("test-service", config);
        assertEquals(IService.State.STOPPED, service.getCurrentState());

        service.start();
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> {
            assertEquals(IService.State.RUNNING, service.getCurrentState());
            assertTrue(service.isRunning);
        });

        service.stop();
        service.awaitTermination();
        assertEquals(IService.State.STOPPED, service.getCurrentState());
        assertFalse(service.isRunning);
        assertTrue(service.wasInterrupted());
    }

    @Test
    void servicePausesAndResumesCorrectly() throws InterruptedException {
        TestService service = new TestService("test-service", config);
        service.start();
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() ->
            assertEquals(IService.State.RUNNING, service.getCurrentState()));

        service.pause();
        assertEquals(IService.State.PAUSED, service.getCurrentState());
        assertThrows(IllegalStateException.class, service::pause);

        service.resume();
        assertEquals(IService.State.RUNNING, service.getCurrentState());

        service.stop();
        service.awaitTermination();
    }

    @Test
    void pausedServiceCanBeStopped() throws InterruptedException {
        TestService service = new TestService("test-service", config);
        service.start();
        await().atMost(2, TimeUnit.SECONDS).until(() -> service.isRunning);
        service.pause();

        service.stop();
        service.awaitTermination();

        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void startTwiceIsRejected() throws InterruptedException {
        TestService service = new TestService("test-service", config);
        service.start();

        assertThrows(IllegalStateException.class, service::start);

        service.stop();
        service.awaitTermination();
        assertThrows(IllegalStateException.class, service::stop);
    }

    @Test
    void failingRunMovesServiceToError() {
        AbstractService service = new AbstractService("failing-svc", config) {
            @Override
            protected void run() {
                throw new IllegalStateException("fatal");
            }
        };

        service.start();

        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() ->
            assertEquals(IService.State.ERROR, service.getCurrentState()));
        assertFalse(service.isHealthy());
    }

    @Test
    void interruptInducedFailureIsCleanStop() throws InterruptedException {
        CountDownLatch running = new CountDownLatch(1);
        AbstractService service = new AbstractService("wrapping-svc", config) {
            @Override
            protected void run() {
                running.countDown();
                try {
                    Thread.sleep(Long.MAX_VALUE);
                } catch (InterruptedException e) {
                    throw new IllegalStateException("wrapped", e);
                }
            }
        };
        service.start();
        assertTrue(running.await(2, TimeUnit.SECONDS));

        service.stop();

        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void recordedErrorsAreBoundedAndClearable() {
        TestService service = new TestService("test-service", config) {
            @Override
            protected int getMaxErrors() {
                return 2;
            }
        };

        service.fail("FIRST");
        service.fail("SECOND");
        service.fail("THIRD");

        List<OperationalError> errors = service.getErrors();
        assertEquals(List.of("SECOND", "THIRD"), errors.stream().map(OperationalError::code).toList());
        assertFalse(service.isHealthy());
        Map<String, Number> metrics = service.getMetrics();
        assertEquals(2, metrics.get("error_count").intValue());

        service.clearErrors();
        assertTrue(service.getErrors().isEmpty());
        assertTrue(service.isHealthy());
    }

    /**
     * Stays in the WAITING phase and blocks; stop() should interrupt it at once.
     */
    private static class WaitingPhaseService extends AbstractService {
        private final CountDownLatch runningLatch = new CountDownLatch(1);

        protected WaitingPhaseService(String name, Config options) {
            super(name, options);
        }

        @Override
        protected void run() throws InterruptedException {
            runningLatch.countDown();
            Thread.sleep(Long.MAX_VALUE);
        }
    }

    /**
     * Enters the PROCESSING phase for a fixed duration; stop() should wait for it.
     */
    private static class ProcessingPhaseService extends AbstractService {
        private final CountDownLatch runningLatch = new CountDownLatch(1);
        private final AtomicBoolean wasInterruptedDuringProcessing = new AtomicBoolean(false);
        private final long processingDurationMs;

        protected ProcessingPhaseService(String name, Config options, long processingDurationMs) {
            super(name, options);
            this.processingDurationMs = processingDurationMs;
        }

        @Override
        protected void run() throws InterruptedException {
            setShutdownPhase(ShutdownPhase.PROCESSING);
            Thread.interrupted();
            runningLatch.countDown();

            long start = System.currentTimeMillis();
            while ((System.currentTimeMillis() - start) < processingDurationMs) {
                if (Thread.currentThread().isInterrupted()) {
                    wasInterruptedDuringProcessing.set(true);
                    return;
                }
                Thread.yield();
            }

            setShutdownPhase(ShutdownPhase.WAITING);

            while (!isStopRequested() && !Thread.currentThread().isInterrupted()) {
                Thread.sleep(50);
            }
        }
    }

    @Test
    void waitingPhaseServiceIsInterruptedImmediately() throws InterruptedException {
        WaitingPhaseService service = new WaitingPhaseService("waiting-svc", config);
        service.start();
        assertTrue(service.runningLatch.await(2, TimeUnit.SECONDS), "Service should be running");

        long start = System.currentTimeMillis();
        service.stop();
        long elapsed = System.currentTimeMillis() - start;

        assertEquals(IService.State.STOPPED, service.getCurrentState());
        assertTrue(elapsed < 2000, "WAITING service should stop quickly, took " + elapsed + "ms");
    }

    @Test
    void processingPhaseServiceGetsGracePeriod() throws InterruptedException {
        ProcessingPhaseService service = new ProcessingPhaseService("processing-svc", config, 500);
        service.start();
        assertTrue(service.runningLatch.await(2, TimeUnit.SECONDS), "Service should be running");
        assertEquals(IService.ShutdownPhase.PROCESSING, service.getShutdownPhase());

        service.stop();

        assertEquals(IService.State.STOPPED, service.getCurrentState());
        assertFalse(service.wasInterruptedDuringProcessing.get(),
            "Service should not be interrupted during PROCESSING phase");
    }

    @Test
    void stuckServiceIsInterruptedAfterShutdownTimeout() throws InterruptedException {
        Config shortTimeout = ConfigFactory.parseString("shutdown-timeout = 100ms");
        ProcessingPhaseService service = new ProcessingPhaseService("stuck-svc", shortTimeout, 60_000);
        service.start();
        assertTrue(service.runningLatch.await(2, TimeUnit.SECONDS), "Service should be running");

        service.stop();

        assertTrue(service.wasInterruptedDuringProcessing.get());
        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void defaultShutdownPhaseIsWaiting() {
        TestService service = new TestService("test-service", config);
        assertEquals(IService.ShutdownPhase.WAITING, service.getShutdownPhase());
    }
}
