package org.tweann.runtime;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tweann.runtime.functions.FunctionBindings;

/**
 * A live phenotype: one actor per sensor, neuron and actuator plus the {@link Synchronizer}, each
 * running on its own thread.
 * <p>
 * The network owns its actors through a handle table keyed by node id and owns the executor their
 * threads come from. Nothing is registered globally; when the run finishes, fails or is aborted,
 * all threads are released and the network cannot be started again.
 * <p>
 * <strong>Failure:</strong> an exception inside any actor completes the result future with a
 * {@link NetworkFailureException} and interrupts every other actor of the same network.
 * <p>
 * Typical use:
 * <pre>{@code
 * try (Network network = Network.build(blueprint, bindings)) {
 *     NetworkResult result = network.run(steps, timeout);
 * }
 * }</pre>
 */
public final class Network implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Network.class);

    /** Handle of the synchronizer in the actor table. */
    public static final String SYNCHRONIZER_ID = "synchronizer";

    private final String id;
    private final Map<String, AbstractActor> handles = new LinkedHashMap<>();
    private final Synchronizer synchronizer;
    private final ExecutorService executor;
    private final CompletableFuture<NetworkResult> result = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private Network(NetworkBlueprint blueprint, FunctionBindings bindings) {
        this.id = blueprint.id();
        this.synchronizer = new Synchronizer(SYNCHRONIZER_ID, this);
        handles.put(SYNCHRONIZER_ID, synchronizer);

        for (NetworkBlueprint.SensorNode node : blueprint.sensors()) {
            SensorActor sensor = new SensorActor(node.id(), this, bindings.sensor(node.function()), node.vectorLength());
            handles.put(node.id(), sensor);
            synchronizer.register(sensor);
        }
        for (NetworkBlueprint.NeuronNode node : blueprint.neurons()) {
            NeuronActor neuron = new NeuronActor(node.id(), this, node.activation(), node.inputs(), node.bias(),
                    synchronizer);
            handles.put(node.id(), neuron);
            synchronizer.register(neuron);
        }
        for (NetworkBlueprint.ActuatorNode node : blueprint.actuators()) {
            ActuatorActor actuator = new ActuatorActor(node.id(), this, bindings.actuator(node.function()),
                    node.fanIn(), synchronizer);
            handles.put(node.id(), actuator);
            synchronizer.register(actuator);
        }

        // Output lists are the inverse of the declared inputs.
        for (NetworkBlueprint.NeuronNode node : blueprint.neurons()) {
            NeuronActor neuron = (NeuronActor) handles.get(node.id());
            for (NetworkBlueprint.WeightedInput input : node.inputs()) {
                AbstractActor source = handles.get(input.source());
                if (source instanceof SensorActor sensor) {
                    sensor.connect(neuron);
                } else {
                    ((NeuronActor) source).connect(neuron);
                }
            }
        }
        for (NetworkBlueprint.ActuatorNode node : blueprint.actuators()) {
            AbstractActor actuator = handles.get(node.id());
            for (String neuronId : node.fanIn()) {
                ((NeuronActor) handles.get(neuronId)).connect(actuator);
            }
        }

        this.executor = Executors.newFixedThreadPool(handles.size(), new ActorThreadFactory(id));
    }

    /**
     * Validates the blueprint, resolves every function name and wires the actors. No thread is
     * started until {@link #start(int)}.
     *
     * @param blueprint The network description.
     * @param bindings  Function instances for the sensor and actuator names used by the blueprint.
     * @return The constructed, idle network.
     * @throws NetworkConfigurationException if the blueprint is invalid or a function name is unknown.
     */
    public static Network build(NetworkBlueprint blueprint, FunctionBindings bindings) {
        blueprint.validate();
        return new Network(blueprint, bindings);
    }

    public String getId() {
        return id;
    }

    /**
     * Returns the ids in the network's handle table, synchronizer first.
     */
    public Iterable<String> getActorIds() {
        return Collections.unmodifiableSet(handles.keySet());
    }

    public Synchronizer.State getSynchronizerState() {
        return synchronizer.getState();
    }

    /**
     * Starts every actor and runs the given number of sense-think-act cycles.
     *
     * @param steps Number of cycles, at least 1.
     * @return A future completed with the result once the synchronizer terminates, or
     *         exceptionally with a {@link NetworkFailureException} if an actor fails.
     * @throws IllegalStateException    if the network was already started.
     * @throws IllegalArgumentException if {@code steps < 1}.
     */
    public CompletableFuture<NetworkResult> start(int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be at least 1, got: " + steps);
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Network " + id + " has already been started");
        }
        log.debug("Starting network {} with {} actors for {} step(s)", id, handles.size(), steps);
        for (AbstractActor actor : handles.values()) {
            executor.execute(actor);
        }
        synchronizer.send(new Message.Start(steps));
        return result;
    }

    /**
     * Runs the network and waits for its result.
     * <p>
     * If the run does not finish in time, the network is aborted: all actor threads are interrupted
     * and no backup is collected.
     *
     * @param steps   Number of cycles.
     * @param timeout Upper bound on the whole run.
     * @return The result.
     * @throws NetworkFailureException if an actor failed, the timeout expired or the caller was interrupted.
     */
    public NetworkResult run(int steps, Duration timeout) throws NetworkFailureException {
        CompletableFuture<NetworkResult> future = start(steps);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            NetworkFailureException failure = new NetworkFailureException(
                    "Network " + id + " did not finish within " + timeout.toMillis() + "ms", e);
            abort(failure);
            throw failure;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof NetworkFailureException failure) {
                throw failure;
            }
            throw new NetworkFailureException("Network " + id + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            NetworkFailureException failure = new NetworkFailureException("Interrupted while running network " + id, e);
            abort(failure);
            throw failure;
        }
    }

    /**
     * Requests an orderly early stop: the synchronizer stops triggering cycles, collects the
     * backup and terminates all actors. Has no effect once the network has finished.
     */
    public void terminate() {
        synchronizer.send(new Message.Terminate());
    }

    /**
     * Releases all threads. Completes the result exceptionally if the run has not finished.
     */
    @Override
    public void close() {
        abort(new NetworkFailureException("Network " + id + " was closed before finishing"));
    }

    void complete(NetworkResult networkResult) {
        if (result.complete(networkResult)) {
            log.debug("Network {} finished after {} cycle(s){}", id, networkResult.cyclesCompleted(),
                    networkResult.terminatedEarly() ? " (terminated early)" : "");
        }
        executor.shutdown();
    }

    void fail(String actorId, Throwable cause) {
        NetworkFailureException failure = new NetworkFailureException(
                "Actor '" + actorId + "' of network " + id + " failed: " + cause.getMessage(), cause);
        if (result.completeExceptionally(failure)) {
            log.debug("Network {} failed in actor '{}': {}", id, actorId, cause.getMessage());
        }
        executor.shutdownNow();
    }

    private void abort(NetworkFailureException failure) {
        result.completeExceptionally(failure);
        executor.shutdownNow();
    }

    private static final class ActorThreadFactory implements ThreadFactory {
        private final String networkId;
        private final AtomicInteger counter = new AtomicInteger();

        ActorThreadFactory(String networkId) {
            this.networkId = networkId;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "net-" + networkId + "-actor-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
