package org.tweann.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The cycle barrier of a network.
 * <p>
 * Triggers every sensor, waits until every actuator has reported, and repeats until the step
 * budget is spent. It then collects a weight backup from every neuron, terminates all other actors
 * and publishes the {@link NetworkResult}.
 * <pre>
 * AWAITING_INITIAL_STATE --Start--&gt; RUNNING --budget spent or Terminate--&gt; COLLECTING_BACKUP --all backups--&gt; TERMINATED
 * </pre>
 * A {@link Message.Terminate} received before the start skips straight to {@code TERMINATED}.
 */
public final class Synchronizer extends AbstractActor {

    private static final Logger log = LoggerFactory.getLogger(Synchronizer.class);

    /**
     * Protocol state.
     */
    public enum State {
        AWAITING_INITIAL_STATE,
        RUNNING,
        COLLECTING_BACKUP,
        TERMINATED
    }

    private final Network network;
    private final List<SensorActor> sensors = new ArrayList<>();
    private final List<NeuronActor> neurons = new ArrayList<>();
    private final List<ActuatorActor> actuators = new ArrayList<>();

    private volatile State state = State.AWAITING_INITIAL_STATE;
    private int remainingSteps;
    private int cyclesCompleted;
    private boolean terminatedEarly;
    private final Set<String> synced = new HashSet<>();
    private final Map<String, NeuronWeights> backup = new HashMap<>();

    Synchronizer(String id, Network network) {
        super(id, network);
        this.network = network;
    }

    void register(SensorActor sensor) {
        sensors.add(sensor);
    }

    void register(NeuronActor neuron) {
        neurons.add(neuron);
    }

    void register(ActuatorActor actuator) {
        actuators.add(actuator);
    }

    /**
     * Returns the current protocol state. Safe to call from any thread.
     */
    public State getState() {
        return state;
    }

    @Override
    protected boolean handle(Message message) {
        return switch (state) {
            case AWAITING_INITIAL_STATE -> awaitingInitialState(message);
            case RUNNING -> running(message);
            case COLLECTING_BACKUP -> collectingBackup(message);
            case TERMINATED -> false;
        };
    }

    private boolean awaitingInitialState(Message message) {
        if (message instanceof Message.Start start) {
            remainingSteps = start.steps();
            transition(State.RUNNING);
            broadcast(sensors, new Message.Sample());
            return true;
        }
        if (message instanceof Message.Terminate) {
            terminatedEarly = true;
            return finish();
        }
        throw unexpected(message);
    }

    private boolean running(Message message) {
        if (message instanceof Message.Sync sync) {
            if (!synced.add(sync.actuatorId())) {
                throw new IllegalStateException("Actuator '" + sync.actuatorId() + "' reported twice in cycle "
                        + cyclesCompleted);
            }
            if (synced.size() == actuators.size()) {
                synced.clear();
                cyclesCompleted++;
                remainingSteps--;
                if (remainingSteps > 0) {
                    broadcast(sensors, new Message.Sample());
                } else {
                    return beginBackup();
                }
            }
            return true;
        }
        if (message instanceof Message.Terminate) {
            terminatedEarly = true;
            return beginBackup();
        }
        throw unexpected(message);
    }

    private boolean collectingBackup(Message message) {
        if (message instanceof Message.Backup reply) {
            backup.put(reply.weights().neuronId(), reply.weights());
            if (backup.size() == neurons.size()) {
                return finish();
            }
            return true;
        }
        if (message instanceof Message.Sync || message instanceof Message.Terminate) {
            // Late sync after an early terminate, or a repeated terminate.
            log.debug("Synchronizer '{}' ignoring {} while collecting backup", getId(), message);
            return true;
        }
        throw unexpected(message);
    }

    private boolean beginBackup() {
        transition(State.COLLECTING_BACKUP);
        if (neurons.isEmpty()) {
            return finish();
        }
        broadcast(neurons, new Message.GetBackup());
        return true;
    }

    private boolean finish() {
        Message terminate = new Message.Terminate();
        broadcast(sensors, terminate);
        broadcast(neurons, terminate);
        broadcast(actuators, terminate);
        transition(State.TERMINATED);
        network.complete(new NetworkResult(network.getId(), cyclesCompleted, terminatedEarly, backup));
        return false;
    }

    private void transition(State next) {
        log.debug("Synchronizer '{}' {} -> {} after {} cycle(s)", getId(), state, next, cyclesCompleted);
        state = next;
    }
}
