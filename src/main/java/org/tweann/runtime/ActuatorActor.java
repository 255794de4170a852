package org.tweann.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.tweann.runtime.spi.IActuatorFunction;

/**
 * Collects one scalar from every fan-in neuron, reassembles them in declared fan-in order, invokes
 * its consumer function and reports to the synchronizer.
 */
final class ActuatorActor extends AbstractActor {

    private final IActuatorFunction function;
    private final Synchronizer synchronizer;
    private final Object2IntOpenHashMap<String> slotByNeuron = new Object2IntOpenHashMap<>();
    private final double[] vector;
    private final boolean[] reported;
    private int reportedCount;
    private final Deque<Message.Signal> deferred = new ArrayDeque<>();

    ActuatorActor(String id, Network network, IActuatorFunction function, List<String> fanIn,
                  Synchronizer synchronizer) {
        super(id, network);
        this.function = function;
        this.synchronizer = synchronizer;
        this.vector = new double[fanIn.size()];
        this.reported = new boolean[fanIn.size()];
        slotByNeuron.defaultReturnValue(-1);
        for (int i = 0; i < fanIn.size(); i++) {
            slotByNeuron.put(fanIn.get(i), i);
        }
    }

    @Override
    protected boolean handle(Message message) {
        if (message instanceof Message.Signal signal) {
            accept(signal);
            return true;
        }
        if (message instanceof Message.Terminate) {
            return false;
        }
        throw unexpected(message);
    }

    private void accept(Message.Signal signal) {
        int slot = slotByNeuron.getInt(signal.from());
        if (slot < 0) {
            throw new IllegalStateException("Actuator '" + getId() + "' received a signal from undeclared neuron '"
                    + signal.from() + "'");
        }
        if (reported[slot]) {
            deferred.addLast(signal);
            return;
        }
        vector[slot] = signal.vector()[0];
        reported[slot] = true;
        reportedCount++;

        if (reportedCount == vector.length) {
            function.act(vector.clone());
            synchronizer.send(new Message.Sync(getId()));

            Arrays.fill(reported, false);
            reportedCount = 0;
            if (!deferred.isEmpty()) {
                List<Message.Signal> replay = new ArrayList<>(deferred);
                deferred.clear();
                for (Message.Signal next : replay) {
                    accept(next);
                }
            }
        }
    }
}
