package org.tweann.runtime;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tweann.runtime.functions.ActivationFunction;

/**
 * Waits for one signal from every declared input, then fires.
 * <p>
 * Each input's weighted contribution is stored in its own slot and the slots are summed in declared
 * input order when the last one arrives, so the output does not depend on arrival order. A signal
 * from an input that has already reported in the current cycle belongs to the next cycle; it is
 * held back and replayed after the neuron fires.
 */
final class NeuronActor extends AbstractActor {

    private static final Logger log = LoggerFactory.getLogger(NeuronActor.class);

    private final ActivationFunction activation;
    private final List<NetworkBlueprint.WeightedInput> inputs;
    private final double bias;
    private final Synchronizer synchronizer;
    private final List<AbstractActor> outputs = new ArrayList<>();

    private final Object2IntOpenHashMap<String> slotBySource = new Object2IntOpenHashMap<>();
    private final double[] contributions;
    private final boolean[] reported;
    private int reportedCount;
    private final Deque<Message.Signal> deferred = new ArrayDeque<>();

    NeuronActor(String id, Network network, ActivationFunction activation,
                List<NetworkBlueprint.WeightedInput> inputs, double bias, Synchronizer synchronizer) {
        super(id, network);
        this.activation = activation;
        this.inputs = List.copyOf(inputs);
        this.bias = bias;
        this.synchronizer = synchronizer;
        this.contributions = new double[inputs.size()];
        this.reported = new boolean[inputs.size()];
        slotBySource.defaultReturnValue(-1);
        for (int i = 0; i < inputs.size(); i++) {
            slotBySource.put(inputs.get(i).source(), i);
        }
    }

    void connect(AbstractActor output) {
        outputs.add(output);
    }

    @Override
    protected boolean handle(Message message) {
        if (message instanceof Message.Signal signal) {
            accept(signal);
            return true;
        }
        if (message instanceof Message.GetBackup) {
            synchronizer.send(new Message.Backup(new NeuronWeights(getId(), inputs, bias)));
            return true;
        }
        if (message instanceof Message.Terminate) {
            return false;
        }
        throw unexpected(message);
    }

    private void accept(Message.Signal signal) {
        int slot = slotBySource.getInt(signal.from());
        if (slot < 0) {
            throw new IllegalStateException("Neuron '" + getId() + "' received a signal from undeclared input '"
                    + signal.from() + "'");
        }
        if (reported[slot]) {
            deferred.addLast(signal);
            return;
        }
        contributions[slot] = inputs.get(slot).dot(signal.vector());
        reported[slot] = true;
        reportedCount++;

        if (reportedCount == inputs.size()) {
            fire();
        }
    }

    private void fire() {
        double sum = 0.0;
        for (double contribution : contributions) {
            sum += contribution;
        }
        double output = activation.apply(sum + bias);
        log.trace("Neuron '{}' fired {}", getId(), output);

        broadcast(outputs, new Message.Signal(getId(), new double[]{output}));

        Arrays.fill(reported, false);
        reportedCount = 0;

        if (!deferred.isEmpty()) {
            List<Message.Signal> replay = new ArrayList<>(deferred);
            deferred.clear();
            for (Message.Signal signal : replay) {
                accept(signal);
            }
        }
    }
}
