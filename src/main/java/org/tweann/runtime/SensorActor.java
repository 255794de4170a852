package org.tweann.runtime;

import java.util.ArrayList;
import java.util.List;

import org.tweann.runtime.spi.ISensorFunction;

/**
 * Samples its signal function on request and forwards the vector to every fan-out neuron.
 */
final class SensorActor extends AbstractActor {

    private final ISensorFunction function;
    private final int vectorLength;
    private final List<NeuronActor> fanOut = new ArrayList<>();

    SensorActor(String id, Network network, ISensorFunction function, int vectorLength) {
        super(id, network);
        this.function = function;
        this.vectorLength = vectorLength;
    }

    void connect(NeuronActor neuron) {
        fanOut.add(neuron);
    }

    @Override
    protected boolean handle(Message message) {
        if (message instanceof Message.Sample) {
            double[] vector = function.sense(vectorLength);
            if (vector == null || vector.length != vectorLength) {
                throw new IllegalStateException("Sensor '" + getId() + "' produced "
                        + (vector == null ? "no vector" : vector.length + " values") + ", expected " + vectorLength);
            }
            broadcast(fanOut, new Message.Signal(getId(), vector));
            return true;
        }
        if (message instanceof Message.Terminate) {
            return false;
        }
        throw unexpected(message);
    }
}
