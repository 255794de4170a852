package org.tweann.runtime.functions;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.tweann.runtime.spi.IActuatorFunction;

/**
 * Keeps every output vector it receives, in arrival order.
 */
public class RecordingActuator implements IActuatorFunction {

    private final List<double[]> outputs = new CopyOnWriteArrayList<>();

    @Override
    public void act(double[] vector) {
        outputs.add(vector.clone());
    }

    /**
     * Returns copies of the recorded vectors.
     */
    public List<double[]> outputs() {
        List<double[]> copy = new ArrayList<>(outputs.size());
        for (double[] v : outputs) {
            copy.add(v.clone());
        }
        return copy;
    }

    public int invocations() {
        return outputs.size();
    }
}
