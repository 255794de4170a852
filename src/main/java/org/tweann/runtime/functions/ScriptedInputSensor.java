package org.tweann.runtime.functions;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.tweann.runtime.spi.ISensorFunction;

/**
 * Replays a fixed sequence of input vectors, wrapping around after the last one.
 */
public class ScriptedInputSensor implements ISensorFunction {

    private final double[][] script;
    private final AtomicInteger position = new AtomicInteger();

    /**
     * @param inputs Input vectors; must not be empty.
     */
    public ScriptedInputSensor(List<double[]> inputs) {
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("inputs must not be empty");
        }
        this.script = new double[inputs.size()][];
        for (int i = 0; i < script.length; i++) {
            script[i] = inputs.get(i).clone();
        }
    }

    @Override
    public double[] sense(int vectorLength) {
        double[] next = script[Math.floorMod(position.getAndIncrement(), script.length)];
        if (next.length != vectorLength) {
            throw new IllegalStateException("Scripted input has length " + next.length
                    + " but the sensor expects " + vectorLength);
        }
        return next.clone();
    }

    /**
     * Returns how many vectors have been produced so far.
     */
    public int samplesTaken() {
        return position.get();
    }
}
