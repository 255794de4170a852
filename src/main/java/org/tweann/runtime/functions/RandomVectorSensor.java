package org.tweann.runtime.functions;

import java.util.Random;

import org.tweann.runtime.spi.IRandomProvider;
import org.tweann.runtime.spi.ISensorFunction;

/**
 * Produces vectors of uniform random values in [0, 1).
 */
public class RandomVectorSensor implements ISensorFunction {

    private final Random random;

    public RandomVectorSensor(IRandomProvider randomProvider) {
        this.random = randomProvider.asJavaRandom();
    }

    @Override
    public double[] sense(int vectorLength) {
        double[] vector = new double[vectorLength];
        for (int i = 0; i < vectorLength; i++) {
            vector[i] = random.nextDouble();
        }
        return vector;
    }
}
