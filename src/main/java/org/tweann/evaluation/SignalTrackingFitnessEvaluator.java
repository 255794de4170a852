package org.tweann.evaluation;

import java.time.Duration;

import com.typesafe.config.Config;
import org.tweann.genotype.Genotype;
import org.tweann.runtime.Network;
import org.tweann.runtime.NetworkFailureException;
import org.tweann.runtime.PhenotypeMapper;
import org.tweann.runtime.functions.FunctionBindings;
import org.tweann.runtime.functions.FunctionCatalog;
import org.tweann.runtime.functions.RandomVectorSensor;
import org.tweann.runtime.functions.RecordingActuator;
import org.tweann.runtime.spi.IRandomProvider;

/**
 * Rewards networks whose {@code pts} output stays close to a constant while the {@code rng} sensor
 * feeds them noise.
 * <p>
 * Fitness is {@code 1 / (1 + MAE)} over all actuation elements of all cycles. Each genotype draws
 * its noise from a stream derived from its id, so re-evaluating a genotype reproduces its score.
 * <p>
 * Options: {@code target} (default 0.5), {@code steps} (default 10), {@code timeout} (default 5s).
 */
public class SignalTrackingFitnessEvaluator implements IFitnessEvaluator {

    private final IRandomProvider randomProvider;
    private final double target;
    private final int steps;
    private final Duration timeout;

    public SignalTrackingFitnessEvaluator(IRandomProvider randomProvider, Config options) {
        this.randomProvider = randomProvider;
        this.target = options.hasPath("target") ? options.getDouble("target") : 0.5;
        this.steps = options.hasPath("steps") ? options.getInt("steps") : 10;
        this.timeout = options.hasPath("timeout") ? options.getDuration("timeout") : Duration.ofSeconds(5);
        if (steps < 1) {
            throw new IllegalArgumentException("steps must be at least 1, got: " + steps);
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
    }

    @Override
    public double evaluate(Genotype genotype) throws NetworkFailureException {
        RecordingActuator output = new RecordingActuator();
        IRandomProvider noise = randomProvider.deriveFor("signal-tracking", genotype.getId().hashCode());
        FunctionBindings bindings = FunctionBindings.builder()
                .sensor(FunctionCatalog.SensorType.RNG.functionName(), new RandomVectorSensor(noise))
                .actuator(FunctionCatalog.ActuatorType.PTS.functionName(), output)
                .build();

        try (Network network = PhenotypeMapper.instantiate(genotype, bindings)) {
            network.run(steps, timeout);
        }

        double errorSum = 0.0;
        int count = 0;
        for (double[] vector : output.outputs()) {
            for (double value : vector) {
                errorSum += Math.abs(value - target);
                count++;
            }
        }
        if (count == 0) {
            throw new NetworkFailureException("Genotype " + genotype.getId() + " produced no output");
        }
        return 1.0 / (1.0 + errorSum / count);
    }
}
