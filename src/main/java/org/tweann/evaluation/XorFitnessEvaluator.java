package org.tweann.evaluation;

import java.time.Duration;
import java.util.List;

import com.typesafe.config.Config;
import org.tweann.genotype.Genotype;
import org.tweann.runtime.Network;
import org.tweann.runtime.NetworkFailureException;
import org.tweann.runtime.NetworkResult;
import org.tweann.runtime.PhenotypeMapper;
import org.tweann.runtime.functions.FunctionBindings;
import org.tweann.runtime.functions.FunctionCatalog;
import org.tweann.runtime.functions.RecordingActuator;
import org.tweann.runtime.functions.ScriptedInputSensor;
import org.tweann.runtime.spi.IRandomProvider;

/**
 * Scores a genotype on the XOR function in bipolar encoding.
 * <p>
 * The phenotype runs for one cycle per case of {@link FunctionBindings#XOR_INPUTS}; the
 * {@code xor_input} sensor presents the operands and the {@code xor_output} actuator records the
 * answer. Fitness is {@code 1 / (1 + SSE)}, where SSE is the sum of squared errors against the
 * expected outputs, so a perfect network scores 1.
 * <p>
 * Options: {@code timeout} (duration, default 5s) bounds each network run.
 */
public class XorFitnessEvaluator implements IFitnessEvaluator {

    /** Expected output per case of {@link FunctionBindings#XOR_INPUTS}. */
    static final double[] TARGETS = {-1.0, 1.0, 1.0, -1.0};

    private final Duration timeout;

    public XorFitnessEvaluator(IRandomProvider randomProvider, Config options) {
        this.timeout = options.hasPath("timeout") ? options.getDuration("timeout") : Duration.ofSeconds(5);
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
        }
    }

    @Override
    public double evaluate(Genotype genotype) throws NetworkFailureException {
        RecordingActuator output = new RecordingActuator();
        FunctionBindings bindings = FunctionBindings.builder()
                .sensor(FunctionCatalog.SensorType.XOR_INPUT.functionName(),
                        new ScriptedInputSensor(FunctionBindings.XOR_INPUTS))
                .actuator(FunctionCatalog.ActuatorType.XOR_OUTPUT.functionName(), output)
                .build();

        NetworkResult result;
        try (Network network = PhenotypeMapper.instantiate(genotype, bindings)) {
            result = network.run(TARGETS.length, timeout);
        }

        List<double[]> answers = output.outputs();
        if (result.cyclesCompleted() != TARGETS.length || answers.size() != TARGETS.length) {
            throw new NetworkFailureException("Genotype " + genotype.getId() + " produced " + answers.size()
                    + " answers in " + result.cyclesCompleted() + " cycles, expected " + TARGETS.length);
        }

        double sse = 0.0;
        for (int i = 0; i < TARGETS.length; i++) {
            double error = answers.get(i)[0] - TARGETS[i];
            sse += error * error;
        }
        return 1.0 / (1.0 + sse);
    }
}
