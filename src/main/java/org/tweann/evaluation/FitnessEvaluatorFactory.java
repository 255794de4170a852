package org.tweann.evaluation;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.tweann.runtime.spi.IRandomProvider;

/**
 * Instantiates the configured {@link IFitnessEvaluator}.
 * <p>
 * The evaluator block names a {@code className} and optional {@code options}:
 * <pre>
 * evaluator {
 *   className = "org.tweann.evaluation.XorFitnessEvaluator"
 *   options { timeout = 5s }
 * }
 * </pre>
 */
public final class FitnessEvaluatorFactory {

    private FitnessEvaluatorFactory() {
        // Utility class - no instantiation
    }

    /**
     * @param evaluatorConfig The evaluator block.
     * @param randomProvider  Passed to the evaluator's constructor.
     * @return The evaluator.
     * @throws IllegalArgumentException if the class cannot be loaded, does not implement
     *                                  {@link IFitnessEvaluator} or cannot be constructed.
     */
    public static IFitnessEvaluator create(Config evaluatorConfig, IRandomProvider randomProvider) {
        String className = evaluatorConfig.getString("className");
        Config options = evaluatorConfig.hasPath("options") ? evaluatorConfig.getConfig("options") : ConfigFactory.empty();
        try {
            Class<?> clazz = Class.forName(className);
            if (!IFitnessEvaluator.class.isAssignableFrom(clazz)) {
                throw new IllegalArgumentException("Class " + className + " does not implement IFitnessEvaluator");
            }
            return (IFitnessEvaluator) clazz
                    .getConstructor(IRandomProvider.class, Config.class)
                    .newInstance(randomProvider, options);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to instantiate fitness evaluator: " + className, e);
        }
    }
}
