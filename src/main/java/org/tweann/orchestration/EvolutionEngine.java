package org.tweann.orchestration;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tweann.evaluation.EvaluationOutcome;
import org.tweann.evaluation.FitnessEvaluationDispatcher;
import org.tweann.evaluation.FitnessEvaluatorFactory;
import org.tweann.evaluation.IFitnessEvaluator;
import org.tweann.evolution.GenerationSummary;
import org.tweann.evolution.GeneticOperators;
import org.tweann.evolution.GenotypeConstructor;
import org.tweann.evolution.Morphology;
import org.tweann.evolution.Population;
import org.tweann.evolution.PopulationConfig;
import org.tweann.evolution.PopulationManager;
import org.tweann.genotype.Genotype;
import org.tweann.runtime.internal.services.SeededRandomProvider;
import org.tweann.runtime.spi.IRandomProvider;

/**
 * Runs generations synchronously: evaluate every unevaluated genotype, merge the fitness values
 * back into the population and breed the next generation.
 * <p>
 * A step either completes or leaves the engine unchanged, so a failed step can simply be reissued.
 * <p>
 * <strong>Thread Safety:</strong> {@link #step()} must be called from one thread at a time. The
 * getters may be called from any thread and see the state after the last completed step.
 */
public class EvolutionEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EvolutionEngine.class);

    private final PopulationManager manager;
    private final FitnessEvaluationDispatcher dispatcher;
    private volatile Population population;
    private volatile Genotype best;

    public EvolutionEngine(PopulationManager manager, FitnessEvaluationDispatcher dispatcher) {
        this.manager = manager;
        this.dispatcher = dispatcher;
    }

    /**
     * Assembles an engine from the {@code tweann} configuration block.
     *
     * @param config The {@code tweann} block, with {@code seed}, {@code population},
     *               {@code morphology}, {@code mutation}, {@code distance} and {@code evaluation}.
     * @return A new engine; generation 0 is created on the first step.
     * @throws IllegalArgumentException if a value is out of range or the evaluator cannot be created.
     */
    public static EvolutionEngine create(Config config) {
        IRandomProvider randomProvider = new SeededRandomProvider(config.hasPath("seed") ? config.getLong("seed") : 42L);

        PopulationConfig populationConfig = PopulationConfig.fromConfig(config.getConfig("population"));
        GenotypeConstructor constructor = new GenotypeConstructor(Morphology.fromConfig(config.getConfig("morphology")));
        GeneticOperators operators = new GeneticOperators(randomProvider, config);
        PopulationManager manager = new PopulationManager(populationConfig, constructor, operators, randomProvider);

        Config evaluation = config.getConfig("evaluation");
        Config evaluatorConfig = evaluation.getConfig("evaluator");
        if (evaluation.hasPath("timeout") && !evaluatorConfig.hasPath("options.timeout")) {
            evaluatorConfig = evaluatorConfig.withValue("options.timeout", evaluation.getValue("timeout"));
        }
        IFitnessEvaluator evaluator = FitnessEvaluatorFactory.create(evaluatorConfig,
                randomProvider.deriveFor("evaluation", 0));
        int parallelism = evaluation.hasPath("parallelism")
                ? evaluation.getInt("parallelism")
                : Runtime.getRuntime().availableProcessors();

        log.debug("Assembled evolution engine: population {}, evaluator {}, parallelism {}",
                populationConfig.size(), evaluator.getClass().getSimpleName(), parallelism);
        return new EvolutionEngine(manager, new FitnessEvaluationDispatcher(evaluator, parallelism));
    }

    /**
     * Evaluates the current generation and replaces it with the next one. Nothing is published
     * unless the whole step succeeds.
     *
     * @return The evaluated generation's summary and fittest genotype.
     * @throws org.tweann.evaluation.EvaluationInterruptedException if the calling thread is
     *         interrupted during evaluation.
     */
    public GenerationReport step() {
        Population current = population != null ? population : manager.initialize();

        List<Genotype> pending = current.getUnevaluated();
        List<EvaluationOutcome> outcomes = dispatcher.evaluateAll(pending);
        List<Genotype> evaluated = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            evaluated.add(outcomes.get(i).applyTo(pending.get(i)));
        }
        Population scored = current.withGenotypes(evaluated);

        Genotype generationBest = scored.getBest().orElseThrow(
                () -> new IllegalStateException("Generation " + scored.getGeneration() + " has no evaluated genotype"));
        Population next = manager.nextGeneration(scored);
        List<GenerationSummary> history = next.getHistory();
        GenerationSummary summary = history.get(history.size() - 1);

        Genotype overallBest = best;
        if (overallBest == null || generationBest.getFitness() > overallBest.getFitness()) {
            best = generationBest;
        }
        population = next;
        return new GenerationReport(summary, generationBest);
    }

    /**
     * Returns the population that the next {@link #step()} will evaluate, or empty before the first
     * step.
     */
    public Optional<Population> getPopulation() {
        return Optional.ofNullable(population);
    }

    /**
     * Returns the fittest genotype seen in any completed step.
     */
    public Optional<Genotype> getBest() {
        return Optional.ofNullable(best);
    }

    public EvolutionStatistics getStatistics() {
        Population current = population;
        List<GenerationSummary> history = current == null ? List.of() : current.getHistory();
        return new EvolutionStatistics(history, dispatcher.getEvaluationCount(), dispatcher.getFailureCount());
    }

    @Override
    public void close() {
        dispatcher.close();
    }
}
