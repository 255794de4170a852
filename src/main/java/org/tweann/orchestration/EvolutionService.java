package org.tweann.orchestration;

import java.util.Map;
import java.util.Optional;

import com.typesafe.config.Config;
import org.tweann.evaluation.EvaluationInterruptedException;
import org.tweann.genotype.Genotype;

/**
 * Runs an {@link EvolutionEngine} for a requested number of generations on its own thread.
 * <p>
 * A failing generation step is recorded as an operational error ({@code STEP_FAILED}) and
 * reissued up to {@code max-step-retries} times; if it still fails, the service stops in
 * {@code ERROR}. A stop request lets the generation in progress finish first, within the shutdown
 * timeout.
 * <p>
 * Options ({@code orchestration} block): {@code max-step-retries} (default 2),
 * {@code shutdown-timeout} (default 5s).
 */
public class EvolutionService extends AbstractService {

    private final EvolutionEngine engine;
    private final int maxStepRetries;
    private volatile int generationsRequested;
    private volatile int generationsCompleted;
    private volatile IProgressListener listener;
    private volatile boolean completed;

    public EvolutionService(String name, Config options, EvolutionEngine engine) {
        super(name, options);
        this.engine = engine;
        this.maxStepRetries = options.hasPath("max-step-retries") ? options.getInt("max-step-retries") : 2;
        if (maxStepRetries < 0) {
            throw new IllegalArgumentException("max-step-retries must be non-negative, got: " + maxStepRetries);
        }
    }

    /**
     * Starts evolving on the service thread and returns immediately.
     *
     * @param generations Number of generations to run, at least 1.
     * @param listener    Called after every generation; may be {@code null}.
     * @throws IllegalArgumentException if {@code generations} is not positive.
     * @throws IllegalStateException    if a run is already in progress.
     */
    public void startEvolution(int generations, IProgressListener listener) {
        if (generations <= 0) {
            throw new IllegalArgumentException("generations must be positive, got: " + generations);
        }
        if (getCurrentState() != State.STOPPED) {
            throw new IllegalStateException("Cannot start evolution while the service is " + getCurrentState());
        }
        this.generationsRequested = generations;
        this.generationsCompleted = 0;
        this.listener = listener;
        this.completed = false;
        start();
    }

    @Override
    protected void logStarted() {
        log.info("{} started: {} generations, {} step retries", serviceName, generationsRequested, maxStepRetries);
    }

    @Override
    protected void run() throws InterruptedException {
        while (generationsCompleted < generationsRequested && !isStopRequested()) {
            checkPause();
            if (isStopRequested()) break;

            GenerationReport report = stepWithRetries();
            generationsCompleted++;

            EvolutionStatistics statistics = engine.getStatistics();
            log.info("Generation {}: best {}, mean {}, species {}, failed evaluations {}",
                    report.generation(), report.summary().bestFitness(), report.summary().meanFitness(),
                    report.summary().speciesCount(), report.summary().failedEvaluations());

            IProgressListener current = listener;
            if (current != null) {
                current.onGeneration(report.generation(), report.summary().bestFitness(), statistics);
            }
        }

        if (generationsCompleted == generationsRequested) {
            completed = true;
            log.info("{} completed {} generations, best fitness {}", serviceName, generationsCompleted,
                    engine.getBest().map(Genotype::getFitness).orElse(Double.NaN));
        }
    }

    private GenerationReport stepWithRetries() throws InterruptedException {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxStepRetries + 1; attempt++) {
            setShutdownPhase(ShutdownPhase.PROCESSING);
            Thread.interrupted();
            try {
                return engine.step();
            } catch (EvaluationInterruptedException e) {
                InterruptedException interrupted = new InterruptedException("Generation step interrupted");
                interrupted.initCause(e);
                throw interrupted;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("Generation step failed (attempt {}/{}): {}", attempt, maxStepRetries + 1, e.getMessage());
                log.debug("Step failure details:", e);
                recordError("STEP_FAILED", "Generation step failed",
                        String.format("attempt=%d, cause=%s: %s", attempt, e.getClass().getSimpleName(), e.getMessage()));
            } finally {
                setShutdownPhase(ShutdownPhase.WAITING);
            }
            if (isStopRequested()) {
                throw new InterruptedException("Stop requested while retrying a failed generation step");
            }
        }
        log.error("Generation step failed {} times, giving up", maxStepRetries + 1);
        throw new IllegalStateException("Generation step failed after " + (maxStepRetries + 1) + " attempts", lastFailure);
    }

    /**
     * Returns the run status derived from the service state.
     */
    public EvolutionStatus getStatus() {
        switch (getCurrentState()) {
            case RUNNING:
                return EvolutionStatus.RUNNING;
            case PAUSED:
                return EvolutionStatus.PAUSED;
            case ERROR:
                return EvolutionStatus.ERROR;
            default:
                return completed ? EvolutionStatus.COMPLETED : EvolutionStatus.IDLE;
        }
    }

    /**
     * Returns the fittest genotype found so far.
     */
    public Optional<Genotype> getBest() {
        return engine.getBest();
    }

    public EvolutionStatistics getStatistics() {
        return engine.getStatistics();
    }

    public int getGenerationsCompleted() {
        return generationsCompleted;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        EvolutionStatistics statistics = engine.getStatistics();
        metrics.put("generations_completed", generationsCompleted);
        metrics.put("evaluations", statistics.evaluations());
        metrics.put("failed_evaluations", statistics.failedEvaluations());
        metrics.put("best_fitness", engine.getBest().map(Genotype::getFitness).orElse(0.0));
    }
}
