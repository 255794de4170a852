package org.tweann.evaluation;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tweann.genotype.Genotype;
import org.tweann.runtime.NetworkFailureException;

/**
 * Evaluates a batch of genotypes in parallel.
 * <p>
 * The batch is split into contiguous chunks across an {@link EvaluationWorkerPool}; each
 * evaluation writes its outcome into its own slot, so evaluations never share state. A genotype
 * whose evaluation throws (evaluator exception, malformed phenotype, network failure or timeout) or
 * yields a non-finite value is recorded with fitness 0 and status {@code FAILED}; the rest of the
 * batch is unaffected.
 * <p>
 * An interrupt of the dispatching thread is not a genotype failure: the batch is abandoned with an
 * {@link EvaluationInterruptedException} and the interrupt flag stays set.
 */
public class FitnessEvaluationDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(FitnessEvaluationDispatcher.class);

    private final IFitnessEvaluator evaluator;
    private final EvaluationWorkerPool pool;
    private final AtomicLong evaluations = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public FitnessEvaluationDispatcher(IFitnessEvaluator evaluator, int parallelism) {
        this(evaluator, new EvaluationWorkerPool(parallelism));
    }

    FitnessEvaluationDispatcher(IFitnessEvaluator evaluator, EvaluationWorkerPool pool) {
        this.evaluator = evaluator;
        this.pool = pool;
    }

    /**
     * Evaluates every genotype in the list.
     *
     * @param genotypes Genotypes to evaluate.
     * @return One outcome per genotype, in input order.
     * @throws EvaluationInterruptedException if the calling thread is interrupted before every
     *                                        outcome is in.
     */
    public List<EvaluationOutcome> evaluateAll(List<Genotype> genotypes) {
        EvaluationOutcome[] slots = new EvaluationOutcome[genotypes.size()];
        pool.dispatch(genotypes.size(), (from, to) -> {
            for (int i = from; i < to; i++) {
                slots[i] = evaluateOne(genotypes.get(i));
            }
        });
        if (Thread.currentThread().isInterrupted()) {
            throw new EvaluationInterruptedException("Interrupted while evaluating " + genotypes.size() + " genotypes");
        }
        List<EvaluationOutcome> outcomes = new ArrayList<>(slots.length);
        for (EvaluationOutcome outcome : slots) {
            outcomes.add(outcome);
        }
        return outcomes;
    }

    EvaluationOutcome evaluateOne(Genotype genotype) {
        if (Thread.currentThread().isInterrupted()) {
            throw new EvaluationInterruptedException("Interrupted before evaluating genotype " + genotype.getId());
        }
        evaluations.incrementAndGet();
        try {
            double fitness = evaluator.evaluate(genotype);
            if (!Double.isFinite(fitness)) {
                return recordFailure(genotype, "evaluator returned " + fitness, null);
            }
            return EvaluationOutcome.success(genotype.getId(), fitness);
        } catch (NetworkFailureException | RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new EvaluationInterruptedException("Interrupted while evaluating genotype " + genotype.getId(), e);
            }
            return recordFailure(genotype, e.getMessage(), e);
        }
    }

    private EvaluationOutcome recordFailure(Genotype genotype, String reason, Exception cause) {
        failures.incrementAndGet();
        log.warn("Evaluation of genotype {} failed: {}", genotype.getId(), reason);
        if (cause != null) {
            log.debug("Evaluation failure details for genotype {}", genotype.getId(), cause);
        }
        return EvaluationOutcome.failure(genotype.getId(), reason);
    }

    public long getEvaluationCount() {
        return evaluations.get();
    }

    public long getFailureCount() {
        return failures.get();
    }

    @Override
    public void close() {
        pool.shutdown();
    }
}
