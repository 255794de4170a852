package org.tweann.evaluation;

import org.tweann.genotype.Genotype;

/**
 * Result of evaluating one genotype.
 *
 * @param genotypeId    Id of the evaluated genotype.
 * @param fitness       Fitness, 0 for failed evaluations.
 * @param status        {@code EVALUATED} or {@code FAILED}.
 * @param failureReason Why the evaluation failed, {@code null} on success.
 */
public record EvaluationOutcome(String genotypeId, double fitness, Genotype.EvaluationStatus status,
                                String failureReason) {

    public static EvaluationOutcome success(String genotypeId, double fitness) {
        return new EvaluationOutcome(genotypeId, fitness, Genotype.EvaluationStatus.EVALUATED, null);
    }

    public static EvaluationOutcome failure(String genotypeId, String reason) {
        return new EvaluationOutcome(genotypeId, 0.0, Genotype.EvaluationStatus.FAILED, reason);
    }

    public boolean isFailed() {
        return status == Genotype.EvaluationStatus.FAILED;
    }

    /**
     * Returns the genotype with this outcome's fitness and status recorded.
     */
    public Genotype applyTo(Genotype genotype) {
        return genotype.withFitness(fitness, status);
    }
}
