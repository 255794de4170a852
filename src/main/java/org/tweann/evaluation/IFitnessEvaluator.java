package org.tweann.evaluation;

import org.tweann.genotype.Genotype;
import org.tweann.runtime.NetworkFailureException;

/**
 * Assigns a scalar fitness to a genotype, typically by running its phenotype through an episode.
 * <p>
 * Implementations are instantiated by class name with the signature
 * {@code (IRandomProvider rng, com.typesafe.config.Config options)}. One instance evaluates many
 * genotypes concurrently, so {@link #evaluate(Genotype)} must be thread-safe and must keep all
 * per-episode state local to the call.
 */
public interface IFitnessEvaluator {

    /**
     * Evaluates one genotype. Higher is better.
     *
     * @param genotype The genotype to evaluate.
     * @return A finite fitness value.
     * @throws NetworkFailureException if the phenotype failed or did not finish in time.
     */
    double evaluate(Genotype genotype) throws NetworkFailureException;
}
