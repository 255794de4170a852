package org.tweann.evolution.mutation;

import org.tweann.genotype.Genotype;

/**
 * A single kind of genotype mutation.
 * <p>
 * Implementations are instantiated with the signature
 * {@code (IRandomProvider rng, com.typesafe.config.Config options)} and read their rates from
 * {@code options}. Each operator applies its own probability gate: a call may return the input
 * unchanged.
 * <p>
 * Operators are not thread-safe; they draw from the random stream they were created with.
 */
public interface IMutationOperator {

    /**
     * Possibly mutates the genotype.
     *
     * @param genotype The genotype to mutate.
     * @return A mutated copy, or {@code genotype} itself if nothing changed.
     */
    Genotype mutate(Genotype genotype);
}
