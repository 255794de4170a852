package org.tweann.orchestration;

/**
 * Receives a callback on the service thread after every completed generation.
 */
@FunctionalInterface
public interface IProgressListener {

    /**
     * @param generation  The generation that was just evaluated.
     * @param bestFitness Best raw fitness of that generation.
     * @param statistics  Statistics of the run so far.
     */
    void onGeneration(int generation, double bestFitness, EvolutionStatistics statistics);
}
