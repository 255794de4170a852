package org.tweann.evolution;

import java.util.List;
import java.util.Objects;

import org.tweann.genotype.Genotype;

/**
 * A niche of mutually compatible genotypes.
 *
 * @param id                        Species id.
 * @param members                   Ids of the member genotypes, in population order.
 * @param representative            Genotype that new candidates are compared against. It need not
 *                                  be a current member.
 * @param bestFitness               Best raw fitness any member has reached.
 * @param lastImprovementGeneration Generation in which {@code bestFitness} last increased.
 * @param age                       Number of completed generations the species has existed for.
 */
public record Species(String id, List<String> members, Genotype representative, double bestFitness,
                      int lastImprovementGeneration, int age) {

    public Species {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(representative, "representative");
        members = List.copyOf(members);
    }

    /**
     * Creates a species founded by the given genotype.
     */
    public static Species founder(String id, Genotype founder, int generation) {
        return new Species(id, List.of(founder.getId()), founder, Double.NEGATIVE_INFINITY, generation, 0);
    }

    public int size() {
        return members.size();
    }

    public Species withMembers(List<String> newMembers) {
        return new Species(id, newMembers, representative, bestFitness, lastImprovementGeneration, age);
    }

    /**
     * Returns whether the species has gone {@code threshold} or more generations without improving.
     */
    public boolean isStagnant(int generation, int threshold) {
        return generation - lastImprovementGeneration >= threshold;
    }
}
