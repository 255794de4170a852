package org.tweann.evolution;

import java.util.List;

import org.tweann.genotype.ConnectionGene;

/**
 * Result of aligning two connection-gene lists by innovation number.
 * <p>
 * A gene present in only one list is <em>excess</em> if its innovation number exceeds the other
 * list's maximum, and <em>disjoint</em> otherwise. Both counts are totals over the two lists, so
 * the alignment of {@code (a, b)} equals that of {@code (b, a)}.
 *
 * @param matching             Number of innovation numbers present in both lists.
 * @param disjoint             Number of disjoint genes in either list.
 * @param excess               Number of excess genes in either list.
 * @param weightDifferenceSum  Sum of {@code |w_a - w_b|} over matching genes, in innovation order.
 */
public record GeneAlignment(int matching, int disjoint, int excess, double weightDifferenceSum) {

    /**
     * Aligns two lists sorted by ascending innovation number.
     */
    public static GeneAlignment align(List<ConnectionGene> a, List<ConnectionGene> b) {
        long maxA = a.isEmpty() ? Long.MIN_VALUE : a.get(a.size() - 1).innovation();
        long maxB = b.isEmpty() ? Long.MIN_VALUE : b.get(b.size() - 1).innovation();

        int matching = 0;
        int disjoint = 0;
        int excess = 0;
        double weightDifferenceSum = 0.0;

        int i = 0;
        int j = 0;
        while (i < a.size() || j < b.size()) {
            if (i < a.size() && j < b.size() && a.get(i).innovation() == b.get(j).innovation()) {
                matching++;
                weightDifferenceSum += Math.abs(a.get(i).weight() - b.get(j).weight());
                i++;
                j++;
            } else if (j >= b.size() || (i < a.size() && a.get(i).innovation() < b.get(j).innovation())) {
                if (a.get(i).innovation() > maxB) excess++; else disjoint++;
                i++;
            } else {
                if (b.get(j).innovation() > maxA) excess++; else disjoint++;
                j++;
            }
        }
        return new GeneAlignment(matching, disjoint, excess, weightDifferenceSum);
    }

    /**
     * Returns the mean absolute weight difference of matching genes, or 0 without matches.
     */
    public double meanWeightDifference() {
        return matching == 0 ? 0.0 : weightDifferenceSum / matching;
    }
}
