package org.tweann.evolution;

import com.typesafe.config.Config;
import org.tweann.genotype.Genotype;

/**
 * NEAT compatibility distance {@code c1*E/N + c2*D/N + c3*W}.
 * <p>
 * {@code E} and {@code D} are the excess and disjoint gene counts, {@code W} the mean absolute
 * weight difference of matching genes and {@code N} the larger connection-gene count of the two
 * genotypes, or 1 when that count is below {@code normalization-threshold}.
 */
public class CompatibilityDistance {

    private final double c1;
    private final double c2;
    private final double c3;
    private final int normalizationThreshold;

    /**
     * Creates the metric from configuration.
     *
     * @param options Configuration with optional {@code c1}, {@code c2}, {@code c3} and
     *                {@code normalization-threshold}.
     */
    public CompatibilityDistance(Config options) {
        this(options.hasPath("c1") ? options.getDouble("c1") : 1.0,
                options.hasPath("c2") ? options.getDouble("c2") : 1.0,
                options.hasPath("c3") ? options.getDouble("c3") : 0.4,
                options.hasPath("normalization-threshold") ? options.getInt("normalization-threshold") : 20);
    }

    public CompatibilityDistance(double c1, double c2, double c3, int normalizationThreshold) {
        if (c1 < 0.0 || c2 < 0.0 || c3 < 0.0) {
            throw new IllegalArgumentException("Distance coefficients must be non-negative, got: c1=" + c1
                    + ", c2=" + c2 + ", c3=" + c3);
        }
        this.c1 = c1;
        this.c2 = c2;
        this.c3 = c3;
        this.normalizationThreshold = normalizationThreshold;
    }

    public double distance(Genotype a, Genotype b) {
        GeneAlignment alignment = GeneAlignment.align(a.getConnections(), b.getConnections());
        int larger = Math.max(a.getConnections().size(), b.getConnections().size());
        double n = larger < normalizationThreshold ? 1.0 : larger;
        return c1 * alignment.excess() / n
                + c2 * alignment.disjoint() / n
                + c3 * alignment.meanWeightDifference();
    }
}
