package org.tweann.genotype.io;

/**
 * Thrown when a genotype record stream cannot be decoded into valid genotypes.
 */
public class GenotypeFormatException extends Exception {

    public GenotypeFormatException(String message) {
        super(message);
    }

    public GenotypeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
