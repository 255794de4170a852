package org.tweann.evaluation;

/**
 * Thrown when the thread dispatching a batch is interrupted. No outcome of the batch is reported;
 * the genotypes stay unevaluated.
 */
public class EvaluationInterruptedException extends RuntimeException {

    public EvaluationInterruptedException(String message) {
        super(message);
    }

    public EvaluationInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
