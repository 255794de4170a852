package org.tweann.runtime.spi;

/**
 * Signal-generating function invoked by a sensor actor on every sample request.
 * <p>
 * Invoked only from the owning sensor's thread. A function instance bound to several sensors is
 * invoked from several threads and must be thread-safe.
 */
@FunctionalInterface
public interface ISensorFunction {

    /**
     * Produces the next signal vector.
     *
     * @param vectorLength Declared length of the sensor's vector.
     * @return A vector of exactly {@code vectorLength} elements.
     */
    double[] sense(int vectorLength);
}
