package org.tweann.runtime.spi;

/**
 * Consumer function invoked by an actuator actor once per cycle with the reassembled output vector.
 * <p>
 * Invoked only from the owning actuator's thread. A function instance bound to several actuators
 * is invoked from several threads and must be thread-safe.
 */
@FunctionalInterface
public interface IActuatorFunction {

    /**
     * Consumes one output vector.
     *
     * @param vector Outputs of the fan-in neurons in declared fan-in order. Owned by the callee.
     */
    void act(double[] vector);
}
