package org.tweann.genotype;

import java.util.List;
import java.util.Objects;

/**
 * Describes an actuator carried by a genotype.
 * <p>
 * The fan-in list holds the actuator-adjacent neurons in the order their outputs are reassembled
 * into the actuation vector. It is fixed when the genotype is constructed; structural mutations
 * grow the network upstream of these neurons.
 *
 * @param id           Node id of the actuator.
 * @param function     Name of the consumer function the actuator invokes.
 * @param vectorLength Length of the actuation vector.
 * @param fanIn        Ordered ids of the neurons feeding the actuator.
 */
public record ActuatorRef(String id, String function, int vectorLength, List<String> fanIn) {

    public ActuatorRef {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(function, "function");
        fanIn = List.copyOf(fanIn);
        if (vectorLength <= 0) {
            throw new IllegalArgumentException("Actuator '" + id + "' vectorLength must be positive, got: " + vectorLength);
        }
    }
}
