package org.tweann.genotype;

import java.util.Objects;

/**
 * Describes a sensor carried by a genotype.
 *
 * @param id           Node id of the sensor.
 * @param function     Name of the signal function the sensor samples.
 * @param vectorLength Length of the vector produced per sample.
 */
public record SensorRef(String id, String function, int vectorLength) {

    public SensorRef {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(function, "function");
        if (vectorLength <= 0) {
            throw new IllegalArgumentException("Sensor '" + id + "' vectorLength must be positive, got: " + vectorLength);
        }
    }
}
