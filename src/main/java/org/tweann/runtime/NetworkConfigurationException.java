package org.tweann.runtime;

/**
 * Thrown when a network cannot be built: unknown functions, dangling ids, empty fan-in lists or a
 * malformed genotype. The network is never started.
 */
public class NetworkConfigurationException extends RuntimeException {

    public NetworkConfigurationException(String message) {
        super(message);
    }

    public NetworkConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
