package org.tweann.runtime.functions;

import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tweann.runtime.spi.IActuatorFunction;

/**
 * Logs every output vector it receives.
 */
public class LoggingActuator implements IActuatorFunction {

    private static final Logger log = LoggerFactory.getLogger(LoggingActuator.class);

    private final String label;

    public LoggingActuator(String label) {
        this.label = label;
    }

    @Override
    public void act(double[] vector) {
        log.info("{}: {}", label, Arrays.toString(vector));
    }
}
