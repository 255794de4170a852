package org.tweann.orchestration.api;

import java.util.List;
import java.util.Map;

/**
 * A component that exposes health, metrics and its recent operational errors.
 */
public interface IMonitorable {

    /**
     * Returns a snapshot of the component's metrics.
     *
     * @return Metric names mapped to their current values, in a stable order.
     */
    Map<String, Number> getMetrics();

    /**
     * Returns the recorded operational errors, oldest first.
     */
    List<OperationalError> getErrors();

    void clearErrors();

    /**
     * @return {@code true} if the component is working and has recorded no errors.
     */
    boolean isHealthy();
}
