package org.ascenoria.service;

import java.util.List;
import java.util.Map;

/**
 * A component that exposes metrics, recovered errors and a health flag.
 */
public interface IMonitorable {

    /**
     * @return Metric name (e.g. {@code reloads_published}) to current value.
     */
    Map<String, Number> getMetrics();

    /**
     * @return Recovered errors, oldest first, until {@link #clearErrors()} is called.
     */
    List<OperationalError> getErrors();

    void clearErrors();

    /**
     * @return {@code true} if the component is running without recorded errors.
     */
    boolean isHealthy();
}
