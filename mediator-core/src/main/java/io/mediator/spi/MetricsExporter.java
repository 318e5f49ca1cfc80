package io.mediator.spi;

/**
 * Observability hook for exporting dispatch counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. See the
 * {@code mediator-micrometer} module for a Micrometer bridge.
 */
public interface MetricsExporter {

    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of requests whose handler completed successfully.
     */
    void incrementSendSuccess();

    /**
     * Increments the count of requests whose handler (or a before-interceptor) failed.
     */
    void incrementSendFailure();

    /**
     * Increments the count of requests that could not be routed: no handler, an
     * ambiguous registration, or a resolution failure.
     */
    void incrementSendUnhandled();

    /**
     * Increments the count of notifications whose handlers all completed.
     */
    void incrementPublishSuccess();

    /**
     * Increments the count of notifications with at least one failed handler.
     */
    void incrementPublishFailure();

    /**
     * Records how long a single handler invocation took.
     *
     * @param durationMs elapsed time in milliseconds, never negative
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Records how many handlers a notification was delivered to.
     *
     * @param handlerCount number of resolved handlers
     */
    default void recordPublishFanOut(int handlerCount) {
    }

    final class Noop implements MetricsExporter {
        @Override
        public void incrementSendSuccess() {
        }

        @Override
        public void incrementSendFailure() {
        }

        @Override
        public void incrementSendUnhandled() {
        }

        @Override
        public void incrementPublishSuccess() {
        }

        @Override
        public void incrementPublishFailure() {
        }
    }
}
