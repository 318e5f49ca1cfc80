package io.mediator.micrometer;

import io.mediator.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code mediator.send.success} requests answered by their handler</li>
 *   <li>{@code mediator.send.failure} requests whose handler or interceptor failed</li>
 *   <li>{@code mediator.send.unhandled} requests with no usable handler</li>
 *   <li>{@code mediator.publish.success} notifications delivered to all handlers</li>
 *   <li>{@code mediator.publish.failure} notifications with at least one failed handler</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code mediator.handler.duration.ms} time per handler invocation</li>
 *   <li>{@code mediator.publish.fanout} handlers resolved per notification</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter sendSuccess;
    private final Counter sendFailure;
    private final Counter sendUnhandled;
    private final Counter publishSuccess;
    private final Counter publishFailure;
    private final DistributionSummary handlerDuration;
    private final DistributionSummary publishFanOut;
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "mediator"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "mediator");
    }

    /**
     * Creates an exporter with a custom metric name prefix, for applications running
     * more than one mediator.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "billing.mediator"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.sendSuccess = Counter.builder(namePrefix + ".send.success")
                .description("Requests answered by their handler")
                .register(registry);
        this.sendFailure = Counter.builder(namePrefix + ".send.failure")
                .description("Requests whose handler or interceptor failed")
                .register(registry);
        this.sendUnhandled = Counter.builder(namePrefix + ".send.unhandled")
                .description("Requests without a usable handler")
                .register(registry);
        this.publishSuccess = Counter.builder(namePrefix + ".publish.success")
                .description("Notifications delivered to every handler")
                .register(registry);
        this.publishFailure = Counter.builder(namePrefix + ".publish.failure")
                .description("Notifications with at least one failed handler")
                .register(registry);

        this.handlerDuration = DistributionSummary.builder(namePrefix + ".handler.duration.ms")
                .description("Handler execution time in milliseconds")
                .baseUnit("milliseconds")
                .register(registry);
        this.publishFanOut = DistributionSummary.builder(namePrefix + ".publish.fanout")
                .description("Handlers resolved per published notification")
                .register(registry);
    }

    @Override
    public void incrementSendSuccess() {
        if (closed) return;
        sendSuccess.increment();
    }

    @Override
    public void incrementSendFailure() {
        if (closed) return;
        sendFailure.increment();
    }

    @Override
    public void incrementSendUnhandled() {
        if (closed) return;
        sendUnhandled.increment();
    }

    @Override
    public void incrementPublishSuccess() {
        if (closed) return;
        publishSuccess.increment();
    }

    @Override
    public void incrementPublishFailure() {
        if (closed) return;
        publishFailure.increment();
    }

    @Override
    public void recordHandlerDurationMs(long durationMs) {
        if (closed) return;
        handlerDuration.record(durationMs);
    }

    @Override
    public void recordPublishFanOut(int handlerCount) {
        if (closed) return;
        publishFanOut.record(handlerCount);
    }

    /**
     * Removes the meters registered by this exporter. Later calls are ignored.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(sendSuccess, sendFailure, sendUnhandled,
                publishSuccess, publishFailure, handlerDuration, publishFanOut)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
