/**
 * Micrometer bridge for mediator dispatch metrics.
 *
 * <p>{@link io.mediator.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.mediator.spi.MetricsExporter} SPI with counters and distribution summaries.
 *
 * @see io.mediator.micrometer.MicrometerMetricsExporter
 */
package io.mediator.micrometer;
