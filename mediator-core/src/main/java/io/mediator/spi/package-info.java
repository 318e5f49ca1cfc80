/**
 * Service Provider Interfaces through which the mediator reaches its environment.
 *
 * <p>Handler resolution is split in two: {@link io.mediator.spi.SingleInstanceFactory}
 * for request handlers and {@link io.mediator.spi.MultiInstanceFactory} for notification
 * handlers. {@link io.mediator.spi.MetricsExporter} receives dispatch counters.
 *
 * @see io.mediator.spi.SingleInstanceFactory
 * @see io.mediator.spi.MultiInstanceFactory
 * @see io.mediator.spi.MetricsExporter
 */
package io.mediator.spi;
