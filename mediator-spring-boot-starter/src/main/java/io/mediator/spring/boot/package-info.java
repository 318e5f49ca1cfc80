/**
 * Spring Boot auto-configuration for the mediator.
 *
 * <p>{@link io.mediator.spring.boot.MediatorAutoConfiguration} exposes a
 * {@link io.mediator.Mediator} bean backed by the application context, configured from
 * {@code mediator.*} properties. {@link io.mediator.spring.boot.MediatorMicrometerAutoConfiguration}
 * adds Micrometer metrics when a {@code MeterRegistry} is present.
 *
 * @see io.mediator.spring.boot.MediatorAutoConfiguration
 * @see io.mediator.spring.boot.MediatorProperties
 */
package io.mediator.spring.boot;
