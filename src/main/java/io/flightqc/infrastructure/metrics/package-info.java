/**
 * OpenTelemetry bridge for {@link io.flightqc.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Instruments are cached in concurrent maps; updates come from extraction workers.</p>
 * <p><strong>Metrics:</strong> Publishes the {@code pool.*}, {@code extract.*} and {@code analysis.*} names.</p>
 */
package io.flightqc.infrastructure.metrics;
