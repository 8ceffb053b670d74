/**
 * Micrometer bridge for exporting dbkit metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.dbkit.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.dbkit.spi.MetricsExporter} SPI using Micrometer counters and a timer.
 *
 * @see io.dbkit.micrometer.MicrometerMetricsExporter
 */
package io.dbkit.micrometer;
