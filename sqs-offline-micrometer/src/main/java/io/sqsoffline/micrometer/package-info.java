/**
 * Micrometer bridge for exporting delivery metrics to Prometheus, Grafana, and other backends.
 *
 * <p>{@link io.sqsoffline.micrometer.MicrometerMetricsExporter} implements the
 * {@link io.sqsoffline.spi.MetricsExporter} SPI with per-queue counters and a handler timer.
 *
 * @see io.sqsoffline.micrometer.MicrometerMetricsExporter
 */
package io.sqsoffline.micrometer;
