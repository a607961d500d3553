/**
 * Micrometer metrics export for dispatch jobs.
 *
 * @see bulkdispatch.micrometer.MicrometerMetricsExporter
 */
package bulkdispatch.micrometer;
