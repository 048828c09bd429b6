/**
 * Micrometer bridge for the dispatch and flow metrics.
 *
 * @see mailflow.micrometer.MicrometerMetricsExporter
 */
package mailflow.micrometer;
