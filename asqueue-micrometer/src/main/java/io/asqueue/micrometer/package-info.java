/**
 * Micrometer integration for queue metrics.
 *
 * @see io.asqueue.micrometer.MicrometerQueueMetrics
 */
package io.asqueue.micrometer;
