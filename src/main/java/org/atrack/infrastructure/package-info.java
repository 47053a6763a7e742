/**
 * Adapters for catalog files, frame manifests, intermediate segment batches, result files, worker pools and
 * OpenTelemetry metrics.
 */
package org.atrack.infrastructure;
