/**
 * Detection pipeline stages and the use case that runs them.
 * <p><strong>Order:</strong> candidate filtering, then triplet partitioning and segment detection, then merging,
 * then classification. Each phase completes system-wide before the next starts.</p>
 * <p><strong>Concurrency:</strong> Stage classes are stateless apart from their immutable configuration and may be
 * shared across worker threads; {@link org.atrack.application.pipeline.DetectionUseCase} owns the worker pools.</p>
 */
package org.atrack.application.pipeline;
