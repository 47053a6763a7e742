/**
 * Core value types for moving-object detection: source records, per-image metadata, candidates,
 * segments and tracks.
 * <p><strong>Role:</strong> Domain layer with no infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across worker threads.</p>
 * <p><strong>Units:</strong> Sky coordinates are degrees on input; every distance produced by
 * {@link org.atrack.domain.SkyGeometry} is in radians.</p>
 */
package org.atrack.domain;
