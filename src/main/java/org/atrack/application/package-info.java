/**
 * Application layer: detection use cases and the ports they depend on.
 * <p><strong>Role:</strong> Orchestrates candidate filtering, segment search, merging and classification
 * without knowing how catalogs are stored or where results go.</p>
 */
package org.atrack.application;
