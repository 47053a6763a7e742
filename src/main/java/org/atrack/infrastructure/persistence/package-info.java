/**
 * File and in-memory adapters for candidates, segment batches, tracks and the generated master catalog.
 *
 * <p>JSON documents are written and read with the Jackson streaming API; every NDJSON line carries
 * {@code schemaVersion}.</p>
 */
package org.atrack.infrastructure.persistence;
