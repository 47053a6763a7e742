/**
 * Ports implemented by infrastructure adapters: catalog input, intermediate segment exchange, result sinks
 * and metrics.
 */
package org.atrack.application.port;
