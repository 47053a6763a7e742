/**
 * Runtime logging controls for the CLI. Log configuration itself lives in {@code logback.xml}.
 */
package org.atrack.logging;
