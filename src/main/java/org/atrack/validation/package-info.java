/**
 * Argument validation helpers shared by configuration records and CLI adapters.
 * <p>Every helper throws {@link java.lang.IllegalArgumentException} naming the offending key so the CLI can
 * report it verbatim.</p>
 */
package org.atrack.validation;
