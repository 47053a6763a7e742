/**
 * Configuration records, YAML loading and precedence merging for the A-Track command-line tools.
 * <p><strong>Precedence:</strong> CLI {@code key=value} arguments override YAML values, which override the
 * embedded defaults from {@link org.atrack.config.DefaultsForMode}.</p>
 */
package org.atrack.config;
