/**
 * Command-line entry points: the {@code atrack} dispatcher and the {@code candidates} and {@code detect} commands.
 *
 * <p>Arguments are flat {@code key=value} pairs plus {@code --flags}. Every command resolves its configuration as
 * CLI over YAML ({@code config=PATH}) over built-in defaults and reports failures through {@link ExitCode}.</p>
 */
package org.atrack.api;
