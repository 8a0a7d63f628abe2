/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity, redact secrets and carry MDC context onto
 * worker threads.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Security:</strong> Provides redaction helpers so session secrets never reach log output.
 *
 * @since 0.1.0
 */
package io.flightqc.logging;
