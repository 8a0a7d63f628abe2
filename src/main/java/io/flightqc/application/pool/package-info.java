/**
 * <strong>Purpose:</strong> Connection pooling for remote file-transfer sessions.
 * <p><strong>Concurrency:</strong> The pool's free queue is the only state shared between extraction workers;
 * every lease is held by exactly one worker until it is released or discarded.</p>
 * <p><strong>Lifecycle:</strong> pools live in a {@link io.flightqc.application.pool.ConnectionPoolCache} owned by
 * one site analysis and are closed when that analysis ends.</p>
 *
 * @since 0.1.0
 */
package io.flightqc.application.pool;
