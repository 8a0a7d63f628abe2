/**
 * <strong>Purpose:</strong> Ports that the extraction pipeline depends on: remote sessions, geotag decoding and
 * metrics.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package io.flightqc.application.port;
