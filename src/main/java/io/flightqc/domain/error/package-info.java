/**
 * Failure taxonomy for remote extraction.
 * <p>Connection and timeout failures are recovered at the narrowest scope (one item, one lease, one
 * folder). Only the initial session failure and the outer analysis timeout reach the caller.</p>
 */
package io.flightqc.domain.error;
