/**
 * Executor construction for extraction workers and blocking remote reads.
 */
package io.flightqc.infrastructure.exec;
