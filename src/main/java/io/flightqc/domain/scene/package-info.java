/**
 * Declarative 3D scene model produced by the scene builder and serialized by the report writers.
 */
package io.flightqc.domain.scene;
