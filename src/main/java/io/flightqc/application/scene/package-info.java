/**
 * Builds declarative 3D flight-path scenes from classified geotags. Rendering is left to the consumer of the
 * serialized scene.
 */
package io.flightqc.application.scene;
