/**
 * Geographic value types: decoded fixes, attributed extraction results, classified points and the bounds used to
 * classify them.
 */
package io.flightqc.domain.geo;
