package io.flightqc.domain.scene;

/** Camera eye position in normalised scene coordinates. */
public record Camera(double eyeX, double eyeY, double eyeZ) {
}
