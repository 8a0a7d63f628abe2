/**
 * Command-line surface of FlightQC: the {@link io.flightqc.api.Main} dispatcher and the {@code analyze} command.
 * <p>Arguments are {@code key=value} pairs plus bare flags; exit codes are listed in
 * {@link io.flightqc.api.ExitCode}.</p>
 */
package io.flightqc.api;
