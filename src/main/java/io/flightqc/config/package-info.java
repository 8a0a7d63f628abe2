/**
 * Configuration loading and wiring for the FlightQC CLI.
 * <p><strong>Precedence:</strong> CLI {@code key=value} arguments, then the YAML file named by {@code config=},
 * then {@link io.flightqc.config.DefaultsForMode}.</p>
 * <p><strong>Security:</strong> passwords are never read from arguments or files, only from the environment
 * variable named by {@code secretEnv}.</p>
 */
package io.flightqc.config;
