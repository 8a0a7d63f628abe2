/**
 * SFTP transport built on JSch: one SSH session and one SFTP channel per {@link io.flightqc.application.port.RemoteSession}.
 */
package io.flightqc.infrastructure.sftp;
