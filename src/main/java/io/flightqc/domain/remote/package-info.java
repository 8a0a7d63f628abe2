/**
 * Value types exchanged with the remote file-transfer collaborator: credentials, listing entries
 * and path helpers.
 */
package io.flightqc.domain.remote;
