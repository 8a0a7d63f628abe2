/** Small formatting helpers shared by the scene builder and the report writers. */
package io.flightqc.application.util;
