/**
 * Interquartile outlier classification of a site's geotags.
 */
package io.flightqc.application.classify;
