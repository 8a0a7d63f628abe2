/**
 * Site-level model: work items, folder categories, folder reports and the aggregated site analysis.
 */
package io.flightqc.domain.site;
