/**
 * JSON output of a finished analysis: the site summary and the Plotly figure, both written with Jackson's
 * streaming generator.
 */
package io.flightqc.infrastructure.report;
