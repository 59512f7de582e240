/**
 * OpenTelemetry span helpers.
 */
package ch.eth.sis.rocrate.schema.tracing;
