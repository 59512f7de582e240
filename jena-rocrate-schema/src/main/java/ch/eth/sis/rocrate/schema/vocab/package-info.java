/**
 * Vocabulary constants and the id/IRI mapping shared by the graph builder
 * and the JSON-LD codec.
 */
package ch.eth.sis.rocrate.schema.vocab;
