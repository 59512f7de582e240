/**
 * JSON-LD export and import.
 */
package ch.eth.sis.rocrate.schema.jsonld;
