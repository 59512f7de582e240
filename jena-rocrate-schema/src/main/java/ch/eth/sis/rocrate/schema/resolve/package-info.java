/**
 * Flattening of cyclic instance graphs into metadata entries.
 */
package ch.eth.sis.rocrate.schema.resolve;
