/**
 * Explicit cardinality validation of entries against their Types.
 */
package ch.eth.sis.rocrate.schema.validation;
