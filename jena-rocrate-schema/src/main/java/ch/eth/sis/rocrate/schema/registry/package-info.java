/**
 * Registration of schema elements and conversion of structural field
 * descriptions into Types.
 */
package ch.eth.sis.rocrate.schema.registry;
