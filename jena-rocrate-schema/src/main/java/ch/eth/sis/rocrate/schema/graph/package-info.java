/**
 * Graph building: schema and instance triples merged into one
 * deterministically ordered graph.
 */
package ch.eth.sis.rocrate.schema.graph;
