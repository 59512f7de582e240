/**
 * Mapping of typed data models onto RO-Crate schema graphs and back.
 *
 * <p>{@link ch.eth.sis.rocrate.schema.SchemaFacade} is the entry point for
 * a session; the subpackages hold the model, the registry, the resolver,
 * the graph builder, the JSON-LD codec and validation.</p>
 */
package ch.eth.sis.rocrate.schema;
