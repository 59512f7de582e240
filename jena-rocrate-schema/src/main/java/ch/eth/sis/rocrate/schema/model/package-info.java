/**
 * Schema and instance model: {@link ch.eth.sis.rocrate.schema.model.Type},
 * {@link ch.eth.sis.rocrate.schema.model.TypeProperty},
 * {@link ch.eth.sis.rocrate.schema.model.Restriction} and
 * {@link ch.eth.sis.rocrate.schema.model.MetadataEntry}. Each element
 * emits its own Jena triples.
 */
package ch.eth.sis.rocrate.schema.model;
