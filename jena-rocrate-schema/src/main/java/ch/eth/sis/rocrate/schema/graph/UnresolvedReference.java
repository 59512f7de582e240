package ch.eth.sis.rocrate.schema.graph;

/**
 * A reference from an entry to a local id that is neither an entry nor a
 * Type. The triple is still part of the graph.
 *
 * @param entryId the referencing entry
 * @param referenceName the property holding the reference
 * @param targetId the id that did not resolve
 */
public record UnresolvedReference(String entryId, String referenceName,
        String targetId) {
}
