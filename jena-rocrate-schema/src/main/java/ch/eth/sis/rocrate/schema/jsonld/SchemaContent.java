package ch.eth.sis.rocrate.schema.jsonld;

import ch.eth.sis.rocrate.schema.model.MetadataEntry;
import ch.eth.sis.rocrate.schema.model.Restriction;
import ch.eth.sis.rocrate.schema.model.Type;
import ch.eth.sis.rocrate.schema.model.TypeProperty;
import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import java.util.List;

/**
 * The schema elements and entries read from a document. Properties and
 * restrictions are the standalone ones; those owned by a Type are reached
 * through it.
 *
 * @param types the Types, in document order
 * @param properties standalone properties
 * @param restrictions standalone restrictions
 * @param entries the entries, in document order
 * @param namespaces the namespaces ids were shortened with
 */
public record SchemaContent(List<Type> types, List<TypeProperty> properties,
        List<Restriction> restrictions, List<MetadataEntry> entries,
        Namespaces namespaces) {

    /**
     * Copies the lists.
     */
    public SchemaContent {
        types = List.copyOf(types);
        properties = List.copyOf(properties);
        restrictions = List.copyOf(restrictions);
        entries = List.copyOf(entries);
    }
}
