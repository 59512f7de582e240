package ch.eth.sis.rocrate.schema.model;

import java.util.Objects;

/**
 * A literal kept as lexical form plus datatype IRI, used for datatypes that
 * have no Java value kind of their own (or lexical forms that do not parse),
 * so that they survive an import/export cycle unchanged.
 *
 * @param lexicalForm the lexical form
 * @param datatypeIri the full datatype IRI
 */
public record TypedValue(String lexicalForm, String datatypeIri) {

    /**
     * Validates the components.
     *
     * @param lexicalForm the lexical form
     * @param datatypeIri the full datatype IRI
     */
    public TypedValue {
        Objects.requireNonNull(lexicalForm, "lexicalForm");
        Objects.requireNonNull(datatypeIri, "datatypeIri");
    }
}
