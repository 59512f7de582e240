package ch.eth.sis.rocrate.schema.jsonld;

import ch.eth.sis.rocrate.schema.MalformedDocumentException;
import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The parts of a JSON-LD {@code @context} needed to expand the keys and
 * ids of an imported document: prefixes, term definitions and
 * {@code @vocab}. Remote contexts are not fetched.
 */
final class JsonLdContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        JsonLdContext.class);

    private final Map<String, String> prefixes = new LinkedHashMap<>(
        Namespaces.wellKnownPrefixes());

    private final Map<String, String> terms = new HashMap<>();

    private final Set<String> referenceTerms = new HashSet<>();

    private final String fallbackBase;

    private String vocab;

    private JsonLdContext(final String base) {
        this.fallbackBase = base;
    }

    /**
     * Parses a context value: an object, an array of objects and strings,
     * a string, or null.
     *
     * @param context the context value
     * @param base namespace relative ids resolve against
     * @return the parsed context
     */
    static JsonLdContext parse(final JsonNode context, final String base) {
        JsonLdContext parsed = new JsonLdContext(base);
        if (context == null || context.isNull()) {
            return parsed;
        }
        if (context.isArray()) {
            for (JsonNode element : context) {
                parsed.merge(element);
            }
        } else {
            parsed.merge(context);
        }
        return parsed;
    }

    private void merge(final JsonNode context) {
        if (context.isTextual()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Ignoring remote context {}", context.asText());
            }
            return;
        }
        if (!context.isObject()) {
            throw new MalformedDocumentException("Invalid @context entry",
                context.toString());
        }
        Map<String, JsonNode> definitions = new LinkedHashMap<>();
        for (Iterator<Map.Entry<String, JsonNode>> it = context.fields(); it.hasNext();) {
            Map.Entry<String, JsonNode> e = it.next();
            if ("@vocab".equals(e.getKey())) {
                vocab = e.getValue().isTextual() ? e.getValue().asText() : null;
            } else if (e.getValue().isTextual()) {
                String value = e.getValue().asText();
                if (value.endsWith("/") || value.endsWith("#")) {
                    prefixes.put(e.getKey(), value);
                }
                definitions.put(e.getKey(), e.getValue());
            } else if (e.getValue().isObject()) {
                definitions.put(e.getKey(), e.getValue());
            }
        }
        // terms may use prefixes defined later in the same object
        for (Map.Entry<String, JsonNode> e : definitions.entrySet()) {
            JsonNode definition = e.getValue();
            if (definition.isTextual()) {
                terms.put(e.getKey(), expandPrefixed(definition.asText()));
            } else {
                JsonNode id = definition.get("@id");
                if (id != null && id.isTextual()) {
                    terms.put(e.getKey(), expandPrefixed(id.asText()));
                }
                JsonNode type = definition.get("@type");
                if (type != null && "@id".equals(type.asText())) {
                    referenceTerms.add(e.getKey());
                }
            }
        }
    }

    /**
     * Returns the namespace bound to a prefix.
     *
     * @param prefix the prefix
     * @return the namespace, or null
     */
    String prefix(final String prefix) {
        return prefixes.get(prefix);
    }

    /**
     * Checks whether a key is defined with {@code "@type": "@id"}.
     *
     * @param key the key
     * @return true if string values of the key are ids
     */
    boolean isReferenceTerm(final String key) {
        return referenceTerms.contains(key);
    }

    /**
     * Expands a key or a type name: terms, then compact ids, then
     * {@code @vocab}, then the base namespace.
     *
     * @param value the key or type name
     * @return the IRI
     */
    String expandVocab(final String value) {
        if (value.startsWith("@") || Namespaces.isBlank(value)) {
            return value;
        }
        String term = terms.get(value);
        if (term != null) {
            return term;
        }
        if (value.indexOf(':') > 0 || Namespaces.isAbsolute(value)) {
            return expandPrefixed(value);
        }
        return (vocab != null ? vocab : fallbackBase) + value;
    }

    /**
     * Expands a node id: compact ids and absolute IRIs, then the base
     * namespace.
     *
     * @param value the id
     * @return the IRI
     */
    String expandId(final String value) {
        if (Namespaces.isBlank(value)) {
            return value;
        }
        if (value.indexOf(':') > 0 || Namespaces.isAbsolute(value)) {
            return expandPrefixed(value);
        }
        return fallbackBase + value;
    }

    private String expandPrefixed(final String value) {
        if (Namespaces.isAbsolute(value)) {
            return value;
        }
        int colon = value.indexOf(':');
        if (colon > 0) {
            String ns = prefixes.get(value.substring(0, colon));
            if (ns != null) {
                return ns + value.substring(colon + 1);
            }
        }
        return value;
    }
}
