package ch.eth.sis.rocrate.schema.graph;

import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import org.apache.jena.graph.Graph;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.Triple;
import org.apache.jena.sparql.graph.GraphFactory;

/**
 * The result of a graph build: duplicate-free triples in emission order,
 * the namespaces their IRIs were minted with and the references that did
 * not resolve.
 */
public final class SchemaGraph {

    private final Set<Triple> triples;

    private final Namespaces namespaces;

    private final List<UnresolvedReference> unresolvedReferences;

    /**
     * Creates a graph.
     *
     * @param triples the triples, in emission order
     * @param namespaces the namespaces
     * @param unresolvedReferences dangling references
     */
    public SchemaGraph(final Set<Triple> triples, final Namespaces namespaces,
            final List<UnresolvedReference> unresolvedReferences) {
        this.triples = Collections.unmodifiableSet(triples);
        this.namespaces = namespaces;
        this.unresolvedReferences = List.copyOf(unresolvedReferences);
    }

    /**
     * Returns the triples in emission order.
     *
     * @return unmodifiable ordered set
     */
    public Set<Triple> getTriples() {
        return triples;
    }

    /**
     * Returns the namespaces the graph's IRIs were minted with.
     *
     * @return the namespaces
     */
    public Namespaces getNamespaces() {
        return namespaces;
    }

    /**
     * Returns the references that matched no entry or Type.
     *
     * @return the dangling references, in emission order
     */
    public List<UnresolvedReference> getUnresolvedReferences() {
        return unresolvedReferences;
    }

    /**
     * Checks whether every local reference resolved.
     *
     * @return true if there are no dangling references
     */
    public boolean isFullyResolved() {
        return unresolvedReferences.isEmpty();
    }

    /**
     * Returns the number of triples.
     *
     * @return the triple count
     */
    public int size() {
        return triples.size();
    }

    /**
     * Returns the distinct subjects in order of first appearance.
     *
     * @return the subjects
     */
    public List<Node> subjects() {
        return triples.stream().map(Triple::getSubject).distinct().toList();
    }

    /**
     * Copies the triples into an in-memory Jena graph.
     *
     * @return a new graph
     */
    public Graph toGraph() {
        Graph graph = GraphFactory.createDefaultGraph();
        triples.forEach(graph::add);
        return graph;
    }

    /**
     * Checks whether this graph and another are isomorphic.
     *
     * @param other the other graph
     * @return true if isomorphic
     */
    public boolean isIsomorphicWith(final SchemaGraph other) {
        return toGraph().isIsomorphicWith(other.toGraph());
    }
}
