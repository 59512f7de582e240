package ch.eth.sis.rocrate.schema;

import ch.eth.sis.rocrate.schema.graph.GraphBuilder;
import ch.eth.sis.rocrate.schema.graph.SchemaGraph;
import ch.eth.sis.rocrate.schema.jsonld.JsonLdCodec;
import ch.eth.sis.rocrate.schema.jsonld.SchemaContent;
import ch.eth.sis.rocrate.schema.model.MetadataEntry;
import ch.eth.sis.rocrate.schema.model.Restriction;
import ch.eth.sis.rocrate.schema.model.Type;
import ch.eth.sis.rocrate.schema.model.TypeProperty;
import ch.eth.sis.rocrate.schema.registry.SchemaRegistry;
import ch.eth.sis.rocrate.schema.registry.TypeTemplate;
import ch.eth.sis.rocrate.schema.resolve.CycleResolver;
import ch.eth.sis.rocrate.schema.resolve.EntryMaterializer;
import ch.eth.sis.rocrate.schema.resolve.Instance;
import ch.eth.sis.rocrate.schema.validation.CardinalityValidator;
import ch.eth.sis.rocrate.schema.validation.ValidationReport;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One schema session: a registry of Types, the entries added so far and the
 * settings used to export them.
 *
 * <pre>{@code
 * SchemaFacade facade = new SchemaFacade();
 * facade.addType(TypeTemplate.from(Person.class, new ReflectiveModelIntrospector()));
 * facade.addInstance(sarah);
 * String json = facade.toJson();
 *
 * SchemaFacade copy = SchemaFacade.fromJson(json);
 * }</pre>
 *
 * <p>Not thread-safe.</p>
 */
public final class SchemaFacade {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        SchemaFacade.class);

    private final SchemaSettings settings;

    private final SchemaRegistry registry;

    private final Map<String, MetadataEntry> entries = new LinkedHashMap<>();

    private final CycleResolver resolver = new CycleResolver();

    private final JsonLdCodec codec;

    /**
     * Creates an empty session with default settings.
     */
    public SchemaFacade() {
        this(SchemaSettings.defaults());
    }

    /**
     * Creates an empty session.
     *
     * @param settings the settings
     */
    public SchemaFacade(final SchemaSettings settings) {
        this(settings, new SchemaRegistry());
    }

    /**
     * Creates a session around an existing registry.
     *
     * @param settings the settings
     * @param registry the registry
     */
    public SchemaFacade(final SchemaSettings settings, final SchemaRegistry registry) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = new JsonLdCodec(settings);
    }

    /**
     * Returns the settings used to export this session.
     *
     * @return the settings
     */
    public SchemaSettings getSettings() {
        return settings;
    }

    /**
     * Returns the registry holding this session's Types.
     *
     * @return the registry
     */
    public SchemaRegistry getRegistry() {
        return registry;
    }

    /**
     * Registers a Type; a Type with the same id is replaced in place.
     *
     * @param type the Type
     * @return the registered Type
     */
    public Type addType(final Type type) {
        return registry.register(type);
    }

    /**
     * Builds a Type from a template and registers it.
     *
     * @param template the template
     * @return the registered Type
     */
    public Type addType(final TypeTemplate template) {
        return registry.register(template);
    }

    /**
     * Registers a property that no Type owns.
     *
     * @param property the property
     * @return the registered property
     */
    public TypeProperty addPropertyType(final TypeProperty property) {
        return registry.registerProperty(property);
    }

    /**
     * Registers a restriction that no Type owns.
     *
     * @param restriction the restriction
     * @return the registered restriction
     */
    public Restriction addRestriction(final Restriction restriction) {
        return registry.registerRestriction(restriction);
    }

    /**
     * Adds an entry; an entry with the same id is replaced in place.
     *
     * @param entry the entry
     * @return the entry
     */
    public MetadataEntry addEntry(final MetadataEntry entry) {
        Objects.requireNonNull(entry, "entry");
        MetadataEntry previous = entries.put(entry.getId(), entry);
        if (previous != null && LOGGER.isDebugEnabled()) {
            LOGGER.debug("Replaced entry {}", entry.getId());
        }
        return entry;
    }

    /**
     * Resolves instance objects, and everything they reference, into
     * entries and adds them.
     *
     * @param instances the objects
     * @return the entries added, in first-seen order
     * @throws IdentityMissingException if an object cannot be identified
     */
    public List<MetadataEntry> addInstance(final Object... instances) {
        List<MetadataEntry> resolved = resolver.resolve(instances);
        resolved.forEach(this::addEntry);
        return resolved;
    }

    /**
     * Returns a registered Type.
     *
     * @param id the Type id
     * @return the Type
     * @throws NotFoundException if no Type has this id
     */
    public Type getType(final String id) {
        return registry.get(id);
    }

    /**
     * Returns the registered Types in registration order.
     *
     * @return the Types
     */
    public List<Type> getTypes() {
        return registry.list();
    }

    /**
     * Returns a property, standalone or owned by a registered Type.
     *
     * @param id the property id
     * @return the property
     * @throws NotFoundException if no property has this id
     */
    public TypeProperty getPropertyType(final String id) {
        return registry.getProperty(id);
    }

    /**
     * Returns every property: those owned by Types first, then standalone
     * ones. A property shared by several Types is returned once.
     *
     * @return the properties
     */
    public List<TypeProperty> getPropertyTypes() {
        Map<String, TypeProperty> byId = new LinkedHashMap<>();
        for (Type type : registry.list()) {
            for (TypeProperty property : type.getProperties()) {
                byId.putIfAbsent(property.getId(), property);
            }
        }
        for (TypeProperty property : registry.listProperties()) {
            byId.putIfAbsent(property.getId(), property);
        }
        return List.copyOf(byId.values());
    }

    /**
     * Returns every restriction: those owned by Types first, then standalone
     * ones.
     *
     * @return the restrictions
     */
    public List<Restriction> getRestrictions() {
        List<Restriction> restrictions = new ArrayList<>();
        for (Type type : registry.list()) {
            restrictions.addAll(type.getRestrictions());
        }
        restrictions.addAll(registry.listRestrictions());
        return restrictions;
    }

    /**
     * Returns an entry.
     *
     * @param id the entry id
     * @return the entry
     * @throws NotFoundException if there is no entry with this id
     */
    public MetadataEntry getEntry(final String id) {
        MetadataEntry entry = entries.get(id);
        if (entry == null) {
            throw new NotFoundException(NotFoundException.Kind.ENTRY, id);
        }
        return entry;
    }

    /**
     * Returns every entry in the order it was first added.
     *
     * @return the entries
     */
    public List<MetadataEntry> getEntries() {
        return List.copyOf(entries.values());
    }

    /**
     * Rebuilds an entry as an {@link Instance}, together with every entry it
     * references. Each id becomes one instance, so cyclic references point
     * back at the same objects.
     *
     * @param id the entry id
     * @return the instance for the entry
     * @throws NotFoundException if there is no entry with this id
     */
    public Instance getEntryAs(final String id) {
        return new EntryMaterializer(entries::get).materialize(getEntry(id));
    }

    /**
     * Returns the entries of one Type.
     *
     * @param classId the Type id
     * @return the entries, in the order they were added
     */
    public List<MetadataEntry> getEntries(final String classId) {
        return entries.values().stream()
            .filter(e -> e.getClassId().equals(classId))
            .toList();
    }

    /**
     * Checks every entry against the cardinality restrictions of its Type.
     *
     * @return the report
     */
    public ValidationReport validate() {
        return new CardinalityValidator().validate(registry.list(), getEntries());
    }

    /**
     * Checks all references and builds the graph.
     *
     * @return the graph
     * @throws NotFoundException if a Type reference or entry class does not
     *     resolve
     */
    public SchemaGraph buildGraph() {
        registry.resolveReferences();
        return new GraphBuilder(settings.getNamespaces()).buildGraph(
            registry.list(), registry.listProperties(),
            registry.listRestrictions(), getEntries());
    }

    /**
     * Builds the graph and compacts it into a JSON-LD document.
     *
     * @return the document
     * @throws NotFoundException if a Type reference or entry class does not
     *     resolve
     */
    public ObjectNode toDocument() {
        return codec.toDocument(buildGraph());
    }

    /**
     * Serializes the session as JSON-LD text.
     *
     * @return the JSON text, pretty-printed if the settings ask for it
     */
    public String toJson() {
        return codec.write(toDocument());
    }

    /**
     * Creates a session from a document, with default settings.
     *
     * @param document the document
     * @return the populated session
     */
    public static SchemaFacade fromDocument(final ObjectNode document) {
        return fromDocument(document, SchemaSettings.defaults());
    }

    /**
     * Creates a session from a document.
     *
     * @param document the document
     * @param settings the settings
     * @return the populated session
     * @throws MalformedDocumentException if the document cannot be read
     */
    public static SchemaFacade fromDocument(final ObjectNode document,
            final SchemaSettings settings) {
        SchemaContent content = new JsonLdCodec(settings).fromDocument(document);
        SchemaFacade facade = new SchemaFacade(
            settings.withNamespaces(content.namespaces()));
        content.types().forEach(facade::addType);
        content.properties().forEach(facade::addPropertyType);
        content.restrictions().forEach(facade::addRestriction);
        content.entries().forEach(facade::addEntry);
        return facade;
    }

    /**
     * Creates a session from JSON text, with default settings.
     *
     * @param json the JSON-LD text
     * @return the populated session
     * @throws MalformedDocumentException if the text cannot be read
     */
    public static SchemaFacade fromJson(final String json) {
        return fromJson(json, SchemaSettings.defaults());
    }

    /**
     * Creates a session from JSON text.
     *
     * @param json the JSON-LD text
     * @param settings the settings
     * @return the populated session
     */
    public static SchemaFacade fromJson(final String json, final SchemaSettings settings) {
        return fromDocument(new JsonLdCodec(settings).read(json), settings);
    }
}
