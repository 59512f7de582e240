package ch.eth.sis.rocrate.schema.registry;

import ch.eth.sis.rocrate.schema.NotFoundException;
import ch.eth.sis.rocrate.schema.model.LiteralType;
import ch.eth.sis.rocrate.schema.model.Restriction;
import ch.eth.sis.rocrate.schema.model.Type;
import ch.eth.sis.rocrate.schema.model.TypeProperty;
import ch.eth.sis.rocrate.schema.vocab.Namespaces;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store of the Types, standalone properties and standalone restrictions of
 * one build session.
 *
 * <p>Registering an id a second time replaces the earlier definition; the
 * replacement keeps the position of the original in registration order.
 * Nothing is merged. A replacement that differs from the original is logged
 * at WARN.</p>
 *
 * <p>Registration accepts references to Types that are not registered yet.
 * {@link #resolveReferences()} checks them once every declaration is in.</p>
 *
 * <p>Not thread-safe; use one registry per session.</p>
 */
public final class SchemaRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        SchemaRegistry.class);

    private final Map<String, Type> types = new LinkedHashMap<>();

    private final Map<String, TypeProperty> properties = new LinkedHashMap<>();

    private final Map<String, Restriction> restrictions = new LinkedHashMap<>();

    /**
     * Registers a Type, replacing any Type with the same id.
     *
     * @param type the Type
     * @return the Type
     */
    public Type register(final Type type) {
        Objects.requireNonNull(type, "type");
        Type previous = types.put(type.getId(), type);
        warnOnReplace("Type", type.getId(), previous, type);
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Registered {} ({} type(s) in registry)", type, types.size());
        }
        return type;
    }

    /**
     * Converts a template and registers the resulting Type.
     *
     * @param template the template
     * @return the registered Type
     */
    public Type register(final TypeTemplate template) {
        return register(template.toType());
    }

    /**
     * Registers a property that no Type owns.
     *
     * @param property the property
     * @return the property
     */
    public TypeProperty registerProperty(final TypeProperty property) {
        Objects.requireNonNull(property, "property");
        TypeProperty previous = properties.put(property.getId(), property);
        warnOnReplace("Property", property.getId(), previous, property);
        return property;
    }

    /**
     * Registers a restriction that no Type owns.
     *
     * @param restriction the restriction
     * @return the restriction
     */
    public Restriction registerRestriction(final Restriction restriction) {
        Objects.requireNonNull(restriction, "restriction");
        Restriction previous = restrictions.put(restriction.getId(), restriction);
        warnOnReplace("Restriction", restriction.getId(), previous, restriction);
        return restriction;
    }

    private static void warnOnReplace(final String kind, final String id,
            final Object previous, final Object replacement) {
        if (previous != null && !previous.equals(replacement)
                && LOGGER.isWarnEnabled()) {
            LOGGER.warn("{} {} registered again; replacing {} with {}",
                kind, id, previous, replacement);
        }
    }

    /**
     * Returns a registered Type.
     *
     * @param id the Type id
     * @return the Type
     * @throws NotFoundException if no Type has this id
     */
    public Type get(final String id) {
        Type type = types.get(id);
        if (type == null) {
            throw new NotFoundException(NotFoundException.Kind.TYPE, id);
        }
        return type;
    }

    /**
     * Returns a property, standalone or owned by a registered Type.
     *
     * @param id the property id
     * @return the property
     * @throws NotFoundException if no property has this id
     */
    public TypeProperty getProperty(final String id) {
        String canonical = Namespaces.canonical(id);
        TypeProperty property = properties.get(canonical);
        if (property != null) {
            return property;
        }
        return types.values().stream()
            .map(t -> t.getProperty(canonical))
            .flatMap(Optional::stream)
            .findFirst()
            .orElseThrow(() -> new NotFoundException(
                NotFoundException.Kind.PROPERTY, id));
    }

    /**
     * Returns a restriction, standalone or owned by a registered Type.
     *
     * @param id the restriction id
     * @return the restriction
     * @throws NotFoundException if no restriction has this id
     */
    public Restriction getRestriction(final String id) {
        Restriction restriction = restrictions.get(id);
        if (restriction != null) {
            return restriction;
        }
        return types.values().stream()
            .flatMap(t -> t.getRestrictions().stream())
            .filter(r -> r.getId().equals(id))
            .findFirst()
            .orElseThrow(() -> new NotFoundException(
                NotFoundException.Kind.RESTRICTION, id));
    }

    /**
     * Checks whether a Type is registered.
     *
     * @param id the Type id
     * @return true if registered
     */
    public boolean contains(final String id) {
        return types.containsKey(id);
    }

    /**
     * Returns the registered Types in registration order.
     *
     * @return the Types
     */
    public List<Type> list() {
        return List.copyOf(types.values());
    }

    /**
     * Returns the standalone properties in registration order.
     *
     * @return the properties
     */
    public List<TypeProperty> listProperties() {
        return List.copyOf(properties.values());
    }

    /**
     * Returns the standalone restrictions in registration order.
     *
     * @return the restrictions
     */
    public List<Restriction> listRestrictions() {
        return List.copyOf(restrictions.values());
    }

    /**
     * Checks that every local reference names a registered Type: parents,
     * the ranges of all properties and the domains of standalone
     * properties. Literal datatypes and qualified ids are not checked.
     *
     * @throws NotFoundException for the first reference that does not
     *     resolve
     */
    public void resolveReferences() {
        for (Type type : types.values()) {
            for (String parent : type.getSubClassOf()) {
                requireType(parent, "parent of " + type.getId());
            }
            for (TypeProperty property : type.getProperties()) {
                checkRanges(property);
            }
        }
        for (TypeProperty property : properties.values()) {
            checkRanges(property);
            for (String domain : property.getDomainIncludes()) {
                requireType(domain, "domain of " + property.getId());
            }
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Resolved references of {} type(s) and {} standalone "
                + "properties", types.size(), properties.size());
        }
    }

    private void checkRanges(final TypeProperty property) {
        for (String range : property.getRangeIncludes()) {
            if (LiteralType.fromId(range).isEmpty()) {
                requireType(range, "range of " + property.getId());
            }
        }
    }

    private void requireType(final String id, final String where) {
        if (!Namespaces.isQualified(id) && !types.containsKey(id)) {
            throw new NotFoundException(NotFoundException.Kind.TYPE, id, where);
        }
    }
}
