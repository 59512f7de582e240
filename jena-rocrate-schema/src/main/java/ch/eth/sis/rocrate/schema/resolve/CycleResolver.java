package ch.eth.sis.rocrate.schema.resolve;

import ch.eth.sis.rocrate.schema.IdentityMissingException;
import ch.eth.sis.rocrate.schema.model.LiteralValues;
import ch.eth.sis.rocrate.schema.model.MetadataEntry;
import ch.eth.sis.rocrate.schema.tracing.TracingUtil;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flattens a possibly cyclic object graph into metadata entries, one per
 * distinct identity.
 *
 * <p>Every object gets a placeholder id the first time it is seen, before
 * its fields are visited, so that objects pointing back at it can refer to
 * it. When the object is complete its final id is derived:</p>
 * <ul>
 *   <li>the explicit id, if the object has one;</li>
 *   <li>otherwise {@code <classid>_<hash>}, the first 16 hex digits of the
 *       SHA-256 of the class id and the literal fields in order.</li>
 * </ul>
 * <p>Placeholders are then rewritten to final ids everywhere. Objects that
 * end up with the same final id collapse into the first one seen. Entries
 * are returned in first-seen order.</p>
 */
public final class CycleResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        CycleResolver.class);

    /** Prefix of placeholder ids. */
    public static final String PLACEHOLDER_PREFIX = "_:placeholder-";

    private static final int HASH_HEX_LENGTH = 16;

    private final InstanceExtractor extractor;

    /**
     * Creates a resolver using the standard extractor.
     */
    public CycleResolver() {
        this(InstanceExtractor.standard());
    }

    /**
     * Creates a resolver using the extractor specified.
     *
     * @param extractor the extractor
     */
    public CycleResolver(final InstanceExtractor extractor) {
        this.extractor = extractor;
    }

    /**
     * Resolves the objects specified and everything reachable from them.
     *
     * @param roots the objects
     * @return the entries, in first-seen order
     * @throws ch.eth.sis.rocrate.schema.IdentityMissingException if an
     *     object has neither an explicit id nor a literal field
     */
    public List<MetadataEntry> resolve(final Object... roots) {
        return resolve(Arrays.asList(roots));
    }

    /**
     * Resolves the objects specified and everything reachable from them.
     *
     * @param roots the objects
     * @return the entries, in first-seen order
     */
    public List<MetadataEntry> resolve(final Collection<?> roots) {
        return TracingUtil.inSpan(TracingUtil.SCOPE_RESOLVER,
            "CycleResolver.resolve", span -> {
                List<MetadataEntry> entries = new Session().run(roots);
                span.setAttribute(TracingUtil.ATTR_ENTRIES, (long) entries.size());
                return entries;
            });
    }

    /**
     * Checks whether an id is a placeholder.
     *
     * @param id the id
     * @return true for placeholder ids
     */
    public static boolean isPlaceholder(final String id) {
        return id.startsWith(PLACEHOLDER_PREFIX);
    }

    /** State of one resolve call. */
    private final class Session {
        private final Map<Object, String> visited = new IdentityHashMap<>();
        private final List<Slot> slots = new ArrayList<>();
        private final Map<String, String> finalIds = new HashMap<>();
        private int counter;

        List<MetadataEntry> run(final Collection<?> roots) {
            for (Object root : roots) {
                visit(root);
            }
            Map<String, MetadataEntry> byId = new LinkedHashMap<>();
            for (Slot slot : slots) {
                MetadataEntry entry = slot.builder().build().rewriteReferences(finalIds);
                MetadataEntry first = byId.putIfAbsent(entry.getId(), entry);
                if (first != null && LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Collapsed {} into earlier entry {}",
                        slot.placeholder, entry.getId());
                }
            }
            for (MetadataEntry entry : byId.values()) {
                for (List<String> targets : entry.getReferences().values()) {
                    for (String target : targets) {
                        if (isPlaceholder(target)) {
                            throw new IllegalStateException("Placeholder " + target
                                + " left in entry " + entry.getId());
                        }
                    }
                }
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Resolved {} object(s) into {} distinct entries",
                    slots.size(), byId.size());
            }
            return List.copyOf(byId.values());
        }

        private String visit(final Object object) {
            String known = visited.get(object);
            if (known != null) {
                return known;
            }
            String placeholder = PLACEHOLDER_PREFIX + counter++;
            visited.put(object, placeholder);
            Slot slot = new Slot(placeholder);
            slots.add(slot);

            InstanceView view = extractor.extract(object);
            slot.classId = view.classId();
            for (FieldValue field : view.fields()) {
                if (field.value() == null) {
                    continue;
                }
                if (field.reference()) {
                    List<String> targets = slot.references.computeIfAbsent(
                        field.name(), k -> new ArrayList<>());
                    for (Object target : asList(field.value())) {
                        targets.add(target instanceof String id ? id : visit(target));
                    }
                } else {
                    slot.literals.put(field.name(), field.value());
                }
            }

            String finalId = view.explicitId() != null
                ? view.explicitId() : contentId(view.classId(), slot.literals, object);
            slot.finalId = finalId;
            visited.put(object, finalId);
            finalIds.put(placeholder, finalId);
            return finalId;
        }
    }

    private static List<?> asList(final Object value) {
        if (value instanceof Collection<?> values) {
            return new ArrayList<>(values);
        }
        return List.of(value);
    }

    private static String contentId(final String classId,
            final Map<String, Object> literals, final Object object) {
        if (literals.isEmpty()) {
            throw new IdentityMissingException(classId,
                object.getClass().getSimpleName() + "@"
                    + Integer.toHexString(System.identityHashCode(object)));
        }
        StringBuilder content = new StringBuilder(classId);
        for (Map.Entry<String, Object> e : literals.entrySet()) {
            content.append('\u0000').append(e.getKey()).append('=');
            for (Object value : asList(e.getValue())) {
                content.append(LiteralValues.lexicalForm(LiteralValues.normalize(value)))
                    .append('\u0001');
            }
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                .digest(content.toString().getBytes(StandardCharsets.UTF_8));
            return classId.toLowerCase(Locale.ROOT) + "_"
                + HexFormat.of().formatHex(digest).substring(0, HASH_HEX_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** An entry under construction. */
    private static final class Slot {
        private final String placeholder;
        private String classId;
        private String finalId;
        private final Map<String, Object> literals = new LinkedHashMap<>();
        private final Map<String, List<String>> references = new LinkedHashMap<>();

        Slot(final String placeholderId) {
            this.placeholder = placeholderId;
        }

        MetadataEntry.Builder builder() {
            MetadataEntry.Builder b = MetadataEntry.builder(finalId, classId);
            literals.forEach(b::property);
            references.forEach(b::references);
            return b;
        }
    }
}
