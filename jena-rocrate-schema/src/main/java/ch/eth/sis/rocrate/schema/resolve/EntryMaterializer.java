package ch.eth.sis.rocrate.schema.resolve;

import ch.eth.sis.rocrate.schema.model.MetadataEntry;
import ch.eth.sis.rocrate.schema.tracing.TracingUtil;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds an {@link Instance} graph from metadata entries, the reverse of
 * {@link CycleResolver}.
 *
 * <p>Each entry id is materialized once per call, so two references to the
 * same id yield the same {@code Instance} object and cycles close on
 * themselves. Entries are filled from a work stack rather than by
 * recursion.</p>
 *
 * <p>A reference field whose targets all have entries holds instances: a
 * single instance for one target, a list otherwise. If any target has no
 * entry the field keeps the plain ids, as set by
 * {@link Instance#reference}.</p>
 */
public final class EntryMaterializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        EntryMaterializer.class);

    private final Function<String, MetadataEntry> lookup;

    /**
     * Creates a materializer over the entries specified.
     *
     * @param lookup returns the entry with an id, or null if there is none
     */
    public EntryMaterializer(final Function<String, MetadataEntry> lookup) {
        this.lookup = Objects.requireNonNull(lookup, "lookup");
    }

    /**
     * Materializes an entry and everything it references.
     *
     * @param root the entry to start from
     * @return the instance for the entry
     */
    public Instance materialize(final MetadataEntry root) {
        Objects.requireNonNull(root, "root");
        return TracingUtil.inSpan(TracingUtil.SCOPE_RESOLVER,
            "EntryMaterializer.materialize", span -> {
                Map<String, Instance> built = new HashMap<>();
                Deque<MetadataEntry> pending = new ArrayDeque<>();
                Instance result = instanceFor(root, built, pending);
                while (!pending.isEmpty()) {
                    fill(pending.pop(), built, pending);
                }
                span.setAttribute(TracingUtil.ATTR_ENTRIES, (long) built.size());
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Materialized {} instance(s) from entry {}",
                        built.size(), root.getId());
                }
                return result;
            });
    }

    private Instance instanceFor(final MetadataEntry entry,
            final Map<String, Instance> built, final Deque<MetadataEntry> pending) {
        Instance existing = built.get(entry.getId());
        if (existing != null) {
            return existing;
        }
        String classId = entry.isOpaque() && entry.getDeclaredType() != null
            ? entry.getDeclaredType() : entry.getClassId();
        Instance instance = new Instance(classId).id(entry.getId());
        built.put(entry.getId(), instance);
        pending.push(entry);
        return instance;
    }

    private void fill(final MetadataEntry entry, final Map<String, Instance> built,
            final Deque<MetadataEntry> pending) {
        Instance instance = built.get(entry.getId());
        for (String name : entry.getProperties().keySet()) {
            instance.set(name, entry.getProperties().get(name));
        }
        for (Map.Entry<String, List<String>> e : entry.getReferences().entrySet()) {
            List<MetadataEntry> targets = new ArrayList<>(e.getValue().size());
            for (String targetId : e.getValue()) {
                MetadataEntry target = lookup.apply(targetId);
                if (target == null) {
                    LOGGER.debug("Entry {} references {} which has no entry",
                        entry.getId(), targetId);
                    targets = null;
                    break;
                }
                targets.add(target);
            }
            if (targets == null) {
                instance.reference(e.getKey(), e.getValue().toArray(new String[0]));
            } else if (targets.size() == 1) {
                instance.set(e.getKey(), instanceFor(targets.get(0), built, pending));
            } else {
                List<Instance> values = new ArrayList<>(targets.size());
                for (MetadataEntry target : targets) {
                    values.add(instanceFor(target, built, pending));
                }
                instance.set(e.getKey(), values);
            }
        }
    }
}
