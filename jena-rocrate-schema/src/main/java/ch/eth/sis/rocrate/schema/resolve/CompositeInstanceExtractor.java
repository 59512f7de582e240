package ch.eth.sis.rocrate.schema.resolve;

import java.util.List;

/**
 * Delegates to the first extractor that supports an object.
 */
public final class CompositeInstanceExtractor implements InstanceExtractor {

    private final List<InstanceExtractor> delegates;

    /**
     * Creates a composite over the extractors specified, tried in order.
     *
     * @param delegates the extractors
     */
    public CompositeInstanceExtractor(final List<InstanceExtractor> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public boolean supports(final Object instance) {
        return delegates.stream().anyMatch(d -> d.supports(instance));
    }

    @Override
    public InstanceView extract(final Object instance) {
        for (InstanceExtractor delegate : delegates) {
            if (delegate.supports(instance)) {
                return delegate.extract(instance);
            }
        }
        throw new IllegalArgumentException("No extractor supports "
            + instance.getClass().getName());
    }
}
