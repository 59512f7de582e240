package ch.eth.sis.rocrate.schema.resolve;

import java.util.List;

/**
 * Turns an instance object into an {@link InstanceView}. Implementations
 * let any modelling front end feed the resolver.
 */
public interface InstanceExtractor {

    /**
     * Checks whether this extractor can handle an object.
     *
     * @param instance the object
     * @return true if {@link #extract(Object)} accepts it
     */
    boolean supports(Object instance);

    /**
     * Extracts the view of an object.
     *
     * @param instance the object
     * @return the view
     */
    InstanceView extract(Object instance);

    /**
     * Returns the extractor handling {@link Instance} objects first and any
     * other object by reflection.
     *
     * @return the standard extractor
     */
    static InstanceExtractor standard() {
        return new CompositeInstanceExtractor(List.of(
            Instance.EXTRACTOR, new ReflectiveInstanceExtractor()));
    }
}
