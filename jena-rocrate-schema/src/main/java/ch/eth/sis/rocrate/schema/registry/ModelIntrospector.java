package ch.eth.sis.rocrate.schema.registry;

import java.util.List;

/**
 * Source of field descriptions for declared structured types. Type
 * construction depends only on this contract, not on how types are
 * authored.
 */
@FunctionalInterface
public interface ModelIntrospector {

    /**
     * Describes the fields of a type in declaration order.
     *
     * @param javaType the declared type
     * @return the ordered field descriptions
     */
    List<FieldDescriptor> describe(Class<?> javaType);
}
