package ch.eth.sis.rocrate.schema.registry;

import ch.eth.sis.rocrate.schema.model.LiteralType;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Describes Java records and plain classes by reflection.
 *
 * <ul>
 *   <li>Record components, or declared non-static fields, in declaration
 *       order; a field named {@code id} is the instance id and skipped.</li>
 *   <li>{@code List<X>} and other collections become list fields of X.</li>
 *   <li>{@code Optional<X>} becomes an optional field of X.</li>
 *   <li>Primitive fields are required.</li>
 *   <li>Literal Java kinds map to their literal type; any other class is a
 *       reference to the Type named after its simple name.</li>
 * </ul>
 */
public final class ReflectiveModelIntrospector implements ModelIntrospector {

    private static final Logger LOGGER = LoggerFactory.getLogger(
        ReflectiveModelIntrospector.class);

    /** Name of the field holding an instance's id. */
    public static final String ID_FIELD = "id";

    @Override
    public List<FieldDescriptor> describe(final Class<?> javaType) {
        List<FieldDescriptor> fields = new ArrayList<>();
        if (javaType.isRecord()) {
            for (RecordComponent component : javaType.getRecordComponents()) {
                if (!ID_FIELD.equals(component.getName())) {
                    fields.add(describe(component.getName(), component.getType(),
                        component.getGenericType()));
                }
            }
        } else {
            for (Field field : javaType.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()
                        || ID_FIELD.equals(field.getName())) {
                    continue;
                }
                fields.add(describe(field.getName(), field.getType(),
                    field.getGenericType()));
            }
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Described {} with {} field(s)",
                javaType.getSimpleName(), fields.size());
        }
        return fields;
    }

    private static FieldDescriptor describe(final String name,
            final Class<?> raw, final Type generic) {
        if (Collection.class.isAssignableFrom(raw)) {
            return FieldDescriptor.of(name, semanticType(elementType(generic, name)))
                .withList(true);
        }
        if (raw == Optional.class) {
            return FieldDescriptor.of(name, semanticType(elementType(generic, name)));
        }
        return FieldDescriptor.of(name, semanticType(raw))
            .withRequired(raw.isPrimitive());
    }

    private static Class<?> elementType(final Type generic,
            final String name) {
        if (generic instanceof ParameterizedType parameterized) {
            Type arg = parameterized.getActualTypeArguments()[0];
            if (arg instanceof Class<?> cls) {
                return cls;
            }
            if (arg instanceof ParameterizedType nested
                    && nested.getRawType() instanceof Class<?> cls) {
                return cls;
            }
        }
        throw new IllegalArgumentException(
            "Cannot determine the element type of field " + name + ": " + generic);
    }

    static SemanticType semanticType(final Class<?> cls) {
        Optional<LiteralType> literal = LiteralType.forJavaType(cls);
        return literal.map(SemanticType::of)
            .orElseGet(() -> SemanticType.reference(cls.getSimpleName()));
    }
}
