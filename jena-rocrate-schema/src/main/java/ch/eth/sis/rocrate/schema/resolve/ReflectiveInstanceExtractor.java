package ch.eth.sis.rocrate.schema.resolve;

import ch.eth.sis.rocrate.schema.model.LiteralValues;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Extracts records and plain objects by reflection. The class id is the
 * simple class name and a {@code String} field named {@code id} is the
 * explicit id. Collections of non-literal objects are list references;
 * enum constants are stored by name.
 */
public final class ReflectiveInstanceExtractor implements InstanceExtractor {

    /** Name of the field holding an instance's id. */
    public static final String ID_FIELD = "id";

    @Override
    public boolean supports(final Object instance) {
        return instance != null && !LiteralValues.isLiteral(instance)
            && !(instance instanceof Collection<?>)
            && !(instance instanceof Map<?, ?>)
            && !(instance instanceof Optional<?>)
            && !instance.getClass().isArray()
            && !instance.getClass().isEnum();
    }

    @Override
    public InstanceView extract(final Object instance) {
        Class<?> cls = instance.getClass();
        String explicitId = null;
        List<FieldValue> fields = new ArrayList<>();
        if (cls.isRecord()) {
            for (RecordComponent component : cls.getRecordComponents()) {
                Object value = read(component, instance);
                if (ID_FIELD.equals(component.getName())) {
                    explicitId = asId(value);
                } else {
                    addField(fields, component.getName(), value);
                }
            }
        } else {
            for (Class<?> c = cls; c != null && c != Object.class; c = c.getSuperclass()) {
                for (Field field : c.getDeclaredFields()) {
                    if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                        continue;
                    }
                    Object value = read(field, instance);
                    if (ID_FIELD.equals(field.getName())) {
                        explicitId = asId(value);
                    } else {
                        addField(fields, field.getName(), value);
                    }
                }
            }
        }
        return new InstanceView(cls.getSimpleName(), explicitId, fields);
    }

    private static String asId(final Object value) {
        return value instanceof String s && !s.isBlank() ? s : null;
    }

    private static void addField(final List<FieldValue> fields, final String name,
            final Object raw) {
        Object value = raw instanceof Optional<?> optional ? optional.orElse(null) : raw;
        if (value == null) {
            return;
        }
        if (value instanceof Collection<?> values) {
            List<Object> items = new ArrayList<>(values.size());
            for (Object item : values) {
                items.add(item instanceof Enum<?> e ? e.name() : item);
            }
            boolean literal = items.stream().allMatch(LiteralValues::isLiteral);
            fields.add(new FieldValue(name, items, !literal));
        } else if (value instanceof Enum<?> e) {
            fields.add(new FieldValue(name, e.name(), false));
        } else {
            fields.add(new FieldValue(name, value, !LiteralValues.isLiteral(value)));
        }
    }

    private static Object read(final RecordComponent component, final Object instance) {
        Method accessor = component.getAccessor();
        try {
            accessor.setAccessible(true);
            return accessor.invoke(instance);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read " + component.getName()
                + " of " + instance.getClass().getName(), e);
        }
    }

    private static Object read(final Field field, final Object instance) {
        try {
            field.setAccessible(true);
            return field.get(instance);
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Cannot read " + field.getName()
                + " of " + instance.getClass().getName(), e);
        }
    }
}
