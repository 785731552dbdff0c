package com.questrail.assetcodec.core;

import com.questrail.assetcodec.api.FieldAccess;
import com.questrail.assetcodec.api.FieldValue;
import com.questrail.assetcodec.api.UnknownFieldException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * ResourceFieldTable
 * -----------------------------------------------------------------------------
 * Declarative list of the logical fields a resource type exposes through
 * {@link FieldAccess}. One table is built per resource class and shared by all
 * of its instances; {@link #bind(AbstractResourceInstance)} produces the
 * per-instance view.
 *
 * <p>The table is backed by:</p>
 * <ul>
 *   <li>a list for index -> field</li>
 *   <li>a map for name -> index</li>
 * </ul>
 *
 * <h2>Value coercion</h2>
 * Writes accept a value of the declared type, or a {@link Number} that can be
 * represented in the declared numeric type without changing its integral value.
 * Anything else is rejected with {@link IllegalArgumentException}.
 */
public final class ResourceFieldTable<R extends AbstractResourceInstance>
{
    private final String resourceKind;
    private final List<FieldDefinition<R, ?>> fields;
    private final Map<String, Integer> indexByName;
    private final List<String> names;

    private ResourceFieldTable(String resourceKind, List<FieldDefinition<R, ?>> fields) {
        this.resourceKind = resourceKind;
        this.fields = List.copyOf(fields);

        Map<String, Integer> tmp = new HashMap<>(fields.size() * 2);
        List<String> tmpNames = new ArrayList<>(fields.size());
        for (int i = 0; i < this.fields.size(); i++) {
            String name = this.fields.get(i).name();
            Integer prev = tmp.put(name, i);
            if (prev != null) {
                throw new IllegalArgumentException("Duplicate field name: " + name);
            }
            tmpNames.add(name);
        }
        this.indexByName = Collections.unmodifiableMap(tmp);
        this.names = Collections.unmodifiableList(tmpNames);
    }

    public static <R extends AbstractResourceInstance> Builder<R> builder(String resourceKind) {
        return new Builder<>(resourceKind);
    }

    public List<String> fieldNames() {
        return names;
    }

    /**
     * Returns a {@link FieldAccess} view bound to {@code resource}.
     */
    public FieldAccess bind(R resource) {
        return new BoundFieldAccess(Objects.requireNonNull(resource, "resource"));
    }

    private FieldDefinition<R, ?> byName(String name) {
        Objects.requireNonNull(name, "name");
        Integer idx = indexByName.get(name);
        if (idx == null) {
            throw new UnknownFieldException(resourceKind, name);
        }
        return fields.get(idx);
    }

    private FieldDefinition<R, ?> byIndex(int index) {
        if (index < 0 || index >= fields.size()) {
            throw new IndexOutOfBoundsException("index=" + index + ", size=" + fields.size());
        }
        return fields.get(index);
    }

    static Object coerce(String fieldName, Class<?> type, Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Field '" + fieldName + "' does not accept null");
        }
        if (type.isInstance(value)) {
            return value;
        }
        if (value instanceof Number n) {
            if (type == Long.class && isIntegral(n)) {
                return n.longValue();
            }
            if (type == Integer.class && isIntegral(n)
                    && n.longValue() >= Integer.MIN_VALUE && n.longValue() <= Integer.MAX_VALUE) {
                return n.intValue();
            }
            if (type == Double.class) {
                return n.doubleValue();
            }
            if (type == Float.class) {
                return n.floatValue();
            }
        }
        throw new IllegalArgumentException("Field '" + fieldName + "' expects "
                + type.getSimpleName() + " but was given " + value.getClass().getSimpleName());
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte;
    }

    private record FieldDefinition<R, T>(
            String name,
            Class<T> type,
            Function<R, T> getter,
            BiConsumer<R, T> setter
    ) {
        FieldValue read(R resource) {
            return new FieldValue(name, type, getter.apply(resource));
        }

        void write(R resource, Object value) {
            if (setter == null) {
                throw new UnsupportedOperationException("Field '" + name + "' is read-only");
            }
            setter.accept(resource, type.cast(coerce(name, type, value)));
        }
    }

    private final class BoundFieldAccess implements FieldAccess
    {
        private final R resource;

        private BoundFieldAccess(R resource) {
            this.resource = resource;
        }

        @Override
        public List<String> fieldNames() {
            resource.checkLive();
            return names;
        }

        @Override
        public FieldValue get(String name) {
            resource.checkLive();
            return byName(name).read(resource);
        }

        @Override
        public FieldValue get(int index) {
            resource.checkLive();
            return byIndex(index).read(resource);
        }

        @Override
        public void set(String name, Object value) {
            resource.checkLive();
            byName(name).write(resource, value);
        }

        @Override
        public void set(int index, Object value) {
            resource.checkLive();
            byIndex(index).write(resource, value);
        }

        @Override
        public boolean isWritable(String name) {
            return byName(name).setter() != null;
        }
    }

    public static final class Builder<R extends AbstractResourceInstance>
    {
        private final String resourceKind;
        private final List<FieldDefinition<R, ?>> fields = new ArrayList<>();

        private Builder(String resourceKind) {
            this.resourceKind = Objects.requireNonNull(resourceKind, "resourceKind");
        }

        public <T> Builder<R> readOnly(String name, Class<T> type, Function<R, T> getter) {
            fields.add(new FieldDefinition<>(name, type, getter, null));
            return this;
        }

        public <T> Builder<R> writable(String name, Class<T> type,
                                       Function<R, T> getter, BiConsumer<R, T> setter) {
            fields.add(new FieldDefinition<>(name, type, getter, Objects.requireNonNull(setter, "setter")));
            return this;
        }

        public ResourceFieldTable<R> build() {
            return new ResourceFieldTable<>(resourceKind, fields);
        }
    }
}
