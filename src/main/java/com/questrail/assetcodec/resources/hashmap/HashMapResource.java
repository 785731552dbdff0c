package com.questrail.assetcodec.resources.hashmap;

import com.questrail.assetcodec.api.DuplicateKeyConflictException;
import com.questrail.assetcodec.api.FieldAccess;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.api.ResourceValue;
import com.questrail.assetcodec.api.ValueKind;
import com.questrail.assetcodec.core.AbstractResourceInstance;
import com.questrail.assetcodec.core.ResourceFieldTable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * HashMapResource
 * -----------------------------------------------------------------------------
 * Associative table from unsigned 32-bit keys to {@link ResourceValue}s.
 *
 * <p>Entries keep their insertion order, which is also their serialized
 * order. Replacing the value of an existing key keeps the key's position.</p>
 *
 * <h2>Capacity</h2>
 * The resource tracks a nominal capacity that doubles whenever the load
 * factor would exceed {@value #MAX_LOAD_FACTOR}. Capacity is advisory and is
 * not part of the payload.
 *
 * <h2>Typed retrieval</h2>
 * Values read from a payload are always {@link ValueKind#TEXT}; use
 * {@link #getValue(int, Class)} to obtain them as another Java type.
 */
public final class HashMapResource extends AbstractResourceInstance
{
    public static final ResourceTypeId TYPE_ID = ResourceTypeId.of(0x49596978);
    public static final long SUPPORTED_VERSION = 1;

    static final double MAX_LOAD_FACTOR = 0.75;
    private static final int MIN_GROWN_CAPACITY = 4;

    private static final ResourceFieldTable<HashMapResource> FIELDS =
            ResourceFieldTable.<HashMapResource>builder("HashMapResource")
                    .writable("Version", Long.class, HashMapResource::version, HashMapResource::setVersion)
                    .readOnly("Count", Integer.class, HashMapResource::count)
                    .readOnly("Capacity", Integer.class, HashMapResource::capacity)
                    .build();

    private final LinkedHashMap<Integer, ResourceValue> entries = new LinkedHashMap<>();
    private long version = SUPPORTED_VERSION;
    private int capacity;

    public HashMapResource() {
        super(TYPE_ID);
    }

    void load(long version, LinkedHashMap<Integer, ResourceValue> parsed) {
        this.version = version;
        this.entries.clear();
        this.entries.putAll(parsed);
        this.capacity = 0;
        grow(parsed.size());
    }

    @Override
    public long version() {
        checkLive();
        return version;
    }

    /**
     * @throws IllegalArgumentException if {@code version} is negative or above {@link #SUPPORTED_VERSION}
     */
    public void setVersion(long version) {
        checkLive();
        if (version < 0 || version > SUPPORTED_VERSION) {
            throw new IllegalArgumentException("Unsupported version " + version);
        }
        if (this.version != version) {
            this.version = version;
            markChanged("Version");
        }
    }

    public int count() {
        checkLive();
        return entries.size();
    }

    public int capacity() {
        checkLive();
        return capacity;
    }

    /**
     * Raises the nominal capacity to at least {@code minCapacity}.
     *
     * @throws IllegalArgumentException if {@code minCapacity} is less than {@link #count()}
     */
    public void ensureCapacity(int minCapacity) {
        checkLive();
        if (minCapacity < entries.size()) {
            throw new IllegalArgumentException(
                    "Capacity (" + minCapacity + ") cannot be less than count (" + entries.size() + ")");
        }
        capacity = Math.max(capacity, minCapacity);
    }

    public double loadFactor() {
        checkLive();
        return capacity == 0 ? 0.0 : (double) entries.size() / capacity;
    }

    public boolean containsKey(int key) {
        checkLive();
        return entries.containsKey(key);
    }

    public Optional<ResourceValue> getValue(int key) {
        checkLive();
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Returns the value for {@code key} as {@code type}, converting it when the
     * stored kind differs. Empty if the key is absent or no conversion applies.
     */
    public <T> Optional<T> getValue(int key, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return getValue(key).flatMap(v -> v.as(type));
    }

    /**
     * Inserts or replaces the value for {@code key}. Setting a value equal to
     * the current one is a no-op.
     */
    public void setValue(int key, Object value) {
        checkLive();
        ResourceValue v = ResourceValue.from(value);
        ResourceValue prev = entries.get(key);
        if (v.equals(prev)) {
            return;
        }
        entries.put(key, v);
        if (prev == null) {
            grow(entries.size());
        }
        markChanged("Entries");
    }

    /**
     * Inserts a value for a key that must not exist yet.
     *
     * @throws DuplicateKeyConflictException if {@code key} is already present
     */
    public void addValue(int key, Object value) {
        checkLive();
        ResourceValue v = ResourceValue.from(value);
        if (entries.containsKey(key)) {
            throw new DuplicateKeyConflictException(Integer.toUnsignedString(key),
                    "Key " + Integer.toUnsignedString(key) + " is already present");
        }
        entries.put(key, v);
        grow(entries.size());
        markChanged("Entries");
    }

    public boolean remove(int key) {
        checkLive();
        if (entries.remove(key) == null) {
            return false;
        }
        markChanged("Entries");
        return true;
    }

    public void clear() {
        checkLive();
        if (entries.isEmpty()) {
            return;
        }
        entries.clear();
        markChanged("Entries");
    }

    /**
     * Keys in insertion order.
     */
    public List<Integer> keys() {
        checkLive();
        return List.copyOf(entries.keySet());
    }

    public List<ResourceValue> values() {
        checkLive();
        return List.copyOf(entries.values());
    }

    /**
     * Returns an insertion-ordered copy of the table.
     */
    public Map<Integer, ResourceValue> entries() {
        checkLive();
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public FieldAccess fields() {
        checkLive();
        return FIELDS.bind(this);
    }

    @Override
    protected void onDispose() {
        entries.clear();
    }

    private void grow(int needed) {
        while (needed > capacity * MAX_LOAD_FACTOR) {
            capacity = capacity == 0 ? MIN_GROWN_CAPACITY : capacity * 2;
        }
    }
}
