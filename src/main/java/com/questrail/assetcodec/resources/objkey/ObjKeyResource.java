package com.questrail.assetcodec.resources.objkey;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.FieldAccess;
import com.questrail.assetcodec.api.ResourceState;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.core.AbstractResourceInstance;
import com.questrail.assetcodec.core.ResourceFieldTable;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.random.RandomGenerator;

/**
 * Identity record: a 64-bit object key, a 32-bit object type and an opaque
 * trailing payload.
 *
 * <p>A record is {@linkplain #isValid() valid} once both key and type are
 * non-zero.</p>
 */
public final class ObjKeyResource extends AbstractResourceInstance
{
    public static final ResourceTypeId TYPE_ID = ResourceTypeId.of(0x48C28979);
    public static final long SUPPORTED_VERSION = 1;

    private static final ResourceFieldTable<ObjKeyResource> FIELDS =
            ResourceFieldTable.<ObjKeyResource>builder("ObjKeyResource")
                    .readOnly("Version", Long.class, ObjKeyResource::version)
                    .writable("ObjectKey", Long.class, ObjKeyResource::objectKey, ObjKeyResource::setObjectKey)
                    .writable("ObjectType", Integer.class, ObjKeyResource::objectType, ObjKeyResource::setObjectType)
                    .writable("AdditionalData", byte[].class, ObjKeyResource::additionalData,
                            ObjKeyResource::setAdditionalData)
                    .build();

    private long version = SUPPORTED_VERSION;
    private long objectKey;
    private int objectType;
    private byte[] additionalData = new byte[0];

    public ObjKeyResource() {
        super(TYPE_ID);
    }

    void load(long version, long objectKey, int objectType, byte[] additionalData) {
        this.version = version;
        this.objectKey = objectKey;
        this.objectType = objectType;
        this.additionalData = additionalData;
    }

    @Override
    public long version() {
        checkLive();
        return version;
    }

    /**
     * The unsigned 64-bit object key, as its bit pattern.
     */
    public long objectKey() {
        checkLive();
        return objectKey;
    }

    public void setObjectKey(long objectKey) {
        checkLive();
        if (this.objectKey != objectKey) {
            this.objectKey = objectKey;
            markChanged("ObjectKey");
        }
    }

    /**
     * The unsigned 32-bit object type, as its bit pattern.
     */
    public int objectType() {
        checkLive();
        return objectType;
    }

    public void setObjectType(int objectType) {
        checkLive();
        if (this.objectType != objectType) {
            this.objectType = objectType;
            markChanged("ObjectType");
        }
    }

    public byte[] additionalData() {
        checkLive();
        return additionalData.clone();
    }

    public void setAdditionalData(byte[] data) {
        checkLive();
        Objects.requireNonNull(data, "data");
        if (!Arrays.equals(additionalData, data)) {
            additionalData = data.clone();
            markChanged("AdditionalData");
        }
    }

    public boolean isValid() {
        checkLive();
        return objectKey != 0 && objectType != 0;
    }

    /**
     * Assigns {@code objectType} and a fresh random key.
     *
     * @see #generateNewKey(int, CancellationSignal, RandomGenerator)
     */
    public void generateNewKey(int objectType, CancellationSignal signal) {
        generateNewKey(objectType, signal, ThreadLocalRandom.current());
    }

    /**
     * Assigns {@code objectType} and a random key drawn from
     * {@code [1, Long.MAX_VALUE)} that differs from the current key.
     */
    public void generateNewKey(int objectType, CancellationSignal signal, RandomGenerator random) {
        checkLive();
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(random, "random");
        signal.throwIfCancelled();

        long key;
        do {
            key = random.nextLong(1, Long.MAX_VALUE);
        } while (key == objectKey);

        setObjectType(objectType);
        setObjectKey(key);
    }

    @Override
    public FieldAccess fields() {
        checkLive();
        return FIELDS.bind(this);
    }

    @Override
    protected void onDispose() {
        additionalData = new byte[0];
    }

    @Override
    public String toString() {
        if (state() == ResourceState.DISPOSED) {
            return super.toString();
        }
        return String.format(Locale.ROOT, "ObjKeyResource (Version: %d, ObjectKey: 0x%016X, ObjectType: 0x%08X, Data Length: %d bytes)",
                version, objectKey, objectType, additionalData.length);
    }
}
