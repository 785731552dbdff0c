package com.questrail.assetcodec.resources.blob;

import com.questrail.assetcodec.api.FieldAccess;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.core.AbstractResourceInstance;
import com.questrail.assetcodec.core.ResourceFieldTable;

import java.util.Arrays;
import java.util.Objects;

/**
 * A payload held as raw bytes. The instance carries the type id of whatever
 * format the bytes belong to; nothing inside them is interpreted.
 */
public final class OpaqueBlobResource extends AbstractResourceInstance
{
    private static final ResourceFieldTable<OpaqueBlobResource> FIELDS =
            ResourceFieldTable.<OpaqueBlobResource>builder("OpaqueBlobResource")
                    .readOnly("Size", Integer.class, OpaqueBlobResource::size)
                    .writable("Data", byte[].class, OpaqueBlobResource::data, OpaqueBlobResource::setData)
                    .build();

    private byte[] data = new byte[0];

    public OpaqueBlobResource(ResourceTypeId typeId) {
        super(typeId);
    }

    void load(byte[] data) {
        this.data = data;
    }

    /**
     * Always {@code 0}: a blob has no layout of its own to version.
     */
    @Override
    public long version() {
        checkLive();
        return 0;
    }

    public byte[] data() {
        checkLive();
        return data.clone();
    }

    public void setData(byte[] data) {
        checkLive();
        Objects.requireNonNull(data, "data");
        if (!Arrays.equals(this.data, data)) {
            this.data = data.clone();
            markChanged("Data");
        }
    }

    public int size() {
        checkLive();
        return data.length;
    }

    @Override
    public FieldAccess fields() {
        checkLive();
        return FIELDS.bind(this);
    }

    @Override
    protected void onDispose() {
        data = new byte[0];
    }
}
