package com.questrail.assetcodec.resources.preset;

import com.questrail.assetcodec.api.FieldAccess;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.core.AbstractResourceInstance;
import com.questrail.assetcodec.core.ResourceFieldTable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered list of character-creation presets saved by a player, preceded by a
 * small header of which only the version is understood.
 */
public final class UserCasPresetResource extends AbstractResourceInstance
{
    public static final ResourceTypeId TYPE_ID = ResourceTypeId.of(0x0591B1AF);
    public static final long SUPPORTED_VERSION = 3;

    private static final ResourceFieldTable<UserCasPresetResource> FIELDS =
            ResourceFieldTable.<UserCasPresetResource>builder("UserCasPresetResource")
                    .readOnly("Version", Long.class, UserCasPresetResource::version)
                    .writable("Unknown1", Long.class, UserCasPresetResource::unknown1, UserCasPresetResource::setUnknown1)
                    .writable("Unknown2", Long.class, UserCasPresetResource::unknown2, UserCasPresetResource::setUnknown2)
                    .writable("Unknown3", Long.class, UserCasPresetResource::unknown3, UserCasPresetResource::setUnknown3)
                    .readOnly("Count", Integer.class, UserCasPresetResource::count)
                    .build();

    private final List<CasPreset> presets = new ArrayList<>();
    private long version = SUPPORTED_VERSION;
    private final long[] unknowns = new long[3];

    public UserCasPresetResource() {
        super(TYPE_ID);
    }

    void load(long version, long unknown1, long unknown2, long unknown3, List<CasPreset> parsed) {
        this.version = version;
        this.unknowns[0] = unknown1;
        this.unknowns[1] = unknown2;
        this.unknowns[2] = unknown3;
        this.presets.clear();
        this.presets.addAll(parsed);
    }

    @Override
    public long version() {
        checkLive();
        return version;
    }

    public long unknown1() {
        checkLive();
        return unknowns[0];
    }

    public void setUnknown1(long value) {
        setUnknown(0, value, "Unknown1");
    }

    public long unknown2() {
        checkLive();
        return unknowns[1];
    }

    public void setUnknown2(long value) {
        setUnknown(1, value, "Unknown2");
    }

    public long unknown3() {
        checkLive();
        return unknowns[2];
    }

    public void setUnknown3(long value) {
        setUnknown(2, value, "Unknown3");
    }

    public int count() {
        checkLive();
        return presets.size();
    }

    public List<CasPreset> presets() {
        checkLive();
        return List.copyOf(presets);
    }

    public CasPreset preset(int index) {
        checkLive();
        return presets.get(index);
    }

    public void addPreset(CasPreset preset) {
        checkLive();
        presets.add(Objects.requireNonNull(preset, "preset"));
        markChanged("Presets");
    }

    public void setPreset(int index, CasPreset preset) {
        checkLive();
        Objects.requireNonNull(preset, "preset");
        if (!presets.get(index).equals(preset)) {
            presets.set(index, preset);
            markChanged("Presets");
        }
    }

    public CasPreset removePreset(int index) {
        checkLive();
        CasPreset removed = presets.remove(index);
        markChanged("Presets");
        return removed;
    }

    public void clearPresets() {
        checkLive();
        if (!presets.isEmpty()) {
            presets.clear();
            markChanged("Presets");
        }
    }

    @Override
    public FieldAccess fields() {
        checkLive();
        return FIELDS.bind(this);
    }

    @Override
    protected void onDispose() {
        presets.clear();
    }

    private void setUnknown(int slot, long value, String field) {
        checkLive();
        if (value < 0 || value > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException(field + " must be an unsigned 32-bit value, was " + value);
        }
        if (unknowns[slot] != value) {
            unknowns[slot] = value;
            markChanged(field);
        }
    }
}
