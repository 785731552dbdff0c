package com.questrail.assetcodec.resources.preset;

import com.questrail.assetcodec.api.CycleConflictException;
import com.questrail.assetcodec.api.FieldAccess;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.api.ResourceValue;
import com.questrail.assetcodec.core.AbstractResourceInstance;
import com.questrail.assetcodec.core.ResourceFieldTable;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * PresetResource
 * -----------------------------------------------------------------------------
 * Named, versioned bag of key/value settings that can inherit from a parent
 * preset.
 *
 * <h2>Inheritance</h2>
 * {@link #getValue(String, Class)} looks in this preset first and then walks
 * the parent chain. The parent link is a runtime relationship only: it is not
 * part of the payload and is not restored by parsing.
 *
 * <p>{@link #setParent(PresetResource)} refuses any assignment that would
 * make the chain cyclic, including a preset becoming its own parent. The
 * refused call leaves both presets unchanged.</p>
 *
 * <h2>Values</h2>
 * Values are {@link ResourceValue}s. Integer values must fit in 32 bits
 * because the payload stores them as {@code i32}.
 */
public final class PresetResource extends AbstractResourceInstance
{
    public static final ResourceTypeId TYPE_ID = ResourceTypeId.of(0x4E69E952, "PRES");

    static final String DEFAULT_TYPE = "";
    static final String DEFAULT_NAME = "Unnamed";

    private static final ResourceFieldTable<PresetResource> FIELDS =
            ResourceFieldTable.<PresetResource>builder("PresetResource")
                    .writable("PresetType", String.class, PresetResource::presetType, PresetResource::setPresetType)
                    .writable("PresetName", String.class, PresetResource::presetName, PresetResource::setPresetName)
                    .writable("PresetVersion", String.class, PresetResource::versionString,
                            PresetResource::setVersionString)
                    .readOnly("Data", Integer.class, PresetResource::count)
                    .build();

    private final LinkedHashMap<String, ResourceValue> data = new LinkedHashMap<>();
    private String presetType;
    private String presetName;
    private int majorVersion = 1;
    private int minorVersion;
    private PresetResource parent;

    public PresetResource() {
        this(DEFAULT_TYPE, DEFAULT_NAME);
    }

    public PresetResource(String presetType, String presetName) {
        super(TYPE_ID);
        this.presetType = Objects.requireNonNull(presetType, "presetType");
        this.presetName = Objects.requireNonNull(presetName, "presetName");
    }

    void load(int major, int minor, String type, String name, LinkedHashMap<String, ResourceValue> parsed) {
        this.majorVersion = major;
        this.minorVersion = minor;
        this.presetType = type;
        this.presetName = name;
        this.data.clear();
        this.data.putAll(parsed);
    }

    /**
     * Returns the major preset version.
     */
    @Override
    public long version() {
        checkLive();
        return majorVersion;
    }

    public int majorVersion() {
        checkLive();
        return majorVersion;
    }

    public int minorVersion() {
        checkLive();
        return minorVersion;
    }

    public String presetType() {
        checkLive();
        return presetType;
    }

    public void setPresetType(String presetType) {
        checkLive();
        Objects.requireNonNull(presetType, "presetType");
        if (!this.presetType.equals(presetType)) {
            this.presetType = presetType;
            markChanged("PresetType");
        }
    }

    public String presetName() {
        checkLive();
        return presetName;
    }

    public void setPresetName(String presetName) {
        checkLive();
        Objects.requireNonNull(presetName, "presetName");
        if (!this.presetName.equals(presetName)) {
            this.presetName = presetName;
            markChanged("PresetName");
        }
    }

    /**
     * Returns the version as {@code "major.minor"}.
     */
    public String versionString() {
        checkLive();
        return majorVersion + "." + minorVersion;
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not {@code "major.minor"}
     */
    void setVersionString(String text) {
        String[] parts = text.trim().split("\\.");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Expected 'major.minor' but was '" + text + "'");
        }
        try {
            setVersion(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Expected 'major.minor' but was '" + text + "'", e);
        }
    }

    public void setVersion(int major, int minor) {
        checkLive();
        if (major < 0 || minor < 0) {
            throw new IllegalArgumentException("Version components must not be negative");
        }
        if (major != majorVersion || minor != minorVersion) {
            majorVersion = major;
            minorVersion = minor;
            markChanged("PresetVersion");
        }
    }

    public int count() {
        checkLive();
        return data.size();
    }

    public boolean containsKey(String key) {
        checkLive();
        return data.containsKey(key);
    }

    /**
     * Looks up {@code key} in this preset, then along the parent chain.
     */
    public Optional<ResourceValue> getValue(String key) {
        checkLive();
        Objects.requireNonNull(key, "key");
        for (PresetResource p = this; p != null; p = p.parent) {
            ResourceValue v = p.data.get(key);
            if (v != null) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * Looks up {@code key} like {@link #getValue(String)} and converts the
     * nearest value to {@code type}. Empty if the key is absent everywhere or
     * the nearest value cannot be converted.
     */
    public <T> Optional<T> getValue(String key, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return getValue(key).flatMap(v -> v.as(type));
    }

    /**
     * @throws IllegalArgumentException if {@code value} is not a supported kind
     *                                  or is an integer outside the 32-bit range
     */
    public void setValue(String key, Object value) {
        checkLive();
        Objects.requireNonNull(key, "key");
        ResourceValue v = ResourceValue.from(value);
        if (v instanceof ResourceValue.IntegerValue iv
                && (iv.value() < Integer.MIN_VALUE || iv.value() > Integer.MAX_VALUE)) {
            throw new IllegalArgumentException("Preset integers are 32-bit; " + iv.value() + " is out of range");
        }
        if (v.equals(data.get(key))) {
            return;
        }
        data.put(key, v);
        markChanged("Data");
    }

    public boolean removeValue(String key) {
        checkLive();
        if (data.remove(key) == null) {
            return false;
        }
        markChanged("Data");
        return true;
    }

    /**
     * Returns an insertion-ordered copy of this preset's own values.
     */
    public Map<String, ResourceValue> data() {
        checkLive();
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public Optional<PresetResource> parent() {
        checkLive();
        return Optional.ofNullable(parent);
    }

    /**
     * Sets or clears ({@code null}) the parent preset.
     *
     * @throws CycleConflictException if {@code newParent} is this preset or has it as an ancestor
     */
    public void setParent(PresetResource newParent) {
        checkLive();
        if (newParent == parent) {
            return;
        }
        if (newParent != null) {
            for (PresetResource p = newParent; p != null; p = p.parent) {
                if (p == this) {
                    throw new CycleConflictException("Preset '" + presetName
                            + "' cannot inherit from '" + newParent.presetName + "': inheritance would be cyclic");
                }
            }
        }
        // not serialized, so the instance does not become dirty
        parent = newParent;
    }

    /**
     * Returns {@code true} if {@code candidate} appears in this preset's parent chain.
     */
    public boolean hasAncestor(PresetResource candidate) {
        checkLive();
        for (PresetResource p = parent; p != null; p = p.parent) {
            if (p == candidate) {
                return true;
            }
        }
        return false;
    }

    /**
     * Creates an empty preset of the same type and version whose parent is this preset.
     */
    public PresetResource createChild(String name) {
        checkLive();
        PresetResource child = new PresetResource(presetType, Objects.requireNonNull(name, "name"));
        child.majorVersion = majorVersion;
        child.minorVersion = minorVersion;
        child.parent = this;
        return child;
    }

    /**
     * Returns a copy at {@code major.minor} if that is newer than this preset's
     * version, otherwise this preset itself. The copy keeps the values and the
     * parent.
     */
    public PresetResource migrateToVersion(int major, int minor) {
        checkLive();
        if (major < majorVersion || (major == majorVersion && minor <= minorVersion)) {
            return this;
        }
        PresetResource migrated = new PresetResource(presetType, presetName);
        migrated.majorVersion = major;
        migrated.minorVersion = minor;
        migrated.data.putAll(data);
        migrated.parent = parent;
        return migrated;
    }

    /**
     * Checks that type and name are not blank and that the parent chain is acyclic.
     */
    public boolean validate() {
        checkLive();
        if (presetType.isBlank() || presetName.isBlank()) {
            return false;
        }
        Set<PresetResource> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (PresetResource p = this; p != null; p = p.parent) {
            if (!seen.add(p)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public FieldAccess fields() {
        checkLive();
        return FIELDS.bind(this);
    }

    @Override
    protected void onDispose() {
        data.clear();
        parent = null;
    }
}
