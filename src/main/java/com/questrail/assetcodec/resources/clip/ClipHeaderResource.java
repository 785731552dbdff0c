package com.questrail.assetcodec.resources.clip;

import com.questrail.assetcodec.api.FieldAccess;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.core.AbstractResourceInstance;
import com.questrail.assetcodec.core.ResourceFieldTable;

import java.util.List;
import java.util.Objects;

/**
 * ClipHeaderResource
 * -----------------------------------------------------------------------------
 * Header of an animation clip: timing, initial offset, naming, namespace
 * bindings, slot assignments, events and the channel tables.
 *
 * <h2>Versioning</h2>
 * Several fields exist only from a given format version onwards (see
 * {@link ClipHeaderCodec}). They can be set on an instance of any version but
 * are written only when {@link #version()} reaches their threshold.
 *
 * <h2>Actor name</h2>
 * {@link #actorName()} is derived from the clip name: it is the text after the
 * last {@code '_'}, or the whole name if it contains none.
 */
public final class ClipHeaderResource extends AbstractResourceInstance
{
    public static final ResourceTypeId TYPE_ID = ResourceTypeId.of(0xBC4A5044);
    public static final long SUPPORTED_VERSION = 11;

    private static final ResourceFieldTable<ClipHeaderResource> FIELDS =
            ResourceFieldTable.<ClipHeaderResource>builder("ClipHeaderResource")
                    .writable("Version", Long.class, ClipHeaderResource::version, ClipHeaderResource::setVersion)
                    .writable("Flags", Integer.class, ClipHeaderResource::flags, ClipHeaderResource::setFlags)
                    .writable("Duration", Float.class, ClipHeaderResource::duration, ClipHeaderResource::setDuration)
                    .writable("ReferenceNamespaceHash", Integer.class,
                            ClipHeaderResource::referenceNamespaceHash, ClipHeaderResource::setReferenceNamespaceHash)
                    .writable("SurfaceNamespaceHash", Integer.class,
                            ClipHeaderResource::surfaceNamespaceHash, ClipHeaderResource::setSurfaceNamespaceHash)
                    .writable("SurfaceJointNameHash", Integer.class,
                            ClipHeaderResource::surfaceJointNameHash, ClipHeaderResource::setSurfaceJointNameHash)
                    .writable("SurfaceChildNamespaceHash", Integer.class,
                            ClipHeaderResource::surfaceChildNamespaceHash, ClipHeaderResource::setSurfaceChildNamespaceHash)
                    .writable("ClipName", String.class, ClipHeaderResource::clipName, ClipHeaderResource::setClipName)
                    .writable("RigName", String.class, ClipHeaderResource::rigName, ClipHeaderResource::setRigName)
                    .readOnly("ActorName", String.class, ClipHeaderResource::actorName)
                    .readOnly("SlotAssignmentCount", Integer.class, r -> r.slotAssignments().size())
                    .readOnly("EventCount", Integer.class, r -> r.events().size())
                    .readOnly("ClipDataCount", Integer.class, r -> r.primaryClipData().size())
                    .build();

    private long version = SUPPORTED_VERSION;
    private int flags;
    private float duration;
    private Rotation rotation = Rotation.IDENTITY;
    private Translation translation = Translation.ZERO;
    private int referenceNamespaceHash;
    private int surfaceNamespaceHash;
    private int surfaceJointNameHash;
    private int surfaceChildNamespaceHash;
    private String clipName = "";
    private String rigName = "";
    private List<String> explicitNamespaces = List.of();
    private List<SlotAssignment> slotAssignments = List.of();
    private List<ClipEvent> events = List.of();
    private List<ClipChannel> primaryClipData = List.of();
    private List<ClipChannel> secondaryClipData = List.of();
    private byte[] trailingData = new byte[0];

    public ClipHeaderResource() {
        super(TYPE_ID);
    }

    // ---------------------------------------------------------------------
    // Loading (used by the codec while the instance is still private to it)
    // ---------------------------------------------------------------------

    void loadVersion(long version) {
        this.version = version;
    }

    void loadHeader(int flags, float duration, Rotation rotation, Translation translation) {
        this.flags = flags;
        this.duration = duration;
        this.rotation = rotation;
        this.translation = translation;
    }

    void loadReferenceNamespaceHash(int hash) {
        this.referenceNamespaceHash = hash;
    }

    void loadSurfaceHashes(int namespaceHash, int jointNameHash) {
        this.surfaceNamespaceHash = namespaceHash;
        this.surfaceJointNameHash = jointNameHash;
    }

    void loadSurfaceChildNamespaceHash(int hash) {
        this.surfaceChildNamespaceHash = hash;
    }

    void loadClipName(String name) {
        this.clipName = name;
    }

    void loadRigName(String name) {
        this.rigName = name;
    }

    void loadExplicitNamespaces(List<String> namespaces) {
        this.explicitNamespaces = List.copyOf(namespaces);
    }

    void loadSlotAssignments(List<SlotAssignment> slots) {
        this.slotAssignments = List.copyOf(slots);
    }

    void loadEvents(List<ClipEvent> events) {
        this.events = List.copyOf(events);
    }

    void loadPrimaryClipData(List<ClipChannel> channels) {
        this.primaryClipData = List.copyOf(channels);
    }

    void loadSecondaryClipData(List<ClipChannel> channels) {
        this.secondaryClipData = List.copyOf(channels);
    }

    void loadTrailingData(byte[] data) {
        this.trailingData = data;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    @Override
    public long version() {
        checkLive();
        return version;
    }

    /**
     * Changes the layout version used by the next serialization. Fields
     * introduced after {@code version} keep their values but are not written.
     *
     * @throws IllegalArgumentException if {@code version} is negative or above {@link #SUPPORTED_VERSION}
     */
    public void setVersion(long version) {
        checkLive();
        if (version < 0 || version > SUPPORTED_VERSION) {
            throw new IllegalArgumentException("Unsupported clip header version " + version);
        }
        if (this.version != version) {
            this.version = version;
            markChanged("Version");
        }
    }

    public int flags() {
        checkLive();
        return flags;
    }

    public void setFlags(int flags) {
        checkLive();
        if (this.flags != flags) {
            this.flags = flags;
            markChanged("Flags");
        }
    }

    public float duration() {
        checkLive();
        return duration;
    }

    public void setDuration(float duration) {
        checkLive();
        if (Float.compare(this.duration, duration) != 0) {
            this.duration = duration;
            markChanged("Duration");
        }
    }

    public Rotation rotation() {
        checkLive();
        return rotation;
    }

    public void setRotation(Rotation rotation) {
        checkLive();
        Objects.requireNonNull(rotation, "rotation");
        if (!this.rotation.equals(rotation)) {
            this.rotation = rotation;
            markChanged("Rotation");
        }
    }

    public Translation translation() {
        checkLive();
        return translation;
    }

    public void setTranslation(Translation translation) {
        checkLive();
        Objects.requireNonNull(translation, "translation");
        if (!this.translation.equals(translation)) {
            this.translation = translation;
            markChanged("Translation");
        }
    }

    public int referenceNamespaceHash() {
        checkLive();
        return referenceNamespaceHash;
    }

    public void setReferenceNamespaceHash(int hash) {
        checkLive();
        if (referenceNamespaceHash != hash) {
            referenceNamespaceHash = hash;
            markChanged("ReferenceNamespaceHash");
        }
    }

    public int surfaceNamespaceHash() {
        checkLive();
        return surfaceNamespaceHash;
    }

    public void setSurfaceNamespaceHash(int hash) {
        checkLive();
        if (surfaceNamespaceHash != hash) {
            surfaceNamespaceHash = hash;
            markChanged("SurfaceNamespaceHash");
        }
    }

    public int surfaceJointNameHash() {
        checkLive();
        return surfaceJointNameHash;
    }

    public void setSurfaceJointNameHash(int hash) {
        checkLive();
        if (surfaceJointNameHash != hash) {
            surfaceJointNameHash = hash;
            markChanged("SurfaceJointNameHash");
        }
    }

    public int surfaceChildNamespaceHash() {
        checkLive();
        return surfaceChildNamespaceHash;
    }

    public void setSurfaceChildNamespaceHash(int hash) {
        checkLive();
        if (surfaceChildNamespaceHash != hash) {
            surfaceChildNamespaceHash = hash;
            markChanged("SurfaceChildNamespaceHash");
        }
    }

    public String clipName() {
        checkLive();
        return clipName;
    }

    public void setClipName(String clipName) {
        checkLive();
        Objects.requireNonNull(clipName, "clipName");
        if (!this.clipName.equals(clipName)) {
            this.clipName = clipName;
            markChanged("ClipName");
        }
    }

    public String rigName() {
        checkLive();
        return rigName;
    }

    public void setRigName(String rigName) {
        checkLive();
        Objects.requireNonNull(rigName, "rigName");
        if (!this.rigName.equals(rigName)) {
            this.rigName = rigName;
            markChanged("RigName");
        }
    }

    public String actorName() {
        checkLive();
        int cut = clipName.lastIndexOf('_');
        return cut < 0 ? clipName : clipName.substring(cut + 1);
    }

    public List<String> explicitNamespaces() {
        checkLive();
        return explicitNamespaces;
    }

    public void setExplicitNamespaces(List<String> namespaces) {
        checkLive();
        List<String> copy = List.copyOf(namespaces);
        if (!explicitNamespaces.equals(copy)) {
            explicitNamespaces = copy;
            markChanged("ExplicitNamespaces");
        }
    }

    public List<SlotAssignment> slotAssignments() {
        checkLive();
        return slotAssignments;
    }

    public void setSlotAssignments(List<SlotAssignment> slots) {
        checkLive();
        List<SlotAssignment> copy = List.copyOf(slots);
        if (!slotAssignments.equals(copy)) {
            slotAssignments = copy;
            markChanged("SlotAssignments");
        }
    }

    public List<ClipEvent> events() {
        checkLive();
        return events;
    }

    public void setEvents(List<ClipEvent> events) {
        checkLive();
        List<ClipEvent> copy = List.copyOf(events);
        if (!this.events.equals(copy)) {
            this.events = copy;
            markChanged("Events");
        }
    }

    public List<ClipChannel> primaryClipData() {
        checkLive();
        return primaryClipData;
    }

    public void setPrimaryClipData(List<ClipChannel> channels) {
        checkLive();
        List<ClipChannel> copy = List.copyOf(channels);
        if (!primaryClipData.equals(copy)) {
            primaryClipData = copy;
            markChanged("ClipData");
        }
    }

    public List<ClipChannel> secondaryClipData() {
        checkLive();
        return secondaryClipData;
    }

    public void setSecondaryClipData(List<ClipChannel> channels) {
        checkLive();
        List<ClipChannel> copy = List.copyOf(channels);
        if (!secondaryClipData.equals(copy)) {
            secondaryClipData = copy;
            markChanged("ClipData");
        }
    }

    /**
     * Bytes that followed the last known section of the parsed payload. They
     * are written back unchanged after the channel tables.
     */
    public byte[] trailingData() {
        checkLive();
        return trailingData.clone();
    }

    @Override
    public FieldAccess fields() {
        checkLive();
        return FIELDS.bind(this);
    }

    @Override
    protected void onDispose() {
        explicitNamespaces = List.of();
        slotAssignments = List.of();
        events = List.of();
        primaryClipData = List.of();
        secondaryClipData = List.of();
        trailingData = new byte[0];
    }
}
