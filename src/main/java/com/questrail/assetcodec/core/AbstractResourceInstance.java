package com.questrail.assetcodec.core;

import com.questrail.assetcodec.api.ParseDiagnostic;
import com.questrail.assetcodec.api.ResourceChangeEvent;
import com.questrail.assetcodec.api.ResourceChangeListener;
import com.questrail.assetcodec.api.ResourceInstance;
import com.questrail.assetcodec.api.ResourceState;
import com.questrail.assetcodec.api.ResourceTypeId;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * AbstractResourceInstance
 * -----------------------------------------------------------------------------
 * A format-neutral base implementation of {@link ResourceInstance} that
 * centralizes the bookkeeping every resource shares.
 *
 * <h2>What this class does</h2>
 * <ul>
 *   <li>Tracks the lifecycle {@link ResourceState} and the dirty flag</li>
 *   <li>Holds parse diagnostics and derives {@link #hasValidData()} from them</li>
 *   <li>Dispatches {@link ResourceChangeEvent}s to registered listeners</li>
 *   <li>Rejects every access once the instance has been disposed</li>
 * </ul>
 *
 * <h2>What this class does NOT do</h2>
 * It knows nothing about byte layout. Reading and writing payloads is the job
 * of the codec paired with each concrete subclass.
 *
 * <h2>Mutation protocol</h2>
 * Subclasses call {@link #checkLive()} at the top of every accessor and
 * {@link #markChanged(String)} after every applied mutation. A setter that is
 * handed the value the field already holds must not call
 * {@link #markChanged(String)}.
 */
public abstract class AbstractResourceInstance implements ResourceInstance
{
    private final ResourceTypeId typeId;
    private final List<ResourceChangeListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ResourceState state = ResourceState.CREATED;
    private volatile boolean dirty;
    private volatile List<ParseDiagnostic> diagnostics = List.of();

    protected AbstractResourceInstance(ResourceTypeId typeId) {
        this.typeId = Objects.requireNonNull(typeId, "typeId");
    }

    /**
     * Short human-readable kind used in error messages, e.g. {@code "HashMapResource"}.
     */
    protected String resourceKind() {
        return getClass().getSimpleName();
    }

    @Override
    public final ResourceTypeId typeId() {
        return typeId;
    }

    @Override
    public final boolean hasValidData() {
        checkLive();
        for (ParseDiagnostic d : diagnostics) {
            if (d.degrading()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public final List<ParseDiagnostic> diagnostics() {
        checkLive();
        return diagnostics;
    }

    @Override
    public final boolean isDirty() {
        checkLive();
        return dirty;
    }

    @Override
    public final ResourceState state() {
        return state;
    }

    @Override
    public final void addChangeListener(ResourceChangeListener listener) {
        Objects.requireNonNull(listener, "listener");
        checkLive();
        listeners.add(listener);
    }

    @Override
    public final void removeChangeListener(ResourceChangeListener listener) {
        listeners.remove(listener);
    }

    @Override
    public final void dispose() {
        if (state == ResourceState.DISPOSED) {
            return;
        }
        state = ResourceState.DISPOSED;
        listeners.clear();
        onDispose();
    }

    /**
     * Records that this instance was populated from a payload.
     *
     * <p>Invoked by {@link AbstractResourceCodec} once parsing has finished.
     * Clears the dirty flag.</p>
     */
    final void markPopulated(List<ParseDiagnostic> parseDiagnostics) {
        checkLive();
        this.diagnostics = List.copyOf(parseDiagnostics);
        this.dirty = false;
        this.state = ResourceState.POPULATED;
    }

    /**
     * Records that this instance has just been serialized. Clears the dirty flag.
     */
    final void markSerialized() {
        checkLive();
        this.dirty = false;
        this.state = ResourceState.SERIALIZED;
    }

    /**
     * Hook for subclasses to drop their content when disposed.
     */
    protected void onDispose() {
    }

    protected final void checkLive() {
        if (state == ResourceState.DISPOSED) {
            throw new IllegalStateException(resourceKind() + " has been disposed");
        }
    }

    /**
     * Marks the instance dirty and notifies listeners that {@code fieldName}
     * changed.
     */
    protected final void markChanged(String fieldName) {
        checkLive();
        dirty = true;
        state = ResourceState.MUTATED;

        ResourceChangeEvent event = new ResourceChangeEvent(this, fieldName);
        for (ResourceChangeListener l : listeners) {
            l.onResourceChanged(event);
        }
    }

    @Override
    public String toString() {
        if (state == ResourceState.DISPOSED) {
            return resourceKind() + " (Disposed)";
        }
        return resourceKind() + " (Type: " + typeId.toHex() + ", Version: " + version() + ")";
    }
}
