package com.questrail.assetcodec.registry;

import com.questrail.assetcodec.api.DuplicateKeyConflictException;
import com.questrail.assetcodec.api.ResourceTypeId;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * RegistrySnapshot
 * -----------------------------------------------------------------------------
 * Immutable view of a registry's content at one instant.
 *
 * <p>Every mutation of {@link CodecRegistry} builds a new snapshot through one
 * of the {@code with*} methods and publishes it atomically; a snapshot that
 * has been handed out never changes. Resolution against a snapshot is a pure
 * function of its registrations.</p>
 *
 * <h2>Resolution order</h2>
 * Candidates for a type id are the enabled registrations that claim it,
 * sorted by descending priority, then by descending registration sequence.
 * The head of that list wins, so among equal priorities the most recently
 * registered codec is chosen.
 */
public final class RegistrySnapshot
{
    static final RegistrySnapshot EMPTY = new RegistrySnapshot(List.of(), Set.of(), Map.of());

    private static final Comparator<CodecHandle> RESOLUTION_ORDER =
            Comparator.<CodecHandle>comparingInt(h -> h.descriptor().priority())
                    .thenComparingLong(CodecHandle::sequence)
                    .reversed();

    private final List<CodecHandle> registrations;
    private final Set<CodecHandle> disabled;
    private final Map<String, ResourceTypeId> aliases;
    private final Map<ResourceTypeId, List<CodecHandle>> candidates;

    private RegistrySnapshot(List<CodecHandle> registrations,
                             Set<CodecHandle> disabled,
                             Map<String, ResourceTypeId> aliases) {
        this.registrations = List.copyOf(registrations);
        this.disabled = Collections.unmodifiableSet(newIdentitySet(disabled));
        this.aliases = Map.copyOf(aliases);
        this.candidates = indexCandidates(this.registrations, this.disabled);
    }

    private static Map<ResourceTypeId, List<CodecHandle>> indexCandidates(List<CodecHandle> registrations,
                                                                          Set<CodecHandle> disabled) {
        Map<ResourceTypeId, List<CodecHandle>> tmp = new HashMap<>();
        for (CodecHandle h : registrations) {
            if (disabled.contains(h)) {
                continue;
            }
            for (ResourceTypeId id : h.descriptor().typeIds()) {
                tmp.computeIfAbsent(id, k -> new ArrayList<>()).add(h);
            }
        }
        Map<ResourceTypeId, List<CodecHandle>> out = new HashMap<>(tmp.size() * 2);
        for (Map.Entry<ResourceTypeId, List<CodecHandle>> e : tmp.entrySet()) {
            List<CodecHandle> list = e.getValue();
            list.sort(RESOLUTION_ORDER);
            out.put(e.getKey(), List.copyOf(list));
        }
        return Collections.unmodifiableMap(out);
    }

    private static Set<CodecHandle> newIdentitySet(Collection<CodecHandle> content) {
        Set<CodecHandle> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(content);
        return set;
    }

    /**
     * Returns the winning codec for {@code typeId}, if any.
     */
    public Optional<CodecDescriptor<?>> resolve(ResourceTypeId typeId) {
        List<CodecHandle> list = candidates.get(Objects.requireNonNull(typeId, "typeId"));
        if (list == null || list.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(list.get(0).descriptor());
    }

    /**
     * Returns the enabled candidates for {@code typeId} in resolution order.
     */
    public List<CodecDescriptor<?>> candidates(ResourceTypeId typeId) {
        List<CodecHandle> list = candidates.getOrDefault(typeId, List.of());
        List<CodecDescriptor<?>> out = new ArrayList<>(list.size());
        for (CodecHandle h : list) {
            out.add(h.descriptor());
        }
        return Collections.unmodifiableList(out);
    }

    public Optional<ResourceTypeId> aliasTarget(String mnemonic) {
        return Optional.ofNullable(aliases.get(mnemonic));
    }

    public Map<String, ResourceTypeId> aliases() {
        return aliases;
    }

    /**
     * Returns every registration, enabled or not, in registration order.
     */
    public List<CodecHandle> registrations() {
        return registrations;
    }

    public boolean contains(CodecHandle handle) {
        for (CodecHandle h : registrations) {
            if (h == handle) {
                return true;
            }
        }
        return false;
    }

    public boolean isDisabled(CodecHandle handle) {
        return disabled.contains(handle);
    }

    public int disabledCount() {
        return disabled.size();
    }

    /**
     * Type ids claimed by at least one enabled registration.
     */
    public Set<ResourceTypeId> resolvableTypeIds() {
        return candidates.keySet();
    }

    RegistrySnapshot withRegistered(CodecHandle handle) {
        List<CodecHandle> next = new ArrayList<>(registrations);
        next.add(handle);
        return new RegistrySnapshot(next, disabled, aliases);
    }

    RegistrySnapshot withUnregistered(CodecHandle handle) {
        if (!contains(handle)) {
            return this;
        }
        List<CodecHandle> next = new ArrayList<>(registrations.size());
        for (CodecHandle h : registrations) {
            if (h != handle) {
                next.add(h);
            }
        }
        Set<CodecHandle> nextDisabled = newIdentitySet(disabled);
        nextDisabled.remove(handle);
        return new RegistrySnapshot(next, nextDisabled, aliases);
    }

    RegistrySnapshot withDisabled(CodecHandle handle, boolean disable) {
        if (!contains(handle) || disabled.contains(handle) == disable) {
            return this;
        }
        Set<CodecHandle> nextDisabled = newIdentitySet(disabled);
        if (disable) {
            nextDisabled.add(handle);
        }
        else {
            nextDisabled.remove(handle);
        }
        return new RegistrySnapshot(registrations, nextDisabled, aliases);
    }

    /**
     * @throws DuplicateKeyConflictException if {@code mnemonic} is bound to a different id
     */
    RegistrySnapshot withAlias(String mnemonic, ResourceTypeId typeId) {
        ResourceTypeId existing = aliases.get(mnemonic);
        if (existing != null) {
            if (existing.equals(typeId)) {
                return this;
            }
            throw new DuplicateKeyConflictException(mnemonic,
                    "Alias '" + mnemonic + "' is already bound to " + existing.toHex());
        }
        Map<String, ResourceTypeId> next = new HashMap<>(aliases);
        next.put(mnemonic, typeId);
        return new RegistrySnapshot(registrations, disabled, next);
    }
}
