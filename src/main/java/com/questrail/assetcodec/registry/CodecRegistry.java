package com.questrail.assetcodec.registry;

import com.questrail.assetcodec.api.DuplicateKeyConflictException;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.observability.CodecObservabilitySink;
import com.questrail.assetcodec.observability.NullObservabilitySink;
import com.questrail.assetcodec.observability.RegistryChangeEvent;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.UnaryOperator;

/**
 * CodecRegistry
 * =============================================================================
 * Maps resource type ids to the codecs that can parse and serialize them.
 *
 * <h2>Architectural Role</h2>
 * The registry is a plain value owned by whoever builds it. There is no
 * process-wide instance and nothing is discovered automatically: codecs are
 * added only through {@link #register}, typically by
 * {@link StandardCodecs#registerAll} or by a caller's own bootstrap code.
 * Tests create a fresh registry per test.
 *
 * <h2>Resolution</h2>
 * {@link #resolve(ResourceTypeId)} returns the enabled codec with the highest
 * priority that claims the id; among equal priorities the most recently
 * registered codec wins. A miss is reported as {@link Optional#empty()}.
 * What to do with an unclaimed payload is the caller's decision.
 *
 * <h2>Thread Safety</h2>
 * State lives in one immutable {@link RegistrySnapshot} held by an
 * {@link AtomicReference}. Mutators build a new snapshot and publish it with
 * compare-and-set, retrying on contention; readers never lock and always see
 * one complete snapshot.
 *
 * <h2>Observability</h2>
 * Each effective mutation is reported to the {@link CodecObservabilitySink}
 * after it has been published. No-op mutations are not reported.
 */
public final class CodecRegistry
{
    private final AtomicReference<RegistrySnapshot> current = new AtomicReference<>(RegistrySnapshot.EMPTY);
    private final AtomicLong sequence = new AtomicLong();
    private final LongAdder resolveCount = new LongAdder();
    private final LongAdder missCount = new LongAdder();

    private final CodecObservabilitySink sink;
    private final Clock clock;

    public CodecRegistry() {
        this(NullObservabilitySink.INSTANCE);
    }

    public CodecRegistry(CodecObservabilitySink sink) {
        this(sink, Clock.systemUTC());
    }

    public CodecRegistry(CodecObservabilitySink sink, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    // ---------------------------------------------------------------------
    // Mutation
    // ---------------------------------------------------------------------

    public CodecHandle register(CodecDescriptor<?> descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        CodecHandle handle = new CodecHandle(sequence.incrementAndGet(), descriptor);
        update(s -> s.withRegistered(handle));
        emit(RegistryChangeEvent.Kind.REGISTERED, descriptor);
        return handle;
    }

    /**
     * @return {@code false} if the handle was already removed or belongs to another registry
     */
    public boolean unregister(CodecHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (!update(s -> s.withUnregistered(handle))) {
            return false;
        }
        emit(RegistryChangeEvent.Kind.UNREGISTERED, handle.descriptor());
        return true;
    }

    /**
     * Keeps the registration but excludes it from resolution.
     *
     * @return {@code true} if the codec was enabled and is now disabled
     */
    public boolean disable(CodecHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (!update(s -> s.withDisabled(handle, true))) {
            return false;
        }
        emit(RegistryChangeEvent.Kind.DISABLED, handle.descriptor());
        return true;
    }

    /**
     * @return {@code true} if the codec was disabled and is now enabled
     */
    public boolean enable(CodecHandle handle) {
        Objects.requireNonNull(handle, "handle");
        if (!update(s -> s.withDisabled(handle, false))) {
            return false;
        }
        emit(RegistryChangeEvent.Kind.ENABLED, handle.descriptor());
        return true;
    }

    /**
     * Binds a mnemonic such as {@code "PRES"} to a type id for
     * {@link #resolve(String)}.
     *
     * @return {@code false} if the mnemonic was already bound to the same id
     * @throws DuplicateKeyConflictException if the mnemonic is bound to a different id
     */
    public boolean registerAlias(String mnemonic, ResourceTypeId typeId) {
        Objects.requireNonNull(mnemonic, "mnemonic");
        Objects.requireNonNull(typeId, "typeId");
        if (mnemonic.isBlank()) {
            throw new IllegalArgumentException("mnemonic must not be blank");
        }
        if (!update(s -> s.withAlias(mnemonic, typeId))) {
            return false;
        }
        sink.onRegistryChange(new RegistryChangeEvent(
                clock.instant(), RegistryChangeEvent.Kind.ALIAS_BOUND, mnemonic, Set.of(typeId), 0));
        return true;
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public Optional<CodecDescriptor<?>> resolve(ResourceTypeId typeId) {
        Objects.requireNonNull(typeId, "typeId");
        resolveCount.increment();
        Optional<CodecDescriptor<?>> result = current.get().resolve(typeId);
        if (result.isEmpty()) {
            missCount.increment();
        }
        return result;
    }

    /**
     * Resolves a bound mnemonic, or hexadecimal text such as {@code "0x4E69E952"}.
     */
    public Optional<CodecDescriptor<?>> resolve(String typeIdOrAlias) {
        Objects.requireNonNull(typeIdOrAlias, "typeIdOrAlias");
        Optional<ResourceTypeId> id = toTypeId(typeIdOrAlias);
        if (id.isEmpty()) {
            resolveCount.increment();
            missCount.increment();
            return Optional.empty();
        }
        return resolve(id.get());
    }

    /**
     * Maps a bound mnemonic or hexadecimal text to a type id.
     */
    public Optional<ResourceTypeId> toTypeId(String typeIdOrAlias) {
        String key = typeIdOrAlias.trim();
        Optional<ResourceTypeId> aliased = current.get().aliasTarget(key);
        return aliased.isPresent() ? aliased : ResourceTypeId.parseHex(key);
    }

    public boolean supports(ResourceTypeId typeId) {
        return current.get().resolve(typeId).isPresent();
    }

    public boolean isDisabled(CodecHandle handle) {
        return current.get().isDisabled(handle);
    }

    public List<CodecHandle> registrations() {
        return current.get().registrations();
    }

    public RegistrySnapshot snapshot() {
        return current.get();
    }

    public RegistryStatistics statistics() {
        RegistrySnapshot s = current.get();
        Map<Integer, Integer> byPriority = new TreeMap<>();
        for (CodecHandle h : s.registrations()) {
            byPriority.merge(h.descriptor().priority(), 1, Integer::sum);
        }
        return new RegistryStatistics(
                s.registrations().size(),
                s.disabledCount(),
                s.resolvableTypeIds().size(),
                s.aliases().size(),
                byPriority,
                resolveCount.sum(),
                missCount.sum());
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    /**
     * Applies {@code change} with compare-and-set, retrying on contention.
     *
     * @return {@code false} if {@code change} returned the snapshot unchanged
     */
    private boolean update(UnaryOperator<RegistrySnapshot> change) {
        while (true) {
            RegistrySnapshot prev = current.get();
            RegistrySnapshot next = change.apply(prev);
            if (next == prev) {
                return false;
            }
            if (current.compareAndSet(prev, next)) {
                return true;
            }
        }
    }

    private void emit(RegistryChangeEvent.Kind kind, CodecDescriptor<?> d) {
        sink.onRegistryChange(new RegistryChangeEvent(clock.instant(), kind, d.name(), d.typeIds(), d.priority()));
    }
}
