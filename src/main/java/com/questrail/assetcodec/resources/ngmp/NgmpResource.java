package com.questrail.assetcodec.resources.ngmp;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.FieldAccess;
import com.questrail.assetcodec.api.ResourceTypeId;
import com.questrail.assetcodec.core.AbstractResourceInstance;
import com.questrail.assetcodec.core.ResourceFieldTable;
import com.questrail.assetcodec.hash.FnvHash;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * NgmpResource
 * -----------------------------------------------------------------------------
 * Ordered list of (name hash, instance) pairs with a lookup index kept in sync.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>The index maps every name hash in the list to the instance of its
 *       last occurrence.</li>
 *   <li>Mutations through this API never leave two pairs with the same name
 *       hash. A parsed payload may contain such duplicates; they are kept
 *       so the payload re-serializes unchanged.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Unlike the other resources, reads and writes of the pair list are guarded
 * by one lock, so an instance may be shared between threads. Change
 * listeners are notified after the lock has been released.
 */
public final class NgmpResource extends AbstractResourceInstance
{
    public static final ResourceTypeId TYPE_ID = ResourceTypeId.of(0xF3A38370, "NGMP");
    public static final long SUPPORTED_VERSION = 1;

    private static final ResourceFieldTable<NgmpResource> FIELDS =
            ResourceFieldTable.<NgmpResource>builder("NgmpResource")
                    .readOnly("Version", Long.class, NgmpResource::version)
                    .readOnly("Count", Integer.class, NgmpResource::count)
                    .build();

    private final Object lock = new Object();
    private List<NamePair> pairs = new ArrayList<>();
    private Map<Long, Long> index = new HashMap<>();

    public NgmpResource() {
        super(TYPE_ID);
    }

    void load(List<NamePair> parsed) {
        synchronized (lock) {
            pairs = new ArrayList<>(parsed);
            index = buildIndex(pairs);
        }
    }

    @Override
    public long version() {
        checkLive();
        return SUPPORTED_VERSION;
    }

    public int count() {
        checkLive();
        synchronized (lock) {
            return pairs.size();
        }
    }

    public boolean containsNameHash(long nameHash) {
        checkLive();
        synchronized (lock) {
            return index.containsKey(nameHash);
        }
    }

    public OptionalLong getInstance(long nameHash) {
        checkLive();
        synchronized (lock) {
            Long v = index.get(nameHash);
            return v == null ? OptionalLong.empty() : OptionalLong.of(v);
        }
    }

    public List<NamePair> pairs() {
        checkLive();
        synchronized (lock) {
            return List.copyOf(pairs);
        }
    }

    public List<Long> nameHashes() {
        checkLive();
        synchronized (lock) {
            List<Long> out = new ArrayList<>(pairs.size());
            for (NamePair p : pairs) {
                out.add(p.nameHash());
            }
            return Collections.unmodifiableList(out);
        }
    }

    public List<Long> instances() {
        checkLive();
        synchronized (lock) {
            List<Long> out = new ArrayList<>(pairs.size());
            for (NamePair p : pairs) {
                out.add(p.instance());
            }
            return Collections.unmodifiableList(out);
        }
    }

    /**
     * Removes every pair for {@code nameHash} and appends {@code (nameHash, instance)}.
     */
    public void upsert(long nameHash, long instance) {
        checkLive();
        boolean changed;
        synchronized (lock) {
            changed = applyUpsert(pairs, nameHash, instance);
            if (changed) {
                index.put(nameHash, instance);
            }
        }
        if (changed) {
            markChanged("Pairs");
        }
    }

    /**
     * Upserts under the FNV-1 64-bit hash of the lower-cased {@code name}.
     */
    public void upsert(String name, long instance) {
        upsert(FnvHash.fnv64(name), instance);
    }

    /**
     * Applies {@link #upsert(long, long)} for each pair in order. The batch is
     * built on a copy and committed only once every pair has been applied; if
     * {@code signal} is cancelled part-way the resource is left unchanged.
     */
    public void upsertAll(Collection<NamePair> batch, CancellationSignal signal) {
        checkLive();
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(signal, "signal");
        boolean changed = false;
        synchronized (lock) {
            List<NamePair> working = new ArrayList<>(pairs);
            for (NamePair p : batch) {
                signal.throwIfCancelled();
                changed |= applyUpsert(working, p.nameHash(), p.instance());
            }
            if (changed) {
                pairs = working;
                index = buildIndex(working);
            }
        }
        if (changed) {
            markChanged("Pairs");
        }
    }

    public boolean remove(long nameHash) {
        checkLive();
        boolean removed;
        synchronized (lock) {
            removed = pairs.removeIf(p -> p.nameHash() == nameHash);
            index.remove(nameHash);
        }
        if (removed) {
            markChanged("Pairs");
        }
        return removed;
    }

    public void clear() {
        checkLive();
        boolean changed;
        synchronized (lock) {
            changed = !pairs.isEmpty();
            pairs.clear();
            index.clear();
        }
        if (changed) {
            markChanged("Pairs");
        }
    }

    @Override
    public FieldAccess fields() {
        checkLive();
        return FIELDS.bind(this);
    }

    @Override
    protected void onDispose() {
        synchronized (lock) {
            pairs.clear();
            index.clear();
        }
    }

    /**
     * @return {@code false} if the list already ended with the only pair for {@code nameHash}
     */
    private static boolean applyUpsert(List<NamePair> list, long nameHash, long instance) {
        NamePair pair = new NamePair(nameHash, instance);
        if (!list.isEmpty() && list.get(list.size() - 1).equals(pair)) {
            int occurrences = 0;
            for (NamePair p : list) {
                if (p.nameHash() == nameHash) {
                    occurrences++;
                }
            }
            if (occurrences == 1) {
                return false;
            }
        }
        list.removeIf(p -> p.nameHash() == nameHash);
        list.add(pair);
        return true;
    }

    private static Map<Long, Long> buildIndex(List<NamePair> list) {
        Map<Long, Long> out = new HashMap<>(Math.max(16, list.size() * 2));
        for (NamePair p : list) {
            out.put(p.nameHash(), p.instance());
        }
        return out;
    }
}
