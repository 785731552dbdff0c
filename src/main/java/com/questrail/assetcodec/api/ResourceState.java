package com.questrail.assetcodec.api;

/**
 * Lifecycle state of a {@link ResourceInstance}.
 *
 * <pre>
 *   CREATED ──parse──▶ POPULATED ──mutate──▶ MUTATED ◀──▶ SERIALIZED
 *      │                   │                    │              │
 *      └───────────────────┴──────dispose───────┴──────────────┴──▶ DISPOSED
 * </pre>
 *
 * <p>No transition leaves {@link #DISPOSED}.</p>
 */
public enum ResourceState
{
    /** Default-valued instance produced by {@code create()}. */
    CREATED,

    /** Populated from a payload; not modified since. */
    POPULATED,

    /** Modified since it was created, parsed or last serialized. */
    MUTATED,

    /** Serialized since the last mutation. */
    SERIALIZED,

    /** Released by its owner. */
    DISPOSED
}
