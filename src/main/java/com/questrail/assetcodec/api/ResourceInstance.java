package com.questrail.assetcodec.api;

import java.util.List;

/**
 * ResourceInstance
 * -----------------------------------------------------------------------------
 * The in-memory form of one parsed (or freshly created) resource payload.
 *
 * <h2>Core Semantics</h2>
 * <ul>
 *   <li>An instance belongs to exactly one format, identified by
 *       {@link #typeId()}, and carries the format {@link #version()} that
 *       decides its serialized layout.</li>
 *   <li>An instance is created empty by a codec's {@code create()} or populated
 *       by its {@code parse(..)}; the codec registry never retains it.</li>
 *   <li>Mutation happens through typed setters or {@link #fields()}. Every
 *       mutation sets the dirty flag and notifies change listeners.</li>
 * </ul>
 *
 * <h2>Validity</h2>
 * A payload whose mandatory header parsed but one of whose optional sections
 * could not be read safely still yields an instance. Such an instance reports
 * {@link #hasValidData()} {@code == false} and lists the reasons in
 * {@link #diagnostics()}. Serializing it reproduces its partial state as-is;
 * nothing is repaired.
 *
 * <h2>Thread Safety</h2>
 * Instances are single-owner: concurrent mutation from two threads is not
 * supported unless an implementation documents otherwise.
 */
public interface ResourceInstance
{
    ResourceTypeId typeId();

    /**
     * Returns the format version that governs this instance's layout.
     */
    long version();

    /**
     * Returns {@code false} if any section was abandoned while parsing.
     */
    boolean hasValidData();

    List<ParseDiagnostic> diagnostics();

    boolean isDirty();

    ResourceState state();

    FieldAccess fields();

    void addChangeListener(ResourceChangeListener listener);

    void removeChangeListener(ResourceChangeListener listener);

    /**
     * Releases the instance. Every later accessor call throws
     * {@link IllegalStateException}. Disposing twice is harmless.
     */
    void dispose();
}
