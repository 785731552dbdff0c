package com.questrail.assetcodec.api;

import java.util.List;

/**
 * FieldAccess
 * -----------------------------------------------------------------------------
 * Uniform, name- or index-addressed view over the logical fields of a parsed
 * resource. Generic tooling (property grids, diff tools, scripted edits) uses
 * this view so it does not need to know each resource's concrete type.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>{@link #fieldNames()} is stable for the lifetime of the instance and
 *       defines the index order.</li>
 *   <li>An unknown name raises {@link UnknownFieldException}; an out-of-range
 *       index raises {@link IndexOutOfBoundsException}. Neither is ever a silent
 *       no-op.</li>
 *   <li>Writing a read-only field raises {@link UnsupportedOperationException};
 *       writing a value of an incompatible type raises
 *       {@link IllegalArgumentException}.</li>
 *   <li>A successful write marks the resource dirty and notifies its
 *       {@link ResourceChangeListener}s.</li>
 * </ul>
 */
public interface FieldAccess
{
    List<String> fieldNames();

    FieldValue get(String name);

    FieldValue get(int index);

    void set(String name, Object value);

    void set(int index, Object value);

    boolean isWritable(String name);
}
