package com.questrail.assetcodec.api;

/**
 * Receives a notification each time a resource instance is mutated.
 *
 * <p>Listeners are invoked synchronously on the mutating thread, after the
 * change has been applied.</p>
 */
@FunctionalInterface
public interface ResourceChangeListener
{
    void onResourceChanged(ResourceChangeEvent event);
}
