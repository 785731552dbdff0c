package com.questrail.assetcodec.core;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.DegradationReason;
import com.questrail.assetcodec.api.ParseDiagnostic;
import com.questrail.assetcodec.api.ResourceChangeListener;
import com.questrail.assetcodec.api.ResourceState;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.resources.ngmp.NgmpCodec;
import com.questrail.assetcodec.resources.ngmp.NgmpResource;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle bookkeeping shared by every resource.
 */
final class AbstractResourceInstanceTest
{
    @Test
    void lifecycleFollowsMutationsAndSerialization()
    {
        NgmpResource r = new NgmpResource();
        assertEquals(ResourceState.CREATED, r.state());

        ((AbstractResourceInstance) r).markPopulated(List.of());
        assertEquals(ResourceState.POPULATED, r.state());
        assertFalse(r.isDirty());

        r.upsert(1L, 2L);
        assertEquals(ResourceState.MUTATED, r.state());
        assertTrue(r.isDirty());

        ((AbstractResourceInstance) r).markSerialized();
        assertEquals(ResourceState.SERIALIZED, r.state());
        assertFalse(r.isDirty());

        r.dispose();
        assertEquals(ResourceState.DISPOSED, r.state());
    }

    @Test
    void onlyTheCodecDriverCanCompleteALifecycleStep() throws NoSuchMethodException
    {
        Method populated = AbstractResourceInstance.class.getDeclaredMethod("markPopulated", List.class);
        Method serialized = AbstractResourceInstance.class.getDeclaredMethod("markSerialized");
        assertFalse(Modifier.isPublic(populated.getModifiers()));
        assertFalse(Modifier.isProtected(populated.getModifiers()));
        assertFalse(Modifier.isPublic(serialized.getModifiers()));
        assertFalse(Modifier.isProtected(serialized.getModifiers()));

        NgmpCodec codec = new NgmpCodec(ParseLimits.defaults());
        NgmpResource r = codec.parse(new byte[0], CancellationSignal.NONE);
        assertEquals(ResourceState.POPULATED, r.state());

        r.upsert(7L, 8L);
        codec.serialize(r, CancellationSignal.NONE);
        assertEquals(ResourceState.SERIALIZED, r.state());
        assertFalse(r.isDirty());
    }

    @Test
    void validityFollowsDegradingDiagnostics()
    {
        NgmpResource r = new NgmpResource();
        ((AbstractResourceInstance) r).markPopulated(List.of(new ParseDiagnostic("pairs", DegradationReason.DUPLICATE_KEY, 8, "note", false)));
        assertTrue(r.hasValidData());

        ((AbstractResourceInstance) r).markPopulated(List.of(new ParseDiagnostic("pairs", DegradationReason.TRUNCATED, 8, "cut", true)));
        assertFalse(r.hasValidData());
        assertEquals(1, r.diagnostics().size());
    }

    @Test
    void everyAccessorFailsAfterDispose()
    {
        NgmpResource r = new NgmpResource();
        r.dispose();
        r.dispose();

        assertThrows(IllegalStateException.class, r::count);
        assertThrows(IllegalStateException.class, r::isDirty);
        assertThrows(IllegalStateException.class, r::hasValidData);
        assertThrows(IllegalStateException.class, () -> r.upsert(1L, 1L));
        assertThrows(IllegalStateException.class, () -> r.addChangeListener(e -> { }));
        assertEquals("NgmpResource (Disposed)", r.toString());
    }

    @Test
    void removedListenerIsNotNotified()
    {
        NgmpResource r = new NgmpResource();
        AtomicInteger calls = new AtomicInteger();
        ResourceChangeListener l = e -> calls.incrementAndGet();

        r.addChangeListener(l);
        r.upsert(1L, 1L);
        r.removeChangeListener(l);
        r.upsert(2L, 2L);

        assertEquals(1, calls.get());
    }
}
