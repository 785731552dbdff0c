package com.questrail.assetcodec.resources.hashmap;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.api.DuplicateKeyConflictException;
import com.questrail.assetcodec.api.ResourceValue;
import com.questrail.assetcodec.config.ParseLimits;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class HashMapResourceTest
{
    @Test
    void addDuplicateKeyIsRejectedWithoutEffect()
    {
        HashMapResource map = new HashMapResource();
        map.addValue(5, "first");

        DuplicateKeyConflictException e = assertThrows(DuplicateKeyConflictException.class,
                () -> map.addValue(5, "second"));
        assertEquals("5", e.key());
        assertEquals(Optional.of(ResourceValue.text("first")), map.getValue(5));
        assertEquals(1, map.count());
    }

    @Test
    void setValueReplacesInPlace()
    {
        HashMapResource map = new HashMapResource();
        map.setValue(1, "a");
        map.setValue(2, "b");
        map.setValue(1, "c");

        assertEquals(List.of(1, 2), map.keys());
        assertEquals(Optional.of("c"), map.getValue(1, String.class));
    }

    @Test
    void settingSameValueDoesNotDirty()
    {
        HashMapResource map = new HashMapResource();
        map.setValue(1, 10);
        new HashMapCodec(ParseLimits.defaults()).serialize(map, CancellationSignal.NONE);
        assertFalse(map.isDirty());

        map.setValue(1, 10L);

        assertFalse(map.isDirty());
    }

    @Test
    void capacityGrowsByDoublingPastLoadFactor()
    {
        HashMapResource map = new HashMapResource();
        assertEquals(0, map.capacity());

        for (int i = 0; i < 3; i++) {
            map.setValue(i, i);
        }
        assertEquals(4, map.capacity());

        map.setValue(3, 3);
        assertEquals(8, map.capacity());
        assertEquals(0.5, map.loadFactor(), 1e-9);
    }

    @Test
    void ensureCapacityCannotDropBelowCount()
    {
        HashMapResource map = new HashMapResource();
        map.setValue(1, 1);
        map.setValue(2, 2);

        assertThrows(IllegalArgumentException.class, () -> map.ensureCapacity(1));
        map.ensureCapacity(100);
        assertEquals(100, map.capacity());
    }

    @Test
    void removeAndClear()
    {
        HashMapResource map = new HashMapResource();
        map.setValue(1, true);
        map.setValue(2, new byte[] { 1 });

        assertTrue(map.remove(1));
        assertFalse(map.remove(1));
        assertFalse(map.containsKey(1));

        map.clear();
        assertEquals(0, map.count());
    }

    @Test
    void versionOutsideSupportedRangeIsRejected()
    {
        HashMapResource map = new HashMapResource();
        assertThrows(IllegalArgumentException.class, () -> map.setVersion(2));
        assertThrows(IllegalArgumentException.class, () -> map.setVersion(-1));
    }
}
