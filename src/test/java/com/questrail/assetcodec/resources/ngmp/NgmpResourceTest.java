package com.questrail.assetcodec.resources.ngmp;

import com.questrail.assetcodec.api.CancellationSignal;
import com.questrail.assetcodec.config.ParseLimits;
import com.questrail.assetcodec.hash.FnvHash;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The pair list and the name-hash index must describe the same mapping after
 * every operation.
 */
final class NgmpResourceTest
{
    private static void assertConsistent(NgmpResource ngmp)
    {
        for (NamePair p : ngmp.pairs()) {
            assertEquals(OptionalLong.of(p.instance()), ngmp.getInstance(p.nameHash()));
        }
        assertEquals(ngmp.pairs().size(), ngmp.count());
    }

    @Test
    void upsertMovesPairToEnd()
    {
        NgmpResource ngmp = new NgmpResource();
        ngmp.upsert(1, 10);
        ngmp.upsert(2, 20);
        ngmp.upsert(1, 11);

        assertEquals(List.of(new NamePair(2, 20), new NamePair(1, 11)), ngmp.pairs());
        assertConsistent(ngmp);
    }

    @Test
    void upsertingLastPairAgainIsNoChange()
    {
        NgmpResource ngmp = new NgmpResource();
        ngmp.upsert(1, 10);
        new NgmpCodec(ParseLimits.defaults()).serialize(ngmp, CancellationSignal.NONE);
        assertFalse(ngmp.isDirty());

        ngmp.upsert(1, 10);

        assertFalse(ngmp.isDirty());
    }

    @Test
    void nameUpsertUsesLowerCaseFnv64()
    {
        NgmpResource ngmp = new NgmpResource();
        ngmp.upsert("Hair", 5);

        assertTrue(ngmp.containsNameHash(FnvHash.fnv64("hair")));
        assertEquals(0xF160317ED87587DDL, ngmp.nameHashes().get(0).longValue());
    }

    @Test
    void removeAndClearKeepIndexInSync()
    {
        NgmpResource ngmp = new NgmpResource();
        ngmp.upsert(1, 10);
        ngmp.upsert(2, 20);

        assertTrue(ngmp.remove(1));
        assertFalse(ngmp.remove(1));
        assertFalse(ngmp.containsNameHash(1));
        assertConsistent(ngmp);

        ngmp.clear();
        assertEquals(0, ngmp.count());
        assertTrue(ngmp.getInstance(2).isEmpty());
    }

    @Test
    void batchUpsertCommitsOnlyWhenComplete()
    {
        NgmpResource ngmp = new NgmpResource();
        ngmp.upsert(1, 10);

        CancellationSignal signal = CancellationSignal.create();
        List<NamePair> batch = new ArrayList<>();
        batch.add(new NamePair(2, 20));
        batch.add(new NamePair(3, 30));
        signal.cancel();

        assertThrows(CancellationException.class, () -> ngmp.upsertAll(batch, signal));
        assertEquals(List.of(new NamePair(1, 10)), ngmp.pairs());

        ngmp.upsertAll(batch, CancellationSignal.NONE);
        assertEquals(3, ngmp.count());
        assertConsistent(ngmp);
    }

    @Test
    void concurrentUpsertsStayConsistent() throws Exception
    {
        NgmpResource ngmp = new NgmpResource();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < 4; t++) {
                final long base = t * 1000L;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (long i = 0; i < 200; i++) {
                        ngmp.upsert(i % 50, base + i);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(50, ngmp.count());
        assertConsistent(ngmp);
    }
}
