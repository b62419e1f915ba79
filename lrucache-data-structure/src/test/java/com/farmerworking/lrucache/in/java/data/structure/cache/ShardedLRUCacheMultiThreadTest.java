package com.farmerworking.lrucache.in.java.data.structure.cache;

import com.farmerworking.lrucache.in.java.api.CacheHandle;
import com.farmerworking.lrucache.in.java.api.Deleter;
import com.google.common.collect.Lists;
import org.junit.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class ShardedLRUCacheMultiThreadTest {
    private static final int kNumThread = 8;
    private static final int kNumKeys = 500;
    private static final int kOpsPerThread = 20000;

    @Test
    public void testConcurrentInsertLookupErase() throws Exception {
        AtomicInteger created = new AtomicInteger();
        AtomicInteger deleted = new AtomicInteger();
        Deleter<long[]> deleter = (key, value) -> {
            assertEquals(CacheTest.decodeKey(key), value[0]);
            deleted.incrementAndGet();
        };

        ShardedLRUCache<long[]> cache = new ShardedLRUCache<>(200);
        ExecutorService executor = Executors.newFixedThreadPool(kNumThread);
        List<Future<Integer>> futures = Lists.newArrayList();
        for (int t = 0; t < kNumThread; t++) {
            int id = t;
            futures.add(executor.submit(() -> {
                Random random = new Random(1000 + id);
                int hits = 0;
                for (int i = 0; i < kOpsPerThread; i++) {
                    int key = random.nextInt(kNumKeys);
                    byte[] encoded = CacheTest.encodeKey(key);
                    int op = random.nextInt(10);
                    if (op < 4) {
                        created.incrementAndGet();
                        CacheHandle<long[]> handle = cache.insert(encoded, new long[]{key, id}, 1 + random.nextInt(3), deleter);
                        assertEquals(key, cache.value(handle)[0]);
                        cache.release(handle);
                    } else if (op < 9) {
                        CacheHandle<long[]> handle = cache.lookup(encoded);
                        if (handle != null) {
                            hits++;
                            assertEquals(key, cache.value(handle)[0]);
                            cache.release(handle);
                        }
                    } else {
                        cache.erase(encoded);
                    }
                }
                return hits;
            }));
        }

        int hits = 0;
        for (Future<Integer> future : futures) {
            hits += future.get();
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        assertTrue(hits > 0);
        assertTrue(cache.totalCharge() <= 16 * 13);

        cache.close();
        assertEquals(0, cache.totalCharge());
        assertEquals(created.get(), deleted.get());
    }

    @Test
    public void testConcurrentNewId() throws Exception {
        ShardedLRUCache<Integer> cache = new ShardedLRUCache<>(10);
        ExecutorService executor = Executors.newFixedThreadPool(kNumThread);
        List<Future<long[]>> futures = Lists.newArrayList();
        for (int t = 0; t < kNumThread; t++) {
            futures.add(executor.submit(() -> {
                long[] ids = new long[1000];
                for (int i = 0; i < ids.length; i++) {
                    ids[i] = cache.newId();
                    if (i > 0) {
                        assertTrue(ids[i] > ids[i - 1]);
                    }
                }
                return ids;
            }));
        }

        boolean[] seen = new boolean[kNumThread * 1000 + 1];
        for (Future<long[]> future : futures) {
            for (long id : future.get()) {
                assertTrue(id >= 1 && id <= kNumThread * 1000);
                assertFalse(seen[(int) id]);
                seen[(int) id] = true;
            }
        }
        executor.shutdown();
        assertEquals(kNumThread * 1000 + 1, cache.newId());
    }
}
