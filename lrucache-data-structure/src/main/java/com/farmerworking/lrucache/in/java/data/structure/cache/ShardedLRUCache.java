package com.farmerworking.lrucache.in.java.data.structure.cache;

import com.farmerworking.lrucache.in.java.api.Cache;
import com.farmerworking.lrucache.in.java.api.CacheHandle;
import com.farmerworking.lrucache.in.java.api.CacheOptions;
import com.farmerworking.lrucache.in.java.api.Deleter;
import com.farmerworking.lrucache.in.java.common.IHash;
import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

// Splits the key space across 2^numShardBits LRUCache shards, each with its
// own lock.  A key's hash is computed once; its top bits pick the shard and
// the same value is handed down for bucket selection.
public class ShardedLRUCache<V> implements Cache<V> {
    private static final Logger logger = LoggerFactory.getLogger(ShardedLRUCache.class);

    static final int kMaxNumShardBits = 16;

    private final int numShardBits;
    private final int hashSeed;
    private final List<LRUCache<V>> shard;
    private final IHash hash = IHash.getInstance();

    private final AtomicLong lastId = new AtomicLong(0);

    public ShardedLRUCache(long capacity) {
        this(new CacheOptions(capacity));
    }

    public ShardedLRUCache(CacheOptions options) {
        Preconditions.checkNotNull(options, "options");
        Preconditions.checkArgument(options.getCapacity() >= 0, "capacity must not be negative: %s", options.getCapacity());
        Preconditions.checkArgument(options.getNumShardBits() >= 0 && options.getNumShardBits() <= kMaxNumShardBits,
                "numShardBits must be in [0, %s]: %s", kMaxNumShardBits, options.getNumShardBits());

        this.numShardBits = options.getNumShardBits();
        this.hashSeed = options.getHashSeed();

        int numShards = 1 << numShardBits;
        long capacityPerShard = LongMath.divide(options.getCapacity(), numShards, RoundingMode.CEILING);
        this.shard = new ArrayList<>(numShards);
        for (int i = 0; i < numShards; i++) {
            shard.add(new LRUCache<>(capacityPerShard, options.isStrictCapacity()));
        }

        logger.debug("created sharded lru cache: capacity {}, {} shards of {}, strict {}",
                options.getCapacity(), numShards, capacityPerShard, options.isStrictCapacity());
    }

    @Override
    public CacheHandle<V> insert(byte[] key, V value, long charge, Deleter<V> deleter) {
        int h = hashKey(key);
        return new LRUCacheHandle<>(this, shard.get(shard(h)).insert(key, h, value, charge, deleter));
    }

    @Override
    public CacheHandle<V> lookup(byte[] key) {
        int h = hashKey(key);
        LRUHandle<V> node = shard.get(shard(h)).lookup(key, h);
        return node == null ? null : new LRUCacheHandle<>(this, node);
    }

    @Override
    public void release(CacheHandle<V> cacheHandle) {
        LRUCacheHandle<V> handle = checkHandle(cacheHandle);
        LRUHandle<V> node = handle.getNode();
        Preconditions.checkState(node != null, "cache handle already released");
        shard.get(shard(node.getHash())).release(handle);
    }

    @Override
    public V value(CacheHandle<V> cacheHandle) {
        LRUHandle<V> node = checkHandle(cacheHandle).getNode();
        Preconditions.checkState(node != null, "cache handle already released");
        return node.getValue();
    }

    @Override
    public void erase(byte[] key) {
        int h = hashKey(key);
        shard.get(shard(h)).erase(key, h);
    }

    @Override
    public long newId() {
        return lastId.incrementAndGet();
    }

    @Override
    public void prune() {
        for (LRUCache<V> cache : shard) {
            cache.prune();
        }
    }

    @Override
    public long totalCharge() {
        long total = 0;
        for (LRUCache<V> cache : shard) {
            total += cache.totalCharge();
        }
        return total;
    }

    @Override
    public void close() {
        for (LRUCache<V> cache : shard) {
            cache.close();
        }
    }

    int numShards() {
        return shard.size();
    }

    LRUCache<V> getShard(int index) {
        return shard.get(index);
    }

    int hashKey(byte[] key) {
        Preconditions.checkNotNull(key, "key");
        return hash.hash(key, hashSeed);
    }

    int shard(int hash) {
        return numShardBits == 0 ? 0 : hash >>> (32 - numShardBits);
    }

    private LRUCacheHandle<V> checkHandle(CacheHandle<V> cacheHandle) {
        Preconditions.checkNotNull(cacheHandle, "cache handle");
        Preconditions.checkArgument(cacheHandle instanceof LRUCacheHandle
                        && ((LRUCacheHandle<V>) cacheHandle).getOwner() == this,
                "cache handle was not produced by this cache");
        return (LRUCacheHandle<V>) cacheHandle;
    }
}
