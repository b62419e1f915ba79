package com.farmerworking.lrucache.in.java.api;

import lombok.Data;

@Data
public class CacheOptions {
    // Total charge the cache may hold, split evenly (rounded up) across
    // the shards.
    //
    // Default: 8M
    private long capacity = 8 << 20;

    // The cache is partitioned into 2^numShardBits independently locked
    // shards.  The shard of a key is picked from the top bits of its hash.
    //
    // Default: 4
    private int numShardBits = 4;

    // Seed passed to the key hash.
    //
    // Default: 0
    private int hashSeed = 0;

    // An entry whose charge alone exceeds the capacity of its shard can never
    // stay cached; the caller still gets a working handle.  If false, inserting
    // such an entry evicts everything else in its shard before evicting the
    // entry itself.  If true, the entry is turned away up front and the rest of
    // the shard is left untouched.
    //
    // Default: false
    private boolean strictCapacity = false;

    public CacheOptions() {}

    public CacheOptions(long capacity) {
        this.capacity = capacity;
    }

    public CacheOptions(CacheOptions options) {
        this.capacity = options.capacity;
        this.numShardBits = options.numShardBits;
        this.hashSeed = options.hashSeed;
        this.strictCapacity = options.strictCapacity;
    }
}
