package com.farmerworking.lrucache.in.java.api;

// Called exactly once per cached entry, when the last reference to it goes
// away. Runs while the owning shard is locked: must not call back into the
// cache and should return quickly.
public interface Deleter<V> {
    void delete(byte[] key, V value);
}
