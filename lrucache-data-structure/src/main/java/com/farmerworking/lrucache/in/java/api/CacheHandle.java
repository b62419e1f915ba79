package com.farmerworking.lrucache.in.java.api;

// Opaque token for one reference to a cached entry. Every successful
// insert/lookup hands out a new token; it must be given back to the cache
// that produced it through Cache.release() exactly once.
public interface CacheHandle<V> {
    // True once the handle has been released.
    boolean isReleased();
}
