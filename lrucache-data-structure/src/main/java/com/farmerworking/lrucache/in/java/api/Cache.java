package com.farmerworking.lrucache.in.java.api;

public interface Cache<V> extends AutoCloseable {
    // Insert a mapping from key->value into the cache and assign it
    // the specified charge against the total cache capacity.
    //
    // Returns a handle that corresponds to the mapping.  The caller
    // must call this.release(handle) when the returned mapping is no
    // longer needed.
    //
    // When the inserted entry is no longer needed, the key and
    // value will be passed to "deleter".
    CacheHandle<V> insert(byte[] key, V value, long charge, Deleter<V> deleter);

    // If the cache has no mapping for "key", returns null.
    //
    // Else return a handle that corresponds to the mapping.  The caller
    // must call this.release(handle) when the returned mapping is no
    // longer needed.
    CacheHandle<V> lookup(byte[] key);

    // Release a mapping returned by a previous lookup() or insert().
    // REQUIRES: handle must not have been released yet.
    // REQUIRES: handle must have been returned by a method on *this.
    void release(CacheHandle<V> handle);

    // Return the value encapsulated in a handle returned by a
    // successful lookup() or insert().
    // REQUIRES: handle must not have been released yet.
    V value(CacheHandle<V> handle);

    // If the cache contains entry for key, erase it.  Note that the
    // underlying entry will be kept around until all existing handles
    // to it have been released.
    void erase(byte[] key);

    // Return a new numeric id.  May be used by multiple clients who are
    // sharing the same cache to partition the key space.  Typically the
    // client will allocate a new id at startup and prepend the id to
    // its cache keys.
    long newId();

    // Remove all cache entries that are not actively in use.  Memory-constrained
    // applications may wish to call this method to reduce memory usage.
    void prune();

    // Return an estimate of the combined charges of all elements stored in the
    // cache.
    long totalCharge();

    // Drop the cache's own reference to every entry.  Entries still held by
    // callers are freed when their last handle is released.
    @Override
    void close();
}
