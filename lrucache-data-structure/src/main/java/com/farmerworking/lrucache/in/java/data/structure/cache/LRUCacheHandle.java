package com.farmerworking.lrucache.in.java.data.structure.cache;

import com.farmerworking.lrucache.in.java.api.CacheHandle;

// The caller's token for one reference on an entry.  Tokens are never shared:
// each insert/lookup creates a new one, and release() detaches it from the
// entry so a second release or a late value() is caught instead of corrupting
// the reference count.
class LRUCacheHandle<V> implements CacheHandle<V> {
    private final Object owner;
    private volatile LRUHandle<V> node;

    LRUCacheHandle(Object owner, LRUHandle<V> node) {
        this.owner = owner;
        this.node = node;
    }

    Object getOwner() {
        return owner;
    }

    LRUHandle<V> getNode() {
        return node;
    }

    // Called with the shard lock held.
    LRUHandle<V> detach() {
        LRUHandle<V> result = node;
        node = null;
        return result;
    }

    @Override
    public boolean isReleased() {
        return node == null;
    }

    @Override
    public String toString() {
        LRUHandle<V> current = node;
        return current == null ? "LRUCacheHandle{released}" : "LRUCacheHandle{hash=" + Integer.toHexString(current.getHash()) + "}";
    }
}
