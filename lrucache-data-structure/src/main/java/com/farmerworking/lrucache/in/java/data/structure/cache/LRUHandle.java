package com.farmerworking.lrucache.in.java.data.structure.cache;

import com.farmerworking.lrucache.in.java.api.Deleter;
import lombok.Getter;
import lombok.Setter;

import java.util.Arrays;

// An entry is a heap-allocated record kept in two intrusive lists at once:
// the bucket chain of its shard's HandleTable (nextHash) and the circular
// LRU list of the shard (next/previous), ordered by access time.
//
// "refs" counts the cache's own reference (while inCache) plus one per
// outstanding caller handle.  Every mutation happens under the owning
// shard's lock.
@Getter
@Setter
class LRUHandle<V> {
    private final byte[] key;
    private final V value;
    private final Deleter<V> deleter;
    private final long charge;
    private final int hash;     // Hash of key; used for fast sharding and comparisons

    private LRUHandle<V> nextHash;
    private LRUHandle<V> next;
    private LRUHandle<V> previous;

    private int refs;
    private boolean inCache;

    // list head
    LRUHandle() {
        this(null, 0, null, 0, null);
        this.next = this;
        this.previous = this;
    }

    LRUHandle(byte[] key, int hash, V value, long charge, Deleter<V> deleter) {
        this.key = key;
        this.hash = hash;
        this.value = value;
        this.charge = charge;
        this.deleter = deleter;
        this.refs = 0;
        this.inCache = false;
    }

    void ref() {
        this.refs++;
    }

    // Frees the entry when the last reference is dropped.
    void unref() {
        assert this.refs > 0;
        this.refs--;
        if (this.refs == 0) {
            assert !this.inCache;
            if (deleter != null) {
                deleter.delete(key, value);
            }
        }
    }

    boolean matches(byte[] key, int hash) {
        return this.hash == hash && Arrays.equals(this.key, key);
    }
}
