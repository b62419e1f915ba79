package com.farmerworking.lrucache.in.java.data.structure.cache;

import com.farmerworking.lrucache.in.java.api.Deleter;
import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// A single shard of sharded cache.
//
// Every entry the shard holds a reference on is linked into both the hash
// table and the LRU list, and "usage" is the sum of their charges.  Entries
// that were erased, replaced or evicted while a caller still holds a handle
// are in neither structure; they are freed by the last release().
public class LRUCache<V> {
    private static final Logger logger = LoggerFactory.getLogger(LRUCache.class);

    private final long capacity;
    private final boolean strictCapacity;

    // guarded by this
    private long usage;

    // Dummy head of LRU list.
    // lru.previous is newest entry, lru.next is oldest entry.
    private final LRUHandle<V> lru;
    private final HandleTable<V> table;

    public LRUCache(long capacity) {
        this(capacity, false);
    }

    public LRUCache(long capacity, boolean strictCapacity) {
        Preconditions.checkArgument(capacity >= 0, "capacity must not be negative: %s", capacity);
        this.capacity = capacity;
        this.strictCapacity = strictCapacity;
        this.usage = 0;

        this.lru = new LRUHandle<>();
        this.table = new HandleTable<>();
    }

    synchronized LRUHandle<V> insert(byte[] key, int hash, V value, long charge, Deleter<V> deleter) {
        Preconditions.checkNotNull(key, "key");
        Preconditions.checkArgument(charge >= 0, "charge must not be negative: %s", charge);

        LRUHandle<V> node = new LRUHandle<>(key.clone(), hash, value, charge, deleter);
        node.ref(); // for the returned handle

        if (strictCapacity && charge > capacity) {
            // never cached; freed on release.  An older entry for the same key
            // must not keep answering lookups.
            finishErase(table.remove(node.getKey(), hash));
            return node;
        }

        node.ref(); // for the cache reference
        node.setInCache(true);
        append(node);
        usage += charge;
        finishErase(table.insert(node));

        while (usage > capacity && lru.getNext() != lru) {
            eraseOldest();
        }

        return node;
    }

    synchronized LRUHandle<V> lookup(byte[] key, int hash) {
        LRUHandle<V> node = table.lookup(key, hash);
        if (node != null) {
            node.ref();
            remove(node);
            append(node);
        }
        return node;
    }

    // Drops the reference held by handle.  Detaching under the shard lock makes
    // a racing second release fail instead of unref'ing twice.
    synchronized void release(LRUCacheHandle<V> handle) {
        LRUHandle<V> node = handle.detach();
        Preconditions.checkState(node != null, "cache handle already released");
        node.unref();
    }

    synchronized void erase(byte[] key, int hash) {
        finishErase(table.remove(key, hash));
    }

    public synchronized void prune() {
        LRUHandle<V> node = lru.getNext();
        while (node != lru) {
            LRUHandle<V> next = node.getNext();
            if (node.getRefs() == 1) {
                boolean erased = finishErase(table.remove(node.getKey(), node.getHash()));
                assert erased;
            }
            node = next;
        }
    }

    // Drops the cache reference of every entry.  Entries still pinned by a
    // caller survive until their handles are released.
    public synchronized void close() {
        int pinned = 0;
        while (lru.getNext() != lru) {
            LRUHandle<V> oldest = lru.getNext();
            if (oldest.getRefs() > 1) {
                pinned++;
            }
            boolean erased = finishErase(table.remove(oldest.getKey(), oldest.getHash()));
            assert erased;
        }
        assert usage == 0;

        if (pinned > 0) {
            logger.warn("closing cache shard with {} entries still referenced by callers", pinned);
        }
    }

    public synchronized long totalCharge() {
        return usage;
    }

    public synchronized int size() {
        return table.size();
    }

    public long getCapacity() {
        return capacity;
    }

    private void eraseOldest() {
        LRUHandle<V> oldest = lru.getNext();
        boolean erased = finishErase(table.remove(oldest.getKey(), oldest.getHash()));
        assert erased;
    }

    // Finish removing node from the cache; it has already been removed from
    // the hash table.  Return whether node != null.
    private boolean finishErase(LRUHandle<V> node) {
        if (node != null) {
            assert node.isInCache();
            remove(node);
            node.setInCache(false);
            usage -= node.getCharge();
            node.unref();
        }
        return node != null;
    }

    private void remove(LRUHandle<V> node) {
        node.getNext().setPrevious(node.getPrevious());
        node.getPrevious().setNext(node.getNext());
        node.setNext(null);
        node.setPrevious(null);
    }

    // Make node the newest entry by inserting just before lru
    private void append(LRUHandle<V> node) {
        node.setNext(lru);
        node.setPrevious(lru.getPrevious());
        node.getPrevious().setNext(node);
        node.getNext().setPrevious(node);
    }
}
