package com.farmerworking.lrucache.in.java.data.structure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// A simple open-chaining hash table keyed by the entry's key bytes.  The
// hash is computed once by the caller and cached on the entry, so chains are
// walked comparing ints first and key bytes only on a hash match.
class HandleTable<V> {
    private static final Logger logger = LoggerFactory.getLogger(HandleTable.class);

    private static final int kInitialLength = 4;

    // The table consists of an array of buckets where each bucket is
    // a linked list of cache entries that hash into the bucket.
    private LRUHandle<V>[] list;
    private int elems;

    HandleTable() {
        this.elems = 0;
        resize();
    }

    LRUHandle<V> lookup(byte[] key, int hash) {
        LRUHandle<V> node = list[hash & (list.length - 1)];
        while (node != null && !node.matches(key, hash)) {
            node = node.getNextHash();
        }
        return node;
    }

    // Links node into its bucket.  If an entry with the same key is already
    // present it is unlinked and returned; what happens to it is up to the
    // caller.
    LRUHandle<V> insert(LRUHandle<V> node) {
        int index = node.getHash() & (list.length - 1);
        LRUHandle<V> previous = null;
        LRUHandle<V> old = list[index];
        while (old != null && !old.matches(node.getKey(), node.getHash())) {
            previous = old;
            old = old.getNextHash();
        }

        node.setNextHash(old == null ? null : old.getNextHash());
        if (previous == null) {
            list[index] = node;
        } else {
            previous.setNextHash(node);
        }

        if (old == null) {
            elems++;
            if (elems > list.length) {
                // Since each cache entry is fairly large, we aim for a small
                // average linked list length (<= 1).
                resize();
            }
        } else {
            old.setNextHash(null);
        }
        return old;
    }

    LRUHandle<V> remove(byte[] key, int hash) {
        int index = hash & (list.length - 1);
        LRUHandle<V> previous = null;
        LRUHandle<V> node = list[index];
        while (node != null && !node.matches(key, hash)) {
            previous = node;
            node = node.getNextHash();
        }

        if (node != null) {
            if (previous == null) {
                list[index] = node.getNextHash();
            } else {
                previous.setNextHash(node.getNextHash());
            }
            node.setNextHash(null);
            elems--;
        }
        return node;
    }

    int size() {
        return elems;
    }

    int length() {
        return list.length;
    }

    private void resize() {
        int newLength = kInitialLength;
        while (newLength < elems) {
            newLength *= 2;
        }

        LRUHandle<V>[] newList = new LRUHandle[newLength];
        int count = 0;
        if (list != null) {
            for (LRUHandle<V> head : list) {
                LRUHandle<V> node = head;
                while (node != null) {
                    LRUHandle<V> next = node.getNextHash();
                    int index = node.getHash() & (newLength - 1);
                    node.setNextHash(newList[index]);
                    newList[index] = node;
                    node = next;
                    count++;
                }
            }
            logger.trace("resize hash table from {} to {} buckets, {} entries", list.length, newLength, count);
        }
        assert elems == count;
        list = newList;
    }
}
