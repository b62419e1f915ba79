package com.farmerworking.lrucache.in.java.data.structure.cache;

import com.farmerworking.lrucache.in.java.api.Deleter;

import java.util.Vector;

public class TestDeleter<V> implements Deleter<V> {
    public Vector<Integer> deletedKeys = new Vector<>();
    public Vector<V> deletedValues = new Vector<>();

    @Override
    public void delete(byte[] key, V value) {
        deletedKeys.add(CacheTest.decodeKey(key));
        deletedValues.add(value);
    }
}
