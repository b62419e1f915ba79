package com.farmerworking.lrucache.in.java.common;

public interface IHash {
    static IHash instance = getDefaultImpl();

    // Returns a 32-bit fingerprint of data. Callers treat the result as
    // unsigned: low bits pick a bucket, high bits pick a shard.
    int hash(byte[] data, int seed);

    int hash(byte[] data, int offset, int length, int seed);

    static IHash getDefaultImpl() {
        return new Hash();
    }

    static IHash getInstance() {
        return instance;
    }
}
