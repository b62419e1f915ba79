package com.farmerworking.lrucache.in.java.common;

public class Hash implements IHash {
    @Override
    public int hash(byte[] data, int seed) {
        return hash(data, 0, data.length, seed);
    }

    @Override
    public int hash(byte[] data, int offset, int length, int seed) {
        assert offset >= 0 && offset + length <= data.length;

        // Similar to murmur hash
        int m = 0xc6a4a793;
        int r = 24;
        int h = seed ^ (length * m);

        // Pick up four bytes at a time
        int fixed32Length = ICoding.getInstance().getFixed32Length();
        int limit = offset + length;
        while (offset + fixed32Length <= limit) {
            int w = ICoding.getInstance().decodeFixed32(data, offset);
            offset += fixed32Length;
            h += w;
            h *= m;
            h ^= (h >>> 16);
        }

        // Pick up remaining bytes
        int left = limit - offset;
        if (left > 0) {
            for (int i = left - 1; i >= 0; i--) {
                h += (data[offset + i] & 0xff) << (8 * i);
            }
            h *= m;
            h ^= (h >>> r);
        }
        return h;
    }
}
