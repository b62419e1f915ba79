package com.farmerworking.lrucache.in.java.common;

public interface ICoding {
    ICoding instance = getDefaultImpl();

    int getFixed32Length();

    int getFixed64Length();

    void encodeFixed32(byte[] buffer, int offset, int value);

    int decodeFixed32(byte[] buffer, int offset);

    void encodeFixed64(byte[] buffer, int offset, long value);

    long decodeFixed64(byte[] buffer, int offset);

    /**
     * @return a fresh 4 byte little-endian encoding of value
     */
    byte[] fixed32(int value);

    /**
     * @return a fresh 8 byte little-endian encoding of value
     */
    byte[] fixed64(long value);

    static ICoding getDefaultImpl() {
        return new Coding();
    }

    static ICoding getInstance() {
        return instance;
    }
}
