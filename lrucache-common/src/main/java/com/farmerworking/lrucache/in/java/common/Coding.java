package com.farmerworking.lrucache.in.java.common;

// Little-endian fixed width encodings, the layout keys are built with.
public class Coding implements ICoding {
    static final int FIXED_32_LENGTH = 4;
    static final int FIXED_64_LENGTH = 8;

    @Override
    public int getFixed32Length() {
        return FIXED_32_LENGTH;
    }

    @Override
    public int getFixed64Length() {
        return FIXED_64_LENGTH;
    }

    @Override
    public void encodeFixed32(byte[] buffer, int offset, int value) {
        encodeFixedInternal(buffer, offset, value, FIXED_32_LENGTH);
    }

    @Override
    public int decodeFixed32(byte[] buffer, int offset) {
        return (int) decodeFixedInternal(buffer, offset, FIXED_32_LENGTH);
    }

    @Override
    public void encodeFixed64(byte[] buffer, int offset, long value) {
        encodeFixedInternal(buffer, offset, value, FIXED_64_LENGTH);
    }

    @Override
    public long decodeFixed64(byte[] buffer, int offset) {
        return decodeFixedInternal(buffer, offset, FIXED_64_LENGTH);
    }

    @Override
    public byte[] fixed32(int value) {
        byte[] buffer = new byte[FIXED_32_LENGTH];
        encodeFixed32(buffer, 0, value);
        return buffer;
    }

    @Override
    public byte[] fixed64(long value) {
        byte[] buffer = new byte[FIXED_64_LENGTH];
        encodeFixed64(buffer, 0, value);
        return buffer;
    }

    private void encodeFixedInternal(byte[] buffer, int offset, long value, int fixedLength) {
        assert buffer.length >= offset + fixedLength;

        for (int i = 0; i < fixedLength; i++) {
            buffer[offset + i] = (byte) ((value >>> (i * 8)) & 0xff);
        }
    }

    private long decodeFixedInternal(byte[] buffer, int offset, int fixedLength) {
        assert buffer.length >= offset + fixedLength;

        long result = 0;
        for (int i = 0; i < fixedLength; i++) {
            result = result | (long) (buffer[offset + i] & 0xff) << (i * 8);
        }
        return result;
    }
}
