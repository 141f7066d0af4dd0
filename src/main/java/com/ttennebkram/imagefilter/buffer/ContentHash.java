package com.ttennebkram.imagefilter.buffer;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * 128-bit digest of a buffer's dimensions, layout and pixels.
 * Immutable value object usable as a map key.
 */
public final class ContentHash {

    public static final int HASH_LENGTH = 16;
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    private final byte[] bytes;

    public ContentHash(byte[] bytes) {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length != HASH_LENGTH) {
            throw new IllegalArgumentException("Content hash must be " + HASH_LENGTH + " bytes, got: " + bytes.length);
        }
        this.bytes = Arrays.copyOf(bytes, bytes.length);
    }

    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != HASH_LENGTH * 2) {
            throw new IllegalArgumentException("Content hash hex must be " + (HASH_LENGTH * 2) + " characters, got: " + hex.length());
        }
        return new ContentHash(HEX_FORMAT.parseHex(hex));
    }

    public byte[] getBytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
