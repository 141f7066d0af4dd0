package com.ttennebkram.imagefilter.buffer;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Objects;

/**
 * In-memory raster image: width x height pixels of interleaved unsigned 8-bit channels,
 * stored row-major.
 *
 * A buffer is written only by whoever allocated it, before handing it on.
 * Once passed to the engine it is treated as immutable, which is what makes
 * its {@link #contentHash()} safe to cache.
 *
 * Identity semantics: equals/hashCode are not overridden so buffers can be
 * tracked by identity. Use {@link #contentEquals(PixelBuffer)} to compare pixels.
 */
public final class PixelBuffer {

    private final int width;
    private final int height;
    private final ChannelLayout layout;
    private final byte[] data;

    private volatile ContentHash cachedHash;

    private PixelBuffer(int width, int height, ChannelLayout layout, byte[] data) {
        this.width = width;
        this.height = height;
        this.layout = layout;
        this.data = data;
    }

    /**
     * Wrap existing pixel bytes without copying.
     */
    public static PixelBuffer wrap(int width, int height, ChannelLayout layout, byte[] data) {
        Objects.requireNonNull(layout, "layout");
        Objects.requireNonNull(data, "data");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Buffer dimensions must be positive: " + width + "x" + height);
        }
        long expected = byteSize(width, height, layout);
        if (data.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " bytes for " + width + "x" + height
                    + " " + layout + ", got " + data.length);
        }
        return new PixelBuffer(width, height, layout, data);
    }

    /**
     * Create a buffer where every pixel has the given channel values.
     */
    public static PixelBuffer filled(int width, int height, ChannelLayout layout, int... channelValues) {
        if (channelValues.length != layout.getChannels()) {
            throw new IllegalArgumentException("Expected " + layout.getChannels() + " channel values, got "
                    + channelValues.length);
        }
        byte[] data = new byte[(int) byteSize(width, height, layout)];
        int channels = layout.getChannels();
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) channelValues[i % channels];
        }
        return wrap(width, height, layout, data);
    }

    public static long byteSize(int width, int height, ChannelLayout layout) {
        return (long) width * height * layout.getChannels();
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public ChannelLayout getLayout() {
        return layout;
    }

    public int getChannels() {
        return layout.getChannels();
    }

    public long byteSize() {
        return data.length;
    }

    /**
     * Unsigned channel value at (x, y).
     */
    public int get(int x, int y, int channel) {
        return data[index(x, y, channel)] & 0xFF;
    }

    /**
     * Set a channel value. Only valid while the buffer is still owned by its producer.
     */
    public void set(int x, int y, int channel, int value) {
        data[index(x, y, channel)] = (byte) value;
        cachedHash = null;
    }

    /**
     * Backing array, row-major, interleaved. Callers other than the producer must
     * treat it as read-only.
     */
    public byte[] rawData() {
        return data;
    }

    public byte[] copyData() {
        return Arrays.copyOf(data, data.length);
    }

    public PixelBuffer copy() {
        return new PixelBuffer(width, height, layout, copyData());
    }

    public boolean sameDimensions(PixelBuffer other) {
        return other != null && width == other.width && height == other.height && layout == other.layout;
    }

    public boolean contentEquals(PixelBuffer other) {
        return sameDimensions(other) && Arrays.equals(data, other.data);
    }

    /**
     * Digest of dimensions, layout and pixels. Computed once and cached.
     */
    public ContentHash contentHash() {
        ContentHash hash = cachedHash;
        if (hash == null) {
            hash = computeHash();
            cachedHash = hash;
        }
        return hash;
    }

    private ContentHash computeHash() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(ByteBuffer.allocate(12).putInt(width).putInt(height).putInt(layout.ordinal()).array());
            digest.update(data);
            return new ContentHash(Arrays.copyOf(digest.digest(), ContentHash.HASH_LENGTH));
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is mandatory on every Java platform
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private int index(int x, int y, int channel) {
        if (x < 0 || x >= width || y < 0 || y >= height || channel < 0 || channel >= layout.getChannels()) {
            throw new IndexOutOfBoundsException("(" + x + ", " + y + ", " + channel + ") outside "
                    + width + "x" + height + " " + layout);
        }
        return (y * width + x) * layout.getChannels() + channel;
    }

    @Override
    public String toString() {
        return "PixelBuffer[" + width + "x" + height + " " + layout + "]";
    }
}
