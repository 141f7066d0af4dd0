package com.ttennebkram.imagefilter.buffer;

/**
 * Interleaved 8-bit channel layouts supported by {@link PixelBuffer}.
 */
public enum ChannelLayout {
    GRAY(1),
    RGB(3),
    RGBA(4);

    private final int channels;

    ChannelLayout(int channels) {
        this.channels = channels;
    }

    public int getChannels() {
        return channels;
    }

    public boolean hasAlpha() {
        return this == RGBA;
    }

    /**
     * Number of channels carrying colour, i.e. everything except alpha.
     */
    public int getColorChannels() {
        return hasAlpha() ? channels - 1 : channels;
    }

    public static ChannelLayout forChannels(int channels) {
        for (ChannelLayout layout : values()) {
            if (layout.channels == channels) {
                return layout;
            }
        }
        throw new IllegalArgumentException("Unsupported channel count: " + channels);
    }
}
