package com.ttennebkram.imagefilter.catalogue;

/**
 * How blur kernels sample outside the image. Stored in payloads by ordinal.
 */
public enum EdgeMode {
    /** aaa|abcd|ddd */
    CLAMP,
    /** dcb|abcd|cba */
    REFLECT_101,
    /** bcd|abcd|abc */
    WRAP,
    /** cba|abcd|dcb */
    REFLECT;

    public static EdgeMode fromOrdinal(int ordinal) {
        EdgeMode[] modes = values();
        if (ordinal < 0 || ordinal >= modes.length) {
            return REFLECT_101;
        }
        return modes[ordinal];
    }

    /**
     * Map a coordinate that may lie outside [0, size) back into it.
     */
    public int resolve(int i, int size) {
        if (i >= 0 && i < size) {
            return i;
        }
        if (size == 1) {
            return 0;
        }
        switch (this) {
            case CLAMP:
                return i < 0 ? 0 : size - 1;
            case WRAP:
                return Math.floorMod(i, size);
            case REFLECT: {
                int period = 2 * size;
                int m = Math.floorMod(i, period);
                return m < size ? m : period - 1 - m;
            }
            case REFLECT_101:
            default: {
                int period = 2 * size - 2;
                int m = Math.floorMod(i, period);
                return m < size ? m : period - m;
            }
        }
    }
}
