package com.ttennebkram.imagefilter.mask;

/**
 * Buffers or mask canvas handed to the compositor do not share dimensions and layout.
 */
public class DimensionMismatchException extends IllegalArgumentException {

    public DimensionMismatchException(String message) {
        super(message);
    }
}
