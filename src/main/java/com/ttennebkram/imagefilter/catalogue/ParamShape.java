package com.ttennebkram.imagefilter.catalogue;

/**
 * Shape of a filter's parameter payload.
 */
public enum ParamShape {
    /** No parameters */
    NONE,
    SCALAR,
    PAIR,
    TRIPLE,
    QUAD,
    /** A named structured record, e.g. {@link PinchParams} */
    RECORD
}
