package com.ttennebkram.imagefilter.catalogue;

/**
 * A parameter payload does not match the shape or arity its filter kind declares.
 * This is a programming error in the calling layer and is never retried.
 */
public class InvalidPayloadShapeException extends IllegalArgumentException {

    public InvalidPayloadShapeException(String message) {
        super(message);
    }
}
