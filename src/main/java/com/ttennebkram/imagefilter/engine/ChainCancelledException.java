package com.ttennebkram.imagefilter.engine;

import java.util.concurrent.CancellationException;

/**
 * A chain was cancelled before it finished. Remaining stages were abandoned
 * and no partial result is returned.
 */
public class ChainCancelledException extends CancellationException {

    public ChainCancelledException(String message) {
        super(message);
    }
}
