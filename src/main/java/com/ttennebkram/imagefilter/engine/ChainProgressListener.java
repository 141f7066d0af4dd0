package com.ttennebkram.imagefilter.engine;

import com.ttennebkram.imagefilter.catalogue.FilterKind;

/**
 * Receives a callback after each stage of a chain. Called on the worker thread
 * that runs the chain.
 */
@FunctionalInterface
public interface ChainProgressListener {

    ChainProgressListener NONE = (stage, total, kind) -> { };

    /**
     * @param stage 1-based number of the stage that just completed
     * @param total number of stages in the chain
     * @param kind  the filter of the completed stage
     */
    void onStageCompleted(int stage, int total, FilterKind kind);
}
