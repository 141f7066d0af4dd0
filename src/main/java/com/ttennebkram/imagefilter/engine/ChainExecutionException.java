package com.ttennebkram.imagefilter.engine;

import com.ttennebkram.imagefilter.FilterExecutionException;
import com.ttennebkram.imagefilter.catalogue.FilterKind;

/**
 * A stage of a chain failed. The cause is the stage's original failure.
 */
public class ChainExecutionException extends FilterExecutionException {

    private final int stageIndex;
    private final int stageCount;

    public ChainExecutionException(int stageIndex, int stageCount, FilterKind kind, Throwable cause) {
        super("Stage " + (stageIndex + 1) + "/" + stageCount + " (" + kind + ") failed: " + cause.getMessage(),
                kind, cause);
        this.stageIndex = stageIndex;
        this.stageCount = stageCount;
    }

    /** 0-based index of the failing stage */
    public int getStageIndex() {
        return stageIndex;
    }

    public int getStageCount() {
        return stageCount;
    }
}
