package com.ttennebkram.imagefilter.engine;

import com.ttennebkram.imagefilter.buffer.PixelBuffer;

import java.util.concurrent.Callable;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handle to a chain running on the executor's worker pool.
 *
 * Cancelling sets the chain's cancellation flag, so the chain stops before its
 * next stage even when the running stage cannot be interrupted.
 */
public class FilterJob extends FutureTask<PixelBuffer> {

    private final CancellationSignal signal;
    private final AtomicInteger completedStages;
    private final int totalStages;

    FilterJob(Callable<PixelBuffer> chainRun, CancellationSignal signal, AtomicInteger completedStages,
              int totalStages) {
        super(chainRun);
        this.signal = signal;
        this.completedStages = completedStages;
        this.totalStages = totalStages;
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
        signal.cancel();
        return super.cancel(mayInterruptIfRunning);
    }

    public int getCompletedStages() {
        return completedStages.get();
    }

    public int getTotalStages() {
        return totalStages;
    }
}
