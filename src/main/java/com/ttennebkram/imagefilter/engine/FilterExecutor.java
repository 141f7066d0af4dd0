package com.ttennebkram.imagefilter.engine;

import com.ttennebkram.imagefilter.FilterExecutionException;
import com.ttennebkram.imagefilter.backend.FilterBackend;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.cache.CacheKey;
import com.ttennebkram.imagefilter.cache.FilterCache;
import com.ttennebkram.imagefilter.catalogue.FilterChain;
import com.ttennebkram.imagefilter.catalogue.FilterKind;
import com.ttennebkram.imagefilter.catalogue.FilterParams;
import com.ttennebkram.imagefilter.catalogue.FilterSpec;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs filter chains against pixel buffers.
 *
 * Architecture:
 * - Each stage validates its payload, then consults the cache (if any) and
 *   dispatches to the backend on a miss
 * - Intermediates that are neither cached nor returned are released to the
 *   allocator as soon as the next stage has consumed them
 * - {@link #submit} runs chains on a pool of daemon worker threads
 * - Cancellation is checked before every stage
 */
public class FilterExecutor implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(FilterExecutor.class.getName());

    /** Source plus at most this many stage buffers are alive at once */
    private static final int MAX_LIVE_STAGE_BUFFERS = 2;

    private final FilterBackend backend;
    private final FilterCache cache;
    private final BufferAllocator allocator;
    private final long memoryCeilingBytes;
    private final ExecutorService workers;

    /**
     * @param backend            runs individual filters
     * @param cache              result cache, or null to disable caching
     * @param allocator          receives released intermediates
     * @param memoryCeilingBytes pre-flight limit per chain; 0 or less disables the check
     * @param workerThreads      size of the pool used by {@link #submit}
     */
    public FilterExecutor(FilterBackend backend, FilterCache cache, BufferAllocator allocator,
                          long memoryCeilingBytes, int workerThreads) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.cache = cache;
        this.allocator = Objects.requireNonNull(allocator, "allocator");
        this.memoryCeilingBytes = memoryCeilingBytes;
        this.workers = Executors.newFixedThreadPool(Math.max(1, workerThreads), new WorkerThreadFactory());
    }

    public FilterBackend getBackend() {
        return backend;
    }

    /**
     * The result cache, or null if caching is disabled.
     */
    public FilterCache getCache() {
        return cache;
    }

    public BufferAllocator getAllocator() {
        return allocator;
    }

    public long getMemoryCeilingBytes() {
        return memoryCeilingBytes;
    }

    /**
     * Apply a chain on the calling thread. The empty chain returns the source itself.
     */
    public PixelBuffer apply(FilterChain chain, PixelBuffer source) throws FilterExecutionException {
        return apply(chain, source, ChainProgressListener.NONE, new CancellationSignal());
    }

    /**
     * Apply a chain on the calling thread. A result that is also held by the cache
     * is returned as a private copy, so callers may modify it freely.
     *
     * @throws ChainExecutionException        if a stage fails, with the stage index and kind
     * @throws MemoryBudgetExceededException  if a memory ceiling is configured and the chain would exceed it
     * @throws ChainCancelledException        if cancelled before a stage
     */
    public PixelBuffer apply(FilterChain chain, PixelBuffer source, ChainProgressListener listener,
                             CancellationSignal signal) throws FilterExecutionException {
        Objects.requireNonNull(chain, "chain");
        Objects.requireNonNull(source, "source");
        if (chain.isEmpty()) {
            return source;
        }
        if (memoryCeilingBytes > 0) {
            checkMemoryBudget(chain, source, memoryCeilingBytes);
        }

        int total = chain.size();
        long startTime = System.nanoTime();
        LOGGER.fine(() -> "Running " + chain + " on " + source + " via " + backend.getName());

        PixelBuffer current = source;
        for (int i = 0; i < total; i++) {
            FilterSpec spec = chain.get(i);
            PixelBuffer next;
            try {
                signal.throwIfCancelled("before stage " + (i + 1) + "/" + total);
                next = runStage(spec, current);
            } catch (ChainCancelledException e) {
                releaseIntermediate(current, source);
                throw e;
            } catch (FilterExecutionException | RuntimeException e) {
                releaseIntermediate(current, source);
                LOGGER.log(Level.FINE, "Stage " + (i + 1) + "/" + total + " failed", e);
                throw new ChainExecutionException(i, total, spec.getKind(), e);
            }
            if (next != current) {
                releaseIntermediate(current, source);
            }
            current = next;
            listener.onStageCompleted(i + 1, total, spec.getKind());
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startTime);
        LOGGER.fine(() -> "Finished " + total + " stage(s) in " + elapsedMs + "ms"
                + (cache != null ? ", " + cache : ""));
        if (cache != null && cache.isResident(current)) {
            return current.copy();
        }
        return current;
    }

    /**
     * Run a chain on the worker pool.
     */
    public FilterJob submit(FilterChain chain, PixelBuffer source, ChainProgressListener listener) {
        Objects.requireNonNull(chain, "chain");
        Objects.requireNonNull(source, "source");
        ChainProgressListener callback = listener == null ? ChainProgressListener.NONE : listener;
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger completed = new AtomicInteger();
        ChainProgressListener tracking = (stage, total, kind) -> {
            completed.set(stage);
            callback.onStageCompleted(stage, total, kind);
        };
        FilterJob job = new FilterJob(() -> apply(chain, source, tracking, signal), signal, completed, chain.size());
        workers.execute(job);
        return job;
    }

    /**
     * Run arbitrary engine work, such as mask compositing, on the worker pool.
     */
    public <T> Future<T> submitTask(Callable<T> task) {
        return workers.submit(task);
    }

    /**
     * Estimated peak bytes for running the chain: the source plus the live stage
     * buffers, of which there are at most two and never more than the chain has stages.
     */
    public static long estimateBytes(FilterChain chain, PixelBuffer source) {
        int stageBuffers = Math.min(chain.size(), MAX_LIVE_STAGE_BUFFERS);
        return source.byteSize() * (1 + stageBuffers);
    }

    /**
     * @throws MemoryBudgetExceededException if the estimate exceeds the ceiling
     */
    public static void checkMemoryBudget(FilterChain chain, PixelBuffer source, long ceilingBytes)
            throws MemoryBudgetExceededException {
        long estimate = estimateBytes(chain, source);
        if (estimate > ceilingBytes) {
            LOGGER.fine(() -> "Chain of " + chain.size() + " needs ~" + estimate + " bytes, ceiling " + ceilingBytes);
            throw new MemoryBudgetExceededException(estimate, ceilingBytes);
        }
    }

    private PixelBuffer runStage(FilterSpec spec, PixelBuffer input) throws FilterExecutionException {
        FilterKind kind = spec.getKind();
        FilterParams params = ParameterValidator.validate(kind, spec.getParams());
        if (cache == null) {
            return backend.transform(kind, params, input);
        }
        CacheKey key = CacheKey.of(kind, params, input);
        return cache.getOrCompute(key, () -> backend.transform(kind, params, input));
    }

    private void releaseIntermediate(PixelBuffer buffer, PixelBuffer source) {
        if (buffer == source) {
            return;
        }
        if (cache != null && cache.isResident(buffer)) {
            return;
        }
        allocator.release(buffer);
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "filter-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
