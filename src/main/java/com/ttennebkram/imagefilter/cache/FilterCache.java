package com.ttennebkram.imagefilter.cache;

import com.ttennebkram.imagefilter.FilterExecutionException;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import com.ttennebkram.imagefilter.engine.ChainCancelledException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LRU cache of filter results, bounded by entry count and total bytes.
 *
 * Lookups are by full key only. Evicted and invalidated buffers are handed to
 * the eviction listener, outside the cache lock. Concurrent
 * {@link #getOrCompute} calls for the same key share a single computation;
 * a failed computation leaves nothing behind.
 */
public class FilterCache {

    private static final Logger LOGGER = Logger.getLogger(FilterCache.class.getName());

    private final int maxEntries;
    private final long maxBytes;

    // access-ordered: iteration starts at the least recently used entry
    private final LinkedHashMap<CacheKey, PixelBuffer> entries = new LinkedHashMap<>(16, 0.75f, true);
    private long bytes;

    private final Map<CacheKey, FutureTask<PixelBuffer>> inFlight = new ConcurrentHashMap<>();

    private volatile Consumer<PixelBuffer> evictionListener = buffer -> { };

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public FilterCache(int maxEntries, long maxBytes) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1: " + maxEntries);
        }
        if (maxBytes < 1) {
            throw new IllegalArgumentException("maxBytes must be positive: " + maxBytes);
        }
        this.maxEntries = maxEntries;
        this.maxBytes = maxBytes;
    }

    public void setEvictionListener(Consumer<PixelBuffer> listener) {
        this.evictionListener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Cached buffer for the key, or null. Counts as a hit or a miss.
     */
    public PixelBuffer get(CacheKey key) {
        PixelBuffer buffer;
        synchronized (this) {
            buffer = entries.get(key);
        }
        if (buffer != null) {
            hits.incrementAndGet();
        } else {
            misses.incrementAndGet();
        }
        return buffer;
    }

    /**
     * Store a result, evicting least recently used entries as needed.
     *
     * @return false if the buffer alone exceeds the byte budget and was not stored
     */
    public boolean put(CacheKey key, PixelBuffer buffer) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(buffer, "buffer");
        long size = buffer.byteSize();
        if (size > maxBytes) {
            LOGGER.fine(() -> "Not caching " + key + ": " + size + " bytes exceeds budget of " + maxBytes);
            return false;
        }

        List<PixelBuffer> removed = new ArrayList<>();
        synchronized (this) {
            PixelBuffer previous = entries.put(key, buffer);
            if (previous != buffer) {
                bytes += size;
                if (previous != null) {
                    bytes -= previous.byteSize();
                    removed.add(previous);
                }
            }
            Iterator<Map.Entry<CacheKey, PixelBuffer>> it = entries.entrySet().iterator();
            while ((entries.size() > maxEntries || bytes > maxBytes) && it.hasNext()) {
                Map.Entry<CacheKey, PixelBuffer> eldest = it.next();
                if (eldest.getKey().equals(key)) {
                    continue;
                }
                it.remove();
                bytes -= eldest.getValue().byteSize();
                removed.add(eldest.getValue());
                evictions.incrementAndGet();
                LOGGER.finer(() -> "Evicted " + eldest.getKey());
            }
        }
        notifyRemoved(removed);
        return true;
    }

    /**
     * Return the cached result for the key, or run the computation once and cache
     * its result. Callers arriving while a computation for the same key is running
     * wait for it and share its result or its failure.
     *
     * @throws ChainCancelledException if interrupted while waiting
     */
    public PixelBuffer getOrCompute(CacheKey key, FilterComputation computation) throws FilterExecutionException {
        PixelBuffer cached = get(key);
        if (cached != null) {
            return cached;
        }

        FutureTask<PixelBuffer> task = new FutureTask<>(() -> {
            PixelBuffer resident = peek(key);
            if (resident != null) {
                return resident;
            }
            PixelBuffer result = computation.compute();
            put(key, result);
            return result;
        });

        FutureTask<PixelBuffer> running = inFlight.putIfAbsent(key, task);
        if (running == null) {
            running = task;
            try {
                task.run();
            } finally {
                inFlight.remove(key, task);
            }
        } else {
            LOGGER.finer(() -> "Joining in-flight computation of " + key);
        }

        try {
            return running.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChainCancelledException("Interrupted while waiting for " + key);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FilterExecutionException fe) {
                throw fe;
            }
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new FilterExecutionException("Computation of " + key + " failed", key.getKind(), cause);
        }
    }

    /**
     * Remove every entry whose key matches.
     *
     * @return number of entries removed
     */
    public int invalidate(Predicate<CacheKey> predicate) {
        List<PixelBuffer> removed = new ArrayList<>();
        synchronized (this) {
            Iterator<Map.Entry<CacheKey, PixelBuffer>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<CacheKey, PixelBuffer> entry = it.next();
                if (predicate.test(entry.getKey())) {
                    it.remove();
                    bytes -= entry.getValue().byteSize();
                    removed.add(entry.getValue());
                }
            }
        }
        notifyRemoved(removed);
        return removed.size();
    }

    public int invalidateAll() {
        return invalidate(key -> true);
    }

    /**
     * True if the key is cached. Does not affect recency or statistics.
     */
    public synchronized boolean contains(CacheKey key) {
        return entries.containsKey(key);
    }

    /**
     * True if this exact buffer instance is held by the cache.
     */
    public synchronized boolean isResident(PixelBuffer buffer) {
        for (PixelBuffer value : entries.values()) {
            if (value == buffer) {
                return true;
            }
        }
        return false;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long bytes() {
        return bytes;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public long getMaxBytes() {
        return maxBytes;
    }

    public long getHitCount() {
        return hits.get();
    }

    public long getMissCount() {
        return misses.get();
    }

    public long getEvictionCount() {
        return evictions.get();
    }

    @Override
    public String toString() {
        return String.format("FilterCache[%d entries, %d bytes, hits=%d, misses=%d, evictions=%d]",
                size(), bytes(), hits.get(), misses.get(), evictions.get());
    }

    private PixelBuffer peek(CacheKey key) {
        synchronized (this) {
            // get() on an access-ordered map refreshes recency, which is wanted here
            return entries.get(key);
        }
    }

    private void notifyRemoved(List<PixelBuffer> removed) {
        Consumer<PixelBuffer> listener = evictionListener;
        for (PixelBuffer buffer : removed) {
            try {
                listener.accept(buffer);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Eviction listener failed for " + buffer, e);
            }
        }
    }
}
