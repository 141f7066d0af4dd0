package com.ttennebkram.imagefilter.buffer;

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Heap allocator that tracks every buffer it hands out, to help find leaks
 * in long filter chains.
 *
 * Usage:
 * 1. Allocate through {@link #allocate(int, int, ChannelLayout)}
 * 2. Call {@link #release(PixelBuffer)} once a buffer is no longer needed
 * 3. Call {@link #dumpLeaks(PrintStream)} to see buffers that were never released
 *
 * An optional byte limit turns over-allocation into an {@link AllocationFailureException}
 * before the JVM runs out of heap.
 */
public class TrackingBufferAllocator implements BufferAllocator {

    private static final Logger LOGGER = Logger.getLogger(TrackingBufferAllocator.class.getName());

    /** Largest array the JVM reliably allocates */
    private static final long MAX_ARRAY_BYTES = Integer.MAX_VALUE - 8;

    private final long limitBytes;
    private volatile boolean captureLocations;

    private final Map<PixelBuffer, AllocationInfo> active = new ConcurrentHashMap<>();
    private final AtomicLong bytesInUse = new AtomicLong();
    private final AtomicLong totalAllocated = new AtomicLong();
    private final AtomicLong totalReleased = new AtomicLong();

    /**
     * Info about a tracked buffer.
     */
    private static class AllocationInfo {
        final long id;
        final long bytes;
        final long creationTime;
        final String location;

        AllocationInfo(long id, long bytes, boolean captureLocation) {
            this.id = id;
            this.bytes = bytes;
            this.creationTime = System.currentTimeMillis();
            this.location = captureLocation ? findCaller() : "unknown";
        }

        private static String findCaller() {
            for (StackTraceElement element : Thread.currentThread().getStackTrace()) {
                String className = element.getClassName();
                if (className.equals("java.lang.Thread")
                        || className.startsWith(TrackingBufferAllocator.class.getName())
                        || className.equals(BufferAllocator.class.getName())) {
                    continue;
                }
                return element.getFileName() + ":" + element.getLineNumber();
            }
            return "unknown";
        }
    }

    /**
     * Unlimited allocator, bounded only by the JVM heap.
     */
    public TrackingBufferAllocator() {
        this(0);
    }

    /**
     * @param limitBytes maximum bytes in use at once; 0 or less for no limit
     */
    public TrackingBufferAllocator(long limitBytes) {
        this.limitBytes = limitBytes;
    }

    public void setCaptureLocations(boolean captureLocations) {
        this.captureLocations = captureLocations;
    }

    public long getLimitBytes() {
        return limitBytes;
    }

    @Override
    public PixelBuffer allocate(int width, int height, ChannelLayout layout) throws AllocationFailureException {
        long size = PixelBuffer.byteSize(width, height, layout);
        if (size > MAX_ARRAY_BYTES) {
            throw new AllocationFailureException("Buffer of " + size + " bytes exceeds the maximum array size",
                    size, MAX_ARRAY_BYTES);
        }
        if (limitBytes > 0) {
            long after = bytesInUse.addAndGet(size);
            if (after > limitBytes) {
                bytesInUse.addAndGet(-size);
                long available = Math.max(0, limitBytes - (after - size));
                throw new AllocationFailureException("Allocating " + size + " bytes would exceed the limit of "
                        + limitBytes + " bytes", size, available);
            }
        } else {
            bytesInUse.addAndGet(size);
        }

        byte[] data;
        try {
            data = new byte[(int) size];
        } catch (OutOfMemoryError e) {
            bytesInUse.addAndGet(-size);
            LOGGER.log(Level.WARNING, "Heap exhausted allocating " + width + "x" + height + " " + layout);
            Runtime runtime = Runtime.getRuntime();
            long available = runtime.maxMemory() - (runtime.totalMemory() - runtime.freeMemory());
            throw new AllocationFailureException("Out of memory allocating " + size + " bytes", size, available, e);
        }

        PixelBuffer buffer = PixelBuffer.wrap(width, height, layout, data);
        active.put(buffer, new AllocationInfo(totalAllocated.incrementAndGet(), size, captureLocations));
        return buffer;
    }

    @Override
    public void release(PixelBuffer buffer) {
        if (buffer == null) return;
        AllocationInfo info = active.remove(buffer);
        if (info != null) {
            bytesInUse.addAndGet(-info.bytes);
            totalReleased.incrementAndGet();
        }
    }

    @Override
    public long bytesInUse() {
        return bytesInUse.get();
    }

    public boolean isTracked(PixelBuffer buffer) {
        return active.containsKey(buffer);
    }

    public int getActiveCount() {
        return active.size();
    }

    public long getTotalAllocated() {
        return totalAllocated.get();
    }

    public long getTotalReleased() {
        return totalReleased.get();
    }

    public void printSummary(PrintStream out) {
        out.printf("[TrackingBufferAllocator] Allocated: %d, Released: %d, Active: %d (%d bytes)%n",
                totalAllocated.get(), totalReleased.get(), active.size(), bytesInUse.get());
    }

    /**
     * Dump all active (potentially leaked) buffers with their allocation sites.
     */
    public void dumpLeaks(PrintStream out) {
        if (active.isEmpty()) {
            out.println("[TrackingBufferAllocator] No active buffers (no leaks detected)");
            return;
        }

        out.printf("[TrackingBufferAllocator] === %d ACTIVE BUFFERS (potential leaks) ===%n", active.size());
        long now = System.currentTimeMillis();
        int count = 0;
        for (Map.Entry<PixelBuffer, AllocationInfo> entry : active.entrySet()) {
            AllocationInfo info = entry.getValue();
            out.printf("  #%d %s, %d bytes, age %dms, allocated at %s%n",
                    info.id, entry.getKey(), info.bytes, now - info.creationTime, info.location);
            if (++count >= 50) {
                out.printf("  ... and %d more (showing first 50)%n", active.size() - 50);
                break;
            }
        }
        out.println("[TrackingBufferAllocator] === END LEAK DUMP ===");
    }
}
