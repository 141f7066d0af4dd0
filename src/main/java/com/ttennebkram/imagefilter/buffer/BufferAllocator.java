package com.ttennebkram.imagefilter.buffer;

/**
 * Host-provided allocator for pixel buffers, with byte accounting.
 *
 * Release is bookkeeping: a released buffer stays readable for anyone still
 * holding a reference to it, the allocator simply stops counting its bytes.
 * Releasing the same buffer twice, or a buffer this allocator never produced,
 * is a no-op.
 */
public interface BufferAllocator {

    /**
     * Allocate a zero-filled, writable buffer.
     *
     * @throws AllocationFailureException if the memory is not available
     */
    PixelBuffer allocate(int width, int height, ChannelLayout layout) throws AllocationFailureException;

    /**
     * Allocate a buffer with the same dimensions and layout as the template.
     */
    default PixelBuffer allocateLike(PixelBuffer template) throws AllocationFailureException {
        return allocate(template.getWidth(), template.getHeight(), template.getLayout());
    }

    void release(PixelBuffer buffer);

    /**
     * Bytes currently allocated and not yet released.
     */
    long bytesInUse();
}
