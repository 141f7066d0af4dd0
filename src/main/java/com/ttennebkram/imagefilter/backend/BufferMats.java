package com.ttennebkram.imagefilter.backend;

import com.ttennebkram.imagefilter.buffer.AllocationFailureException;
import com.ttennebkram.imagefilter.buffer.BufferAllocator;
import com.ttennebkram.imagefilter.buffer.PixelBuffer;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Conversions between pixel buffers and OpenCV Mats.
 * Channel order is kept as is; the buffer's RGB stays RGB inside the Mat.
 */
public final class BufferMats {

    private BufferMats() {
    }

    /**
     * Copy a buffer into a new 8-bit Mat. The caller releases the Mat.
     */
    public static Mat toMat(PixelBuffer buffer) {
        Mat mat = new Mat(buffer.getHeight(), buffer.getWidth(), CvType.CV_8UC(buffer.getChannels()));
        mat.put(0, 0, buffer.rawData());
        return mat;
    }

    /**
     * Copy an 8-bit Mat into a new buffer shaped like the template.
     *
     * @throws IllegalArgumentException if the Mat does not match the template
     */
    public static PixelBuffer fromMat(Mat mat, PixelBuffer template, BufferAllocator allocator)
            throws AllocationFailureException {
        if (mat.rows() != template.getHeight() || mat.cols() != template.getWidth()
                || mat.channels() != template.getChannels() || mat.depth() != CvType.CV_8U) {
            throw new IllegalArgumentException("Mat " + mat + " does not match " + template);
        }
        PixelBuffer output = allocator.allocateLike(template);
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        try {
            continuous.get(0, 0, output.rawData());
        } finally {
            if (continuous != mat) {
                continuous.release();
            }
        }
        return output;
    }
}
