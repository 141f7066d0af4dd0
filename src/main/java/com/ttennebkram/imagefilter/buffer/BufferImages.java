package com.ttennebkram.imagefilter.buffer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Conversions between {@link PixelBuffer} and AWT images, plus file I/O via ImageIO.
 */
public final class BufferImages {

    private BufferImages() {
    }

    public static PixelBuffer read(Path path, BufferAllocator allocator) throws IOException, AllocationFailureException {
        BufferedImage image = ImageIO.read(path.toFile());
        if (image == null) {
            throw new IOException("Unsupported image format: " + path);
        }
        return fromImage(image, allocator);
    }

    /**
     * Write using the format named by the file extension; alpha is dropped for JPEG.
     */
    public static void write(PixelBuffer buffer, Path path) throws IOException {
        String format = formatName(path);
        BufferedImage image = toImage(buffer);
        if (buffer.getLayout().hasAlpha() && (format.equals("jpg") || format.equals("jpeg"))) {
            image = toImage(dropAlpha(buffer));
        }
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(image, format, path.toFile())) {
            throw new IOException("No ImageIO writer for format '" + format + "'");
        }
    }

    public static PixelBuffer fromImage(BufferedImage image, BufferAllocator allocator)
            throws AllocationFailureException {
        int width = image.getWidth();
        int height = image.getHeight();
        if (image.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            PixelBuffer buffer = allocator.allocate(width, height, ChannelLayout.GRAY);
            Raster raster = image.getRaster();
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    buffer.set(x, y, 0, raster.getSample(x, y, 0));
                }
            }
            return buffer;
        }

        ChannelLayout layout = image.getColorModel().hasAlpha() ? ChannelLayout.RGBA : ChannelLayout.RGB;
        PixelBuffer buffer = allocator.allocate(width, height, layout);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int argb = image.getRGB(x, y);
                buffer.set(x, y, 0, (argb >> 16) & 0xFF);
                buffer.set(x, y, 1, (argb >> 8) & 0xFF);
                buffer.set(x, y, 2, argb & 0xFF);
                if (layout == ChannelLayout.RGBA) {
                    buffer.set(x, y, 3, (argb >>> 24) & 0xFF);
                }
            }
        }
        return buffer;
    }

    public static BufferedImage toImage(PixelBuffer buffer) {
        int width = buffer.getWidth();
        int height = buffer.getHeight();
        switch (buffer.getLayout()) {
            case GRAY -> {
                BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
                WritableRaster raster = image.getRaster();
                for (int y = 0; y < height; y++) {
                    for (int x = 0; x < width; x++) {
                        raster.setSample(x, y, 0, buffer.get(x, y, 0));
                    }
                }
                return image;
            }
            case RGB, RGBA -> {
                boolean alpha = buffer.getLayout().hasAlpha();
                BufferedImage image = new BufferedImage(width, height,
                        alpha ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB);
                for (int y = 0; y < height; y++) {
                    for (int x = 0; x < width; x++) {
                        int a = alpha ? buffer.get(x, y, 3) : 0xFF;
                        int argb = (a << 24) | (buffer.get(x, y, 0) << 16) | (buffer.get(x, y, 1) << 8)
                                | buffer.get(x, y, 2);
                        image.setRGB(x, y, argb);
                    }
                }
                return image;
            }
            default -> throw new IllegalArgumentException("Unsupported layout " + buffer.getLayout());
        }
    }

    private static PixelBuffer dropAlpha(PixelBuffer buffer) {
        PixelBuffer rgb = PixelBuffer.filled(buffer.getWidth(), buffer.getHeight(), ChannelLayout.RGB, 0, 0, 0);
        for (int y = 0; y < buffer.getHeight(); y++) {
            for (int x = 0; x < buffer.getWidth(); x++) {
                for (int c = 0; c < 3; c++) {
                    rgb.set(x, y, c, buffer.get(x, y, c));
                }
            }
        }
        return rgb;
    }

    static String formatName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "png";
        }
        return name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
