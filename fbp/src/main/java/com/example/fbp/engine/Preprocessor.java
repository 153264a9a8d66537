package com.example.fbp.engine;

import com.example.fbp.dto.GrayImage;
import com.example.fbp.dto.RasterImage;
import com.example.fbp.exception.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a color raster into a normalized grayscale image: luminance, global histogram
 * equalization, then a light locally-weighted smoothing.
 */
public final class Preprocessor {

    private static final Logger logger = LoggerFactory.getLogger(Preprocessor.class);

    static final int HISTOGRAM_BINS = 256;
    static final int PATCH_SIZE = 3;
    static final double DENOISE_H = 0.05;

    private Preprocessor() {
    }

    public static GrayImage preprocess(RasterImage raster) {
        GrayImage gray = toGray(raster);
        GrayImage equalized = equalizeHistogram(gray);
        return denoise(equalized);
    }

    /** ITU-R 601 luminance of every pixel, divided by 255. Alpha is ignored. */
    public static GrayImage toGray(RasterImage raster) {
        InvalidInputException.require(raster != null, "Raster image is null");
        int count = raster.pixelCount();
        double[] gray = new double[count];
        for (int i = 0; i < count; i++) {
            gray[i] = (0.299 * raster.red(i) + 0.587 * raster.green(i) + 0.114 * raster.blue(i)) / 255.0;
        }
        return new GrayImage(raster.width(), raster.height(), gray);
    }

    /**
     * Global histogram equalization of an image in [0,1]. A histogram with a single occupied
     * bucket cannot be stretched; the input is then returned unchanged.
     */
    public static GrayImage equalizeHistogram(GrayImage image) {
        double[] pixels = image.pixels();
        int[] histogram = new int[HISTOGRAM_BINS];
        for (double v : pixels) {
            histogram[bin(v)]++;
        }

        long[] cdf = new long[HISTOGRAM_BINS];
        cdf[0] = histogram[0];
        for (int i = 1; i < HISTOGRAM_BINS; i++) {
            cdf[i] = cdf[i - 1] + histogram[i];
        }

        long cdfMin = 0;
        for (long v : cdf) {
            if (v > 0) {
                cdfMin = v;
                break;
            }
        }
        long total = pixels.length;
        if (cdfMin == total) {
            logger.warn("[PREPROCESS] Flat histogram ({} samples in one bucket); equalization skipped.", total);
            return image;
        }

        double[] equalized = new double[pixels.length];
        double range = total - cdfMin;
        for (int i = 0; i < pixels.length; i++) {
            equalized[i] = (cdf[bin(pixels[i])] - cdfMin) / range;
        }
        return new GrayImage(image.width(), image.height(), equalized);
    }

    private static int bin(double v) {
        int b = (int) Math.floor(v * (HISTOGRAM_BINS - 1));
        return Math.max(0, Math.min(HISTOGRAM_BINS - 1, b));
    }

    public static GrayImage denoise(GrayImage image) {
        return denoise(image, PATCH_SIZE, DENOISE_H);
    }

    /**
     * Simplified non-local-means: each pixel becomes the average of its {@code patchSize} square
     * neighborhood weighted by {@code exp(-(d/patchSize)^2 / h^2)}, {@code d} being the Euclidean
     * distance to the neighbor. Patch similarity is not compared, so this is a Gaussian-like
     * smoothing rather than the canonical algorithm.
     */
    public static GrayImage denoise(GrayImage image, int patchSize, double h) {
        InvalidInputException.require(patchSize > 0, "Patch size must be positive, got " + patchSize);
        InvalidInputException.require(h > 0, "Filtering strength must be positive, got " + h);
        int width = image.width();
        int height = image.height();
        double[] pixels = image.pixels();
        double[] denoised = new double[pixels.length];
        int halfPatch = patchSize / 2;

        // weights depend only on the offset
        int side = 2 * halfPatch + 1;
        double[] weights = new double[side * side];
        for (int dy = -halfPatch; dy <= halfPatch; dy++) {
            for (int dx = -halfPatch; dx <= halfPatch; dx++) {
                double dist = Math.sqrt(dx * dx + dy * dy) / patchSize;
                weights[(dy + halfPatch) * side + dx + halfPatch] = Math.exp(-(dist * dist) / (h * h));
            }
        }

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sumWeights = 0;
                double sumValues = 0;
                for (int dy = -halfPatch; dy <= halfPatch; dy++) {
                    int ny = y + dy;
                    if (ny < 0 || ny >= height) continue;
                    for (int dx = -halfPatch; dx <= halfPatch; dx++) {
                        int nx = x + dx;
                        if (nx < 0 || nx >= width) continue;
                        double weight = weights[(dy + halfPatch) * side + dx + halfPatch];
                        sumWeights += weight;
                        sumValues += weight * pixels[ny * width + nx];
                    }
                }
                denoised[y * width + x] = sumWeights > 0 ? sumValues / sumWeights : pixels[y * width + x];
            }
        }
        return new GrayImage(width, height, denoised);
    }

    /**
     * Min-max normalization to [0,1]. A constant image has no range to stretch and maps to zeros.
     */
    public static GrayImage normalizeRange(GrayImage image) {
        double[] data = image.pixels();
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : data) {
            if (v < min) min = v;
            if (v > max) max = v;
        }
        double range = max - min;
        double[] out = new double[data.length];
        if (range > 0) {
            for (int i = 0; i < data.length; i++) {
                out[i] = (data[i] - min) / range;
            }
        } else {
            logger.warn("[PREPROCESS] Zero dynamic range ({}); normalized to zeros.", min);
        }
        return new GrayImage(image.width(), image.height(), out);
    }

    /**
     * Nearest-neighbour shrink so that neither side exceeds {@code maxSize}; the aspect ratio is
     * kept and images already small enough are returned as is.
     */
    public static GrayImage downscale(GrayImage image, int maxSize) {
        InvalidInputException.require(maxSize > 0, "Maximum image size must be positive, got " + maxSize);
        int width = image.width();
        int height = image.height();
        double scale = Math.min(1.0, Math.min((double) maxSize / height, (double) maxSize / width));
        if (scale >= 1.0) {
            return image;
        }
        int newWidth = Math.max(1, (int) Math.round(width * scale));
        int newHeight = Math.max(1, (int) Math.round(height * scale));
        double scaleX = (double) width / newWidth;
        double scaleY = (double) height / newHeight;
        double[] src = image.pixels();
        double[] resized = new double[newWidth * newHeight];
        for (int y = 0; y < newHeight; y++) {
            int srcY = Math.min((int) Math.floor(y * scaleY), height - 1);
            for (int x = 0; x < newWidth; x++) {
                int srcX = Math.min((int) Math.floor(x * scaleX), width - 1);
                resized[y * newWidth + x] = src[srcY * width + srcX];
            }
        }
        logger.info("[PREPROCESS] Resized {}x{} -> {}x{} (max {})", width, height, newWidth, newHeight, maxSize);
        return new GrayImage(newWidth, newHeight, resized);
    }
}
