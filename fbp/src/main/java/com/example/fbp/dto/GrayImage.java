package com.example.fbp.dto;

import com.example.fbp.exception.InvalidInputException;

import java.util.Arrays;

/**
 * Single-channel image, row-major with stride = width. Samples are either normalized to [0,1]
 * or quantized to [0,255] depending on the pipeline stage that produced them.
 */
public record GrayImage(int width, int height, double[] pixels) {

    public GrayImage {
        InvalidInputException.require(width > 0 && height > 0,
                "Image dimensions must be positive, got " + width + "x" + height);
        InvalidInputException.require(pixels != null, "Image pixel buffer is null");
        InvalidInputException.require(pixels.length == (long) width * height,
                "Image buffer holds " + pixels.length + " samples, expected " + width + "x" + height);
        pixels = pixels.clone();
    }

    public static GrayImage filled(int width, int height, double value) {
        double[] pixels = new double[Math.max(0, width) * Math.max(0, height)];
        Arrays.fill(pixels, value);
        return new GrayImage(width, height, pixels);
    }

    @Override
    public double[] pixels() {
        return pixels.clone();
    }

    public double get(int x, int y) {
        return pixels[y * width + x];
    }

    public boolean sameShape(GrayImage other) {
        return other != null && width == other.width && height == other.height;
    }

    /** Multiplies every sample by {@code factor}, e.g. 255 to go from the [0,1] to the 8-bit form. */
    public GrayImage scaled(double factor) {
        double[] out = new double[pixels.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = pixels[i] * factor;
        }
        return new GrayImage(width, height, out);
    }

    /**
     * Places this image centered on a blank square canvas of side {@code size}, cropping when the
     * image is larger than the canvas.
     */
    public GrayImage centeredOn(int size) {
        if (width == size && height == size) {
            return this;
        }
        InvalidInputException.require(size > 0 && (long) size * size <= Integer.MAX_VALUE,
                "Canvas size " + size + " does not fit a square image buffer");
        double[] out = new double[size * size];
        int offsetX = (size - width) / 2;
        int offsetY = (size - height) / 2;
        for (int y = 0; y < height; y++) {
            int ty = y + offsetY;
            if (ty < 0 || ty >= size) continue;
            for (int x = 0; x < width; x++) {
                int tx = x + offsetX;
                if (tx >= 0 && tx < size) {
                    out[ty * size + tx] = pixels[y * width + x];
                }
            }
        }
        return new GrayImage(size, size, out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GrayImage other)) return false;
        return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "GrayImage[" + width + "x" + height + "]";
    }
}
