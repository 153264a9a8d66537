package com.example.fbp.dto;

import com.example.fbp.exception.InvalidInputException;

/**
 * Boundary raster: 4 samples per pixel (R,G,B,A), each an unsigned byte, row-major.
 */
public record RasterImage(int width, int height, byte[] samples) {

    public static final int CHANNELS = 4;

    public RasterImage {
        InvalidInputException.require(width > 0 && height > 0,
                "Raster dimensions must be positive, got " + width + "x" + height);
        InvalidInputException.require(samples != null, "Raster sample buffer is null");
        InvalidInputException.require(samples.length == (long) width * height * CHANNELS,
                "Raster buffer holds " + samples.length + " bytes, expected " + width + "x" + height + "x" + CHANNELS);
        samples = samples.clone();
    }

    /**
     * Builds an opaque gray raster from an image normalized to [0,1]; values outside are clamped.
     */
    public static RasterImage fromGray(GrayImage image) {
        double[] pixels = image.pixels();
        byte[] samples = new byte[pixels.length * CHANNELS];
        for (int i = 0; i < pixels.length; i++) {
            int level = (int) Math.round(Math.max(0.0, Math.min(1.0, pixels[i])) * 255.0);
            int idx = i * CHANNELS;
            samples[idx] = (byte) level;
            samples[idx + 1] = (byte) level;
            samples[idx + 2] = (byte) level;
            samples[idx + 3] = (byte) 255;
        }
        return new RasterImage(image.width(), image.height(), samples);
    }

    @Override
    public byte[] samples() {
        return samples.clone();
    }

    public int pixelCount() {
        return width * height;
    }

    public int red(int pixel) {
        return samples[pixel * CHANNELS] & 0xFF;
    }

    public int green(int pixel) {
        return samples[pixel * CHANNELS + 1] & 0xFF;
    }

    public int blue(int pixel) {
        return samples[pixel * CHANNELS + 2] & 0xFF;
    }

    @Override
    public String toString() {
        return "RasterImage[" + width + "x" + height + "]";
    }
}
