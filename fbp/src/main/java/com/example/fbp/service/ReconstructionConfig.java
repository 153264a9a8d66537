package com.example.fbp.service;

import com.example.fbp.engine.DisplayMapping;
import com.example.fbp.engine.FilterFamily;
import com.example.fbp.engine.RayNormalization;
import com.example.fbp.exception.InvalidInputException;

/**
 * Settings of one pipeline run.
 *
 * @param filterFamily            window applied to the ramp kernel
 * @param outputSize              side of the square output, {@code null} for automatic
 * @param maxImageSize            input images are shrunk so neither side exceeds this
 * @param windowedSsim            report 7x7 windowed SSIM instead of the global statistic
 * @param angleCount              projections taken from an input image, 0 for {@code max(W,H)}
 * @param rayNormalization        forward-projection ray convention
 * @param displayMapping          float to 8-bit mapping of the output image
 * @param includeFilteredSinogram also return the filtered sinogram as a gray raster
 * @param parallel                spread back-projection over the fork-join pool
 */
public record ReconstructionConfig(
        FilterFamily filterFamily,
        Integer outputSize,
        int maxImageSize,
        boolean windowedSsim,
        int angleCount,
        RayNormalization rayNormalization,
        DisplayMapping displayMapping,
        boolean includeFilteredSinogram,
        boolean parallel
) {

    public static final int DEFAULT_MAX_IMAGE_SIZE = 256;

    public ReconstructionConfig {
        InvalidInputException.require(filterFamily != null, "Filter family is required");
        InvalidInputException.require(outputSize == null || outputSize > 0,
                "Output size must be positive, got " + outputSize);
        InvalidInputException.require(outputSize == null || (long) outputSize * outputSize <= Integer.MAX_VALUE,
                "Output size " + outputSize + " is too large for a square image buffer");
        InvalidInputException.require(maxImageSize > 0, "Maximum image size must be positive, got " + maxImageSize);
        InvalidInputException.require(angleCount >= 0, "Angle count must not be negative, got " + angleCount);
        if (rayNormalization == null) {
            rayNormalization = RayNormalization.SUM;
        }
        if (displayMapping == null) {
            displayMapping = DisplayMapping.LINEAR;
        }
    }

    public static ReconstructionConfig defaults() {
        return new ReconstructionConfig(FilterFamily.HANN, null, DEFAULT_MAX_IMAGE_SIZE, false, 0,
                RayNormalization.SUM, DisplayMapping.LINEAR, true, true);
    }

    public ReconstructionConfig withFilterFamily(FilterFamily family) {
        return new ReconstructionConfig(family, outputSize, maxImageSize, windowedSsim, angleCount,
                rayNormalization, displayMapping, includeFilteredSinogram, parallel);
    }

    public ReconstructionConfig withOutputSize(Integer size) {
        return new ReconstructionConfig(filterFamily, size, maxImageSize, windowedSsim, angleCount,
                rayNormalization, displayMapping, includeFilteredSinogram, parallel);
    }

    public ReconstructionConfig withMaxImageSize(int size) {
        return new ReconstructionConfig(filterFamily, outputSize, size, windowedSsim, angleCount,
                rayNormalization, displayMapping, includeFilteredSinogram, parallel);
    }

    public ReconstructionConfig withAngleCount(int count) {
        return new ReconstructionConfig(filterFamily, outputSize, maxImageSize, windowedSsim, count,
                rayNormalization, displayMapping, includeFilteredSinogram, parallel);
    }

    public ReconstructionConfig withWindowedSsim(boolean windowed) {
        return new ReconstructionConfig(filterFamily, outputSize, maxImageSize, windowed, angleCount,
                rayNormalization, displayMapping, includeFilteredSinogram, parallel);
    }

    public ReconstructionConfig withRayNormalization(RayNormalization normalization) {
        return new ReconstructionConfig(filterFamily, outputSize, maxImageSize, windowedSsim, angleCount,
                normalization, displayMapping, includeFilteredSinogram, parallel);
    }

    public ReconstructionConfig withDisplayMapping(DisplayMapping mapping) {
        return new ReconstructionConfig(filterFamily, outputSize, maxImageSize, windowedSsim, angleCount,
                rayNormalization, mapping, includeFilteredSinogram, parallel);
    }

    public ReconstructionConfig withParallel(boolean enabled) {
        return new ReconstructionConfig(filterFamily, outputSize, maxImageSize, windowedSsim, angleCount,
                rayNormalization, displayMapping, includeFilteredSinogram, enabled);
    }
}
