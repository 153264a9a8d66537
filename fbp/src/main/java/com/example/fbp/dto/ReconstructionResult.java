package com.example.fbp.dto;

import com.example.fbp.engine.FilterFamily;
import com.example.fbp.exception.InvalidInputException;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one successful pipeline run. {@code imageData} and {@code filteredSinogram} are
 * unsigned 8-bit gray levels; the filtered sinogram has the shape of the input sinogram.
 */
public record ReconstructionResult(
        byte[] imageData,
        int size,
        byte[] filteredSinogram,
        int detectorCount,
        int angleCount,
        FilterFamily filterUsed,
        QualityMetrics metrics,
        RunStatistics statistics
) {

    public ReconstructionResult {
        InvalidInputException.require(imageData != null && imageData.length == (long) size * size,
                "Result image must hold " + size + "x" + size + " gray levels");
        imageData = imageData.clone();
        filteredSinogram = filteredSinogram != null ? filteredSinogram.clone() : null;
    }

    @Override
    public byte[] imageData() {
        return imageData.clone();
    }

    @Override
    public byte[] filteredSinogram() {
        return filteredSinogram != null ? filteredSinogram.clone() : null;
    }

    public ReconstructionResult withStatistics(RunStatistics runStatistics) {
        return new ReconstructionResult(imageData, size, filteredSinogram, detectorCount, angleCount,
                filterUsed, metrics, runStatistics);
    }

    public Optional<QualityMetrics> qualityMetrics() {
        return Optional.ofNullable(metrics);
    }

    public Optional<byte[]> filteredSinogramData() {
        return Optional.ofNullable(filteredSinogram());
    }

    public int grayLevel(int x, int y) {
        return imageData[y * size + x] & 0xFF;
    }

    /** Output image as gray levels in [0,255]. */
    public GrayImage toGrayImage() {
        double[] levels = new double[imageData.length];
        for (int i = 0; i < levels.length; i++) {
            levels[i] = imageData[i] & 0xFF;
        }
        return new GrayImage(size, size, levels);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReconstructionResult other)) return false;
        return size == other.size && detectorCount == other.detectorCount && angleCount == other.angleCount
                && filterUsed == other.filterUsed && Arrays.equals(imageData, other.imageData)
                && Arrays.equals(filteredSinogram, other.filteredSinogram)
                && Objects.equals(metrics, other.metrics) && Objects.equals(statistics, other.statistics);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(size, detectorCount, angleCount, filterUsed, metrics, statistics);
        result = 31 * result + Arrays.hashCode(imageData);
        return 31 * result + Arrays.hashCode(filteredSinogram);
    }

    @Override
    public String toString() {
        return "ReconstructionResult[" + size + "x" + size + ", filter=" + filterUsed.id()
                + ", sinogram " + detectorCount + "x" + angleCount + "]";
    }
}
