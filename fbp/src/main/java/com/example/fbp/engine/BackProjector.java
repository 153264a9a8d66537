package com.example.fbp.engine;

import com.example.fbp.dto.GrayImage;
import com.example.fbp.dto.Sinogram;
import com.example.fbp.exception.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

/**
 * Weighted back-projection of a filtered sinogram onto a square grid (inverse Radon transform).
 *
 * <p>Angles are processed in chunks of roughly a tenth of the angle count; a progress checkpoint
 * follows every chunk. Within a chunk the output rows may be spread over the common fork-join
 * pool: every task owns whole rows and adds the angles in index order, so the parallel and the
 * sequential paths produce bit-identical images.
 */
public final class BackProjector {

    private static final Logger logger = LoggerFactory.getLogger(BackProjector.class);

    static final int CHECKPOINTS = 10;

    private BackProjector() {
    }

    public static GrayImage reconstruct(Sinogram filtered, int outputSize) {
        return reconstruct(filtered, outputSize, true, ProgressTracker.silent(), 0, 100);
    }

    /**
     * @param filtered    ramp-filtered sinogram
     * @param outputSize  side S of the square output
     * @param parallel    spread output rows over the fork-join pool
     * @param tracker     checkpoint gate, polled after every angle chunk
     * @param fromPercent progress reported before the first chunk
     * @param toPercent   progress reported after the last chunk
     * @return S x S image, scaled by {@code pi / (2A)}
     */
    public static GrayImage reconstruct(Sinogram filtered, int outputSize, boolean parallel,
                                        ProgressTracker tracker, int fromPercent, int toPercent) {
        InvalidInputException.require(filtered != null, "Filtered sinogram is null");
        InvalidInputException.require(outputSize > 0, "Output size must be positive, got " + outputSize);
        InvalidInputException.require((long) outputSize * outputSize <= Integer.MAX_VALUE,
                "Output size " + outputSize + " is too large for a square image buffer");

        final int numAngles = filtered.angleCount();
        final int numDetectors = filtered.detectorCount();
        final int size = outputSize;
        final double[] data = filtered.samples();
        final double[] image = new double[size * size];

        final double center = size / 2.0;
        final double detectorCenter = numDetectors / 2.0;
        final double[] cos = new double[numAngles];
        final double[] sin = new double[numAngles];
        double[] angles = filtered.angles();
        for (int a = 0; a < numAngles; a++) {
            double theta = Math.toRadians(angles[a]);
            cos[a] = Math.cos(theta);
            sin[a] = Math.sin(theta);
        }

        int chunk = Math.max(1, (numAngles + CHECKPOINTS - 1) / CHECKPOINTS);
        tracker.checkpoint(fromPercent, "Back-projection: 0%");

        for (int start = 0; start < numAngles; start += chunk) {
            final int first = start;
            final int last = Math.min(numAngles, start + chunk);

            IntStream rows = IntStream.range(0, size);
            if (parallel) {
                rows = rows.parallel();
            }
            rows.forEach(y -> {
                double dy = y - center;
                int rowOffset = y * size;
                for (int a = first; a < last; a++) {
                    int offset = a * numDetectors;
                    double c = cos[a];
                    double base = dy * sin[a] + detectorCenter;
                    for (int x = 0; x < size; x++) {
                        double t = (x - center) * c + base;
                        if (t >= 0 && t < numDetectors - 1) {
                            image[rowOffset + x] += interpolate(data, offset, t);
                        }
                    }
                }
            });

            double done = (double) last / numAngles;
            tracker.checkpoint(fromPercent, toPercent, done,
                    "Back-projection: " + Math.round(done * 100) + "%");
        }

        double normFactor = Math.PI / (2.0 * numAngles);
        for (int i = 0; i < image.length; i++) {
            image[i] *= normFactor;
        }

        logger.debug("[BACKPROJECTION] {} angles x {} detectors -> {}x{} (parallel={})",
                numAngles, numDetectors, size, size, parallel);
        return new GrayImage(size, size, image);
    }

    /**
     * Linear interpolation of {@code row} at fractional detector position {@code t}; an integer
     * {@code t} returns the sample itself.
     */
    public static double interpolate(double[] row, double t) {
        InvalidInputException.require(t >= 0 && t <= row.length - 1,
                "Detector position " + t + " outside [0, " + (row.length - 1) + "]");
        return interpolate(row, 0, t);
    }

    static double interpolate(double[] data, int offset, double t) {
        int i0 = (int) Math.floor(t);
        double w = t - i0;
        if (w == 0.0) {
            return data[offset + i0];
        }
        return data[offset + i0] * (1 - w) + data[offset + i0 + 1] * w;
    }
}
