package com.example.fbp.engine;

import com.example.fbp.dto.Sinogram;
import com.example.fbp.exception.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spatial-domain ramp filtering. The kernel approximates the |omega| response of the ramp filter
 * and is applied to each projection by direct convolution.
 */
public final class FilterBank {

    private static final Logger logger = LoggerFactory.getLogger(FilterBank.class);

    private FilterBank() {
    }

    /**
     * Ram-Lak kernel of length {@code size}, centered at {@code floor(size/2)}, multiplied by the
     * window of {@code family}.
     */
    public static double[] makeKernel(int size, FilterFamily family) {
        InvalidInputException.require(size > 0, "Kernel size must be positive, got " + size);
        InvalidInputException.require(family != null, "Filter family is null");

        double[] kernel = new double[size];
        int center = size / 2;
        for (int i = 0; i < size; i++) {
            int n = i - center;
            kernel[i] = ramLak(n) * family.window(i, n, size);
        }
        return kernel;
    }

    static double ramLak(int n) {
        if (n == 0) {
            return 0.25;
        }
        if (n % 2 == 0) {
            return 0.0;
        }
        return -1.0 / (Math.PI * Math.PI * n * n);
    }

    /**
     * Convolves every projection row with {@code kernel}; samples beyond the row ends count as zero.
     */
    public static Sinogram filterSinogram(Sinogram sinogram, double[] kernel) {
        int detectors = sinogram.detectorCount();
        int angles = sinogram.angleCount();
        double[] data = sinogram.samples();
        double[] filtered = new double[data.length];
        double[] projection = new double[detectors];

        for (int row = 0; row < angles; row++) {
            int offset = row * detectors;
            System.arraycopy(data, offset, projection, 0, detectors);
            double[] out = convolve(projection, kernel);
            System.arraycopy(out, 0, filtered, offset, detectors);
        }
        logger.debug("[FILTER] filtered {} projections with a {}-tap kernel", angles, kernel.length);
        return new Sinogram(detectors, angles, filtered, sinogram.angles());
    }

    public static double[] convolve(double[] signal, double[] kernel) {
        double[] result = new double[signal.length];
        int half = kernel.length / 2;
        for (int i = 0; i < signal.length; i++) {
            double sum = 0;
            int jStart = Math.max(0, half - i);
            int jEnd = Math.min(kernel.length, signal.length + half - i);
            for (int j = jStart; j < jEnd; j++) {
                sum += signal[i - half + j] * kernel[j];
            }
            result[i] = sum;
        }
        return result;
    }
}
