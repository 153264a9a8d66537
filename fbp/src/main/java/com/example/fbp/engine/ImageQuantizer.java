package com.example.fbp.engine;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Converts floating-point buffers to unsigned 8-bit gray levels. A buffer without dynamic range
 * becomes uniform {@link #MID_GRAY}.
 */
public final class ImageQuantizer {

    private static final Logger logger = LoggerFactory.getLogger(ImageQuantizer.class);

    public static final int MID_GRAY = 128;
    static final double LOW_PERCENTILE = 0.5;
    static final double HIGH_PERCENTILE = 99.5;
    static final double GAMMA = 0.7;

    private ImageQuantizer() {
    }

    public static byte[] quantize(double[] values, DisplayMapping mapping) {
        if (mapping == DisplayMapping.PERCENTILE_GAMMA) {
            return percentileGamma(values);
        }
        return linear(values);
    }

    public static byte[] linear(double[] values) {
        byte[] out = new byte[values.length];
        if (values.length == 0) {
            return out;
        }
        INDArray v = Nd4j.createFromArray(values);
        double min = v.minNumber().doubleValue();
        double max = v.maxNumber().doubleValue();
        double range = max - min;
        if (!(range > 1e-12) || !Double.isFinite(range)) {
            logger.warn("[QUANTIZE] Zero dynamic range ({}..{}); using mid-gray.", min, max);
            Arrays.fill(out, (byte) MID_GRAY);
            return out;
        }
        double[] scaled = v.sub(min).div(range).mul(255.0).data().asDouble();
        for (int i = 0; i < out.length; i++) {
            out[i] = toLevel(scaled[i]);
        }
        return out;
    }

    static byte[] percentileGamma(double[] values) {
        byte[] out = new byte[values.length];
        if (values.length == 0) {
            return out;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double low = percentile(sorted, LOW_PERCENTILE);
        double high = percentile(sorted, HIGH_PERCENTILE);
        if (!(high - low > 1e-12)) {
            logger.warn("[QUANTIZE] Percentile window collapsed ({}..{}); using mid-gray.", low, high);
            Arrays.fill(out, (byte) MID_GRAY);
            return out;
        }
        double range = high - low;
        for (int i = 0; i < values.length; i++) {
            double clipped = Math.max(low, Math.min(high, values[i]));
            double normalized = (clipped - low) / range;
            out[i] = toLevel(Math.pow(normalized, GAMMA) * 255.0);
        }
        return out;
    }

    /** Linearly interpolated percentile of an ascending array, {@code p} in [0,100]. */
    static double percentile(double[] sorted, double p) {
        double pos = p / 100.0 * (sorted.length - 1);
        int lo = (int) Math.floor(pos);
        int hi = Math.min(sorted.length - 1, lo + 1);
        double frac = pos - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }

    private static byte toLevel(double v) {
        long level = Math.round(v);
        return (byte) Math.max(0, Math.min(255, level));
    }

    /** Gray levels of a [0,1] image, rounded to [0,255]. */
    public static double[] toLevels(double[] normalized) {
        double[] out = new double[normalized.length];
        for (int i = 0; i < out.length; i++) {
            out[i] = Math.max(0, Math.min(255, Math.round(normalized[i] * 255.0)));
        }
        return out;
    }
}
