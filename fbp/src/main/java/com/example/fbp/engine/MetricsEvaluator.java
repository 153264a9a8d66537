package com.example.fbp.engine;

import com.example.fbp.dto.GrayImage;
import com.example.fbp.dto.QualityMetrics;
import com.example.fbp.exception.InvalidInputException;
import org.nd4j.linalg.api.ndarray.INDArray;
import org.nd4j.linalg.factory.Nd4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fidelity statistics between two same-shaped images in the 8-bit range [0,255].
 *
 * <p>{@link #ssim} is a <em>global</em> simplification of SSIM: one mean/variance/covariance
 * triple over the whole image instead of a sliding Gaussian window, so its scores are not
 * comparable with the canonical windowed index. {@link #windowedSsim} averages the same formula
 * over 7x7 windows and is used only on request.
 */
public final class MetricsEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(MetricsEvaluator.class);

    public static final double PSNR_CAP = 100.0;
    public static final double C1 = 6.5025;   // (0.01 * 255)^2
    public static final double C2 = 58.5225;  // (0.03 * 255)^2
    static final int WINDOW = 7;

    private MetricsEvaluator() {
    }

    public static QualityMetrics evaluate(GrayImage original, GrayImage reconstructed, boolean windowed) {
        requireSameShape(original, reconstructed);
        double mse = mse(original, reconstructed);
        double psnr = psnrFromMse(mse);
        double ssim = windowed ? windowedSsim(original, reconstructed) : ssim(original, reconstructed);
        logger.info("[METRICS] MSE={} PSNR={} dB SSIM={}{}", String.format("%.4f", mse),
                String.format("%.2f", psnr), String.format("%.4f", ssim), windowed ? " (windowed)" : "");
        return new QualityMetrics(mse, psnr, ssim);
    }

    public static double mse(GrayImage original, GrayImage reconstructed) {
        requireSameShape(original, reconstructed);
        INDArray diff = Nd4j.createFromArray(original.pixels()).sub(Nd4j.createFromArray(reconstructed.pixels()));
        return diff.mul(diff).meanNumber().doubleValue();
    }

    public static double psnr(GrayImage original, GrayImage reconstructed) {
        return psnrFromMse(mse(original, reconstructed));
    }

    static double psnrFromMse(double mse) {
        if (mse == 0) {
            return PSNR_CAP;
        }
        return 10 * Math.log10((255.0 * 255.0) / mse);
    }

    public static double ssim(GrayImage original, GrayImage reconstructed) {
        requireSameShape(original, reconstructed);
        INDArray x = Nd4j.createFromArray(original.pixels());
        INDArray y = Nd4j.createFromArray(reconstructed.pixels());

        double meanX = x.meanNumber().doubleValue();
        double meanY = y.meanNumber().doubleValue();
        INDArray dx = x.sub(meanX);
        INDArray dy = y.sub(meanY);
        double varX = dx.mul(dx).meanNumber().doubleValue();
        double varY = dy.mul(dy).meanNumber().doubleValue();
        double covar = dx.mul(dy).meanNumber().doubleValue();

        return ssimFormula(meanX, meanY, varX, varY, covar);
    }

    /**
     * Mean of the SSIM formula over every 7x7 window (uniform weights, stride 1). Images smaller
     * than the window fall back to the global statistic.
     */
    public static double windowedSsim(GrayImage original, GrayImage reconstructed) {
        requireSameShape(original, reconstructed);
        int width = original.width();
        int height = original.height();
        if (width < WINDOW || height < WINDOW) {
            return ssim(original, reconstructed);
        }
        double[] a = original.pixels();
        double[] b = reconstructed.pixels();
        double n = WINDOW * WINDOW;
        double total = 0;
        int windows = 0;
        for (int y0 = 0; y0 + WINDOW <= height; y0++) {
            for (int x0 = 0; x0 + WINDOW <= width; x0++) {
                double sumA = 0, sumB = 0, sumAA = 0, sumBB = 0, sumAB = 0;
                for (int y = y0; y < y0 + WINDOW; y++) {
                    int row = y * width;
                    for (int x = x0; x < x0 + WINDOW; x++) {
                        double va = a[row + x];
                        double vb = b[row + x];
                        sumA += va;
                        sumB += vb;
                        sumAA += va * va;
                        sumBB += vb * vb;
                        sumAB += va * vb;
                    }
                }
                double meanA = sumA / n;
                double meanB = sumB / n;
                double varA = Math.max(0, sumAA / n - meanA * meanA);
                double varB = Math.max(0, sumBB / n - meanB * meanB);
                double cov = sumAB / n - meanA * meanB;
                total += ssimFormula(meanA, meanB, varA, varB, cov);
                windows++;
            }
        }
        return total / windows;
    }

    static double ssimFormula(double meanX, double meanY, double varX, double varY, double covar) {
        return ((2 * meanX * meanY + C1) * (2 * covar + C2))
                / ((meanX * meanX + meanY * meanY + C1) * (varX + varY + C2));
    }

    private static void requireSameShape(GrayImage original, GrayImage reconstructed) {
        InvalidInputException.require(original != null && reconstructed != null, "Metrics need two images");
        InvalidInputException.require(original.sameShape(reconstructed),
                "Image shapes differ: " + original.width() + "x" + original.height()
                        + " vs " + reconstructed.width() + "x" + reconstructed.height());
    }
}
