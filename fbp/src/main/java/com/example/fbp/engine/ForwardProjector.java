package com.example.fbp.engine;

import com.example.fbp.dto.GrayImage;
import com.example.fbp.dto.Sinogram;
import com.example.fbp.exception.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parallel-beam Radon transform. The detector spans the image diagonal so no ray leaves the
 * sampled region at any angle; each ray is sampled at unit steps with nearest-pixel lookup.
 */
public final class ForwardProjector {

    private static final Logger logger = LoggerFactory.getLogger(ForwardProjector.class);

    private ForwardProjector() {
    }

    public static int detectorCount(int width, int height) {
        return (int) Math.ceil(Math.sqrt((double) width * width + (double) height * height));
    }

    public static Sinogram project(GrayImage image, double[] angles) {
        return project(image, angles, RayNormalization.SUM);
    }

    /**
     * @param image  source image, any value range
     * @param angles projection angles in degrees, non-decreasing
     * @return sinogram with {@code ceil(sqrt(W^2+H^2))} detector bins and one row per angle
     */
    public static Sinogram project(GrayImage image, double[] angles, RayNormalization normalization) {
        InvalidInputException.require(image != null, "Image to project is null");
        Sinogram.validateAngles(angles);
        RayNormalization mode = normalization != null ? normalization : RayNormalization.SUM;

        int width = image.width();
        int height = image.height();
        double[] pixels = image.pixels();
        int numAngles = angles.length;
        int diagonal = detectorCount(width, height);
        double[] sinogram = new double[diagonal * numAngles];

        double centerX = width / 2.0;
        double centerY = height / 2.0;
        int numSamples = Math.max(width, height);
        int emptyRays = 0;

        for (int angleIdx = 0; angleIdx < numAngles; angleIdx++) {
            double theta = Math.toRadians(angles[angleIdx]);
            double cosTheta = Math.cos(theta);
            double sinTheta = Math.sin(theta);

            for (int t = 0; t < diagonal; t++) {
                double rho = t - diagonal / 2.0;
                double baseX = centerX + rho * cosTheta;
                double baseY = centerY + rho * sinTheta;
                double sum = 0;
                int count = 0;

                for (int k = 0; k < numSamples; k++) {
                    double s = k - numSamples / 2.0;
                    long x = Math.round(baseX - s * sinTheta);
                    long y = Math.round(baseY + s * cosTheta);
                    if (x >= 0 && x < width && y >= 0 && y < height) {
                        sum += pixels[(int) y * width + (int) x];
                        count++;
                    }
                }

                double value;
                if (count == 0) {
                    value = 0;
                    emptyRays++;
                } else if (mode == RayNormalization.MEAN_RESCALED) {
                    value = sum / count * numSamples;
                } else {
                    value = sum;
                }
                sinogram[angleIdx * diagonal + t] = value;
            }
        }

        logger.debug("[RADON] {}x{} image -> {} detectors x {} angles ({} rays missed the image)",
                width, height, diagonal, numAngles, emptyRays);
        return new Sinogram(diagonal, numAngles, sinogram, angles);
    }
}
