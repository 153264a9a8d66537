package com.example.fbp.engine;

import com.example.fbp.dto.GrayImage;
import com.example.fbp.dto.Sinogram;
import com.example.fbp.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ForwardProjectorTest {

    @Test
    void testDetectorCountCoversTheDiagonal() {
        assertEquals(91, ForwardProjector.detectorCount(64, 64));
        assertEquals(5, ForwardProjector.detectorCount(3, 4));
        assertEquals(2, ForwardProjector.detectorCount(1, 1));

        Sinogram sinogram = ForwardProjector.project(GrayImage.filled(30, 40, 0.0), Sinogram.evenAngles(12));
        assertEquals(50, sinogram.detectorCount());
        assertEquals(12, sinogram.angleCount());
    }

    @Test
    void testCenteredPointIsAngleInvariant() {
        int size = 64;
        double[] pixels = new double[size * size];
        pixels[(size / 2) * size + size / 2] = 1.0;
        GrayImage point = new GrayImage(size, size, pixels);

        Sinogram sinogram = ForwardProjector.project(point, Sinogram.evenAngles(180));

        int centerBin = sinogram.detectorCount() / 2;
        for (int a = 0; a < sinogram.angleCount(); a++) {
            double[] row = sinogram.row(a);
            assertEquals(1.0, row[centerBin], 0.0, "angle row " + a);
            double max = 0;
            for (double v : row) {
                max = Math.max(max, v);
            }
            assertEquals(1.0, max, 0.0, "angle row " + a);
        }
    }

    @Test
    void testBlankImageGivesBlankSinogram() {
        Sinogram sinogram = ForwardProjector.project(GrayImage.filled(16, 16, 0.0), Sinogram.evenAngles(8));
        for (double v : sinogram.samples()) {
            assertEquals(0.0, v, 0.0);
        }
    }

    @Test
    void testMeanRescaledConvention() {
        GrayImage ones = GrayImage.filled(16, 16, 1.0);
        double[] angles = {0.0};

        Sinogram mean = ForwardProjector.project(ones, angles, RayNormalization.MEAN_RESCALED);
        Sinogram sum = ForwardProjector.project(ones, angles, RayNormalization.SUM);

        // rho = t - 11.5 at angle 0 hits column round(8 + rho); only rays on the image have samples
        int onImage = 0;
        for (int t = 0; t < mean.detectorCount(); t++) {
            double m = mean.get(0, t);
            if (sum.get(0, t) > 0) {
                assertEquals(16.0, m, 1e-12);
                assertEquals(16.0, sum.get(0, t), 1e-12);
                onImage++;
            } else {
                assertEquals(0.0, m, 0.0);
            }
        }
        assertEquals(16, onImage);
    }

    @Test
    void testSumIsALineIntegral() {
        GrayImage half = GrayImage.filled(20, 20, 0.5);
        // at angle 0 every ray crosses all 20 rows of the image
        Sinogram sinogram = ForwardProjector.project(half, new double[]{0.0});
        double max = 0;
        for (double v : sinogram.row(0)) {
            max = Math.max(max, v);
        }
        assertEquals(10.0, max, 1e-9);
    }

    @Test
    void testAnglesMustBeNonDecreasing() {
        GrayImage image = GrayImage.filled(8, 8, 1.0);
        assertThrows(InvalidInputException.class, () -> ForwardProjector.project(image, new double[]{10, 5}));
        assertThrows(InvalidInputException.class, () -> ForwardProjector.project(image, new double[0]));
        assertThrows(InvalidInputException.class, () -> ForwardProjector.project(null, new double[]{0}));
    }
}
