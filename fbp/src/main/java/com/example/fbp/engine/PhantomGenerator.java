package com.example.fbp.engine;

import com.example.fbp.dto.GrayImage;
import com.example.fbp.exception.InvalidInputException;

import java.util.Random;

/**
 * Synthetic test images, values in [0,1] on a black background. A pixel belongs to a shape when
 * its center lies inside it.
 */
public final class PhantomGenerator {

    static final int BLOB_COUNT = 5;
    static final double SKULL = 1.0;
    static final double BRAIN = 0.2;
    static final double VENTRICLE = 1.0;

    // x, y offsets relative to size; semi-axes as fractions of 0.3 * size
    private static final double[][] VENTRICLES = {
            {0.22, 0.0, 0.11, 0.20},
            {-0.22, 0.0, 0.13, 0.22},
            {0.0, 0.35, 0.15, 0.08},
    };

    private PhantomGenerator() {
    }

    public static GrayImage generate(PhantomKind kind, int size) {
        return generate(kind, size, new Random());
    }

    public static GrayImage generate(PhantomKind kind, int size, Random random) {
        InvalidInputException.require(kind != null, "Phantom kind is null");
        InvalidInputException.require(size > 0, "Phantom size must be positive, got " + size);
        InvalidInputException.require((long) size * size <= Integer.MAX_VALUE,
                "Phantom size " + size + " is too large for a square image buffer");
        double[] pixels = new double[size * size];
        double c = size / 2.0;

        switch (kind) {
            case DISC:
                fillEllipse(pixels, size, c, c, size / 3.0, size / 3.0, 1.0);
                break;
            case SQUARE:
                fillRect(pixels, size, size / 4.0, size / 4.0, size / 2.0, size / 2.0, 1.0);
                break;
            case HEAD_PHANTOM:
                fillEllipse(pixels, size, c, c, 0.69 * 0.45 * size, 0.92 * 0.45 * size, SKULL);
                fillEllipse(pixels, size, c, c, 0.6 * 0.4 * size, 0.8 * 0.4 * size, BRAIN);
                for (double[] v : VENTRICLES) {
                    fillEllipse(pixels, size, c + v[0] * size, c + v[1] * size,
                            v[2] * 0.3 * size, v[3] * 0.3 * size, VENTRICLE);
                }
                break;
            case RANDOM_BLOBS:
                Random rnd = random != null ? random : new Random();
                for (int i = 0; i < BLOB_COUNT; i++) {
                    double x = rnd.nextDouble() * size;
                    double y = rnd.nextDouble() * size;
                    double r = rnd.nextDouble() * size / 6.0;
                    fillEllipse(pixels, size, x, y, r, r, 1.0);
                }
                break;
            default:
                throw new InvalidInputException("Unsupported phantom kind: " + kind);
        }
        return new GrayImage(size, size, pixels);
    }

    private static void fillEllipse(double[] pixels, int size, double cx, double cy, double rx, double ry,
                                    double value) {
        if (rx <= 0 || ry <= 0) return;
        int y0 = Math.max(0, (int) Math.floor(cy - ry));
        int y1 = Math.min(size - 1, (int) Math.ceil(cy + ry));
        int x0 = Math.max(0, (int) Math.floor(cx - rx));
        int x1 = Math.min(size - 1, (int) Math.ceil(cx + rx));
        for (int y = y0; y <= y1; y++) {
            double dy = (y + 0.5 - cy) / ry;
            for (int x = x0; x <= x1; x++) {
                double dx = (x + 0.5 - cx) / rx;
                if (dx * dx + dy * dy <= 1.0) {
                    pixels[y * size + x] = value;
                }
            }
        }
    }

    private static void fillRect(double[] pixels, int size, double left, double top, double w, double h,
                                 double value) {
        for (int y = 0; y < size; y++) {
            double py = y + 0.5;
            if (py < top || py >= top + h) continue;
            for (int x = 0; x < size; x++) {
                double px = x + 0.5;
                if (px >= left && px < left + w) {
                    pixels[y * size + x] = value;
                }
            }
        }
    }
}
