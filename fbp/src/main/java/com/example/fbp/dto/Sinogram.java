package com.example.fbp.dto;

import com.example.fbp.exception.InvalidInputException;

/**
 * Projection data: one row per angle, one column per detector bin. {@code angles} holds the
 * projection angle of each row in degrees.
 */
public record Sinogram(int detectorCount, int angleCount, double[] samples, double[] angles) {

    public Sinogram {
        InvalidInputException.require(detectorCount > 0 && angleCount > 0,
                "Sinogram dimensions must be positive, got " + detectorCount + "x" + angleCount);
        InvalidInputException.require(samples != null, "Sinogram sample buffer is null");
        InvalidInputException.require(angles != null, "Angle vector is null");
        InvalidInputException.require(samples.length == (long) detectorCount * angleCount,
                "Sinogram buffer holds " + samples.length + " samples, expected "
                        + detectorCount + "x" + angleCount);
        InvalidInputException.require(angles.length == angleCount,
                "Angle vector has " + angles.length + " entries but the sinogram has " + angleCount + " rows");
        validateAngles(angles);
        for (double v : samples) {
            InvalidInputException.require(Double.isFinite(v), "Sinogram contains a non-finite sample");
        }
        samples = samples.clone();
        angles = angles.clone();
    }

    /** Angles {@code 180 * i / count} for {@code i} in {@code [0, count)}. */
    public static double[] evenAngles(int count) {
        InvalidInputException.require(count > 0, "Angle count must be positive, got " + count);
        double[] theta = new double[count];
        for (int i = 0; i < count; i++) {
            theta[i] = (180.0 * i) / count;
        }
        return theta;
    }

    public static void validateAngles(double[] angles) {
        InvalidInputException.require(angles != null && angles.length > 0, "Angle vector is empty");
        for (int i = 0; i < angles.length; i++) {
            InvalidInputException.require(Double.isFinite(angles[i]), "Angle " + i + " is not finite");
            if (i > 0 && angles[i] < angles[i - 1]) {
                throw new InvalidInputException("Angles must be non-decreasing: angle " + i + " ("
                        + angles[i] + ") < angle " + (i - 1) + " (" + angles[i - 1] + ")");
            }
        }
    }

    @Override
    public double[] samples() {
        return samples.clone();
    }

    @Override
    public double[] angles() {
        return angles.clone();
    }

    public double get(int angleIndex, int detector) {
        return samples[angleIndex * detectorCount + detector];
    }

    public double[] row(int angleIndex) {
        double[] row = new double[detectorCount];
        System.arraycopy(samples, angleIndex * detectorCount, row, 0, detectorCount);
        return row;
    }

    @Override
    public String toString() {
        return "Sinogram[" + detectorCount + " detectors x " + angleCount + " angles]";
    }
}
