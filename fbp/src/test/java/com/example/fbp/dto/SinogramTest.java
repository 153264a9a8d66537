package com.example.fbp.dto;

import com.example.fbp.exception.InvalidInputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SinogramTest {

    @Test
    void testEvenAngles() {
        assertArrayEquals(new double[]{0.0, 45.0, 90.0, 135.0}, Sinogram.evenAngles(4), 1e-12);
        assertEquals(1, Sinogram.evenAngles(1).length);
        assertThrows(InvalidInputException.class, () -> Sinogram.evenAngles(0));
    }

    @Test
    void testRowAccess() {
        Sinogram sinogram = new Sinogram(3, 2, new double[]{1, 2, 3, 4, 5, 6}, new double[]{0, 90});
        assertEquals(6.0, sinogram.get(1, 2), 0.0);
        assertArrayEquals(new double[]{4, 5, 6}, sinogram.row(1), 0.0);
    }

    @Test
    void testValidation() {
        assertThrows(InvalidInputException.class,
                () -> new Sinogram(3, 2, new double[5], new double[]{0, 90}));
        assertThrows(InvalidInputException.class,
                () -> new Sinogram(3, 2, new double[6], new double[]{0, 45, 90}));
        assertThrows(InvalidInputException.class,
                () -> new Sinogram(3, 2, new double[6], new double[]{90, 0}));
        assertThrows(InvalidInputException.class,
                () -> new Sinogram(3, 2, new double[6], new double[]{0, Double.NaN}));
        assertThrows(InvalidInputException.class,
                () -> new Sinogram(2, 1, new double[]{1, Double.POSITIVE_INFINITY}, new double[]{0}));
        assertThrows(InvalidInputException.class,
                () -> new Sinogram(0, 1, new double[0], new double[]{0}));
    }

    @Test
    void testBuffersAreCopied() {
        double[] samples = {1, 2};
        Sinogram sinogram = new Sinogram(2, 1, samples, new double[]{0});
        samples[0] = 99;
        sinogram.samples()[1] = 99;
        assertArrayEquals(new double[]{1, 2}, sinogram.samples(), 0.0);
    }
}
