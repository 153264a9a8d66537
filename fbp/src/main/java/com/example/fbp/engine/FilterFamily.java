package com.example.fbp.engine;

import com.example.fbp.exception.InvalidInputException;

import java.util.Locale;

/**
 * Window applied on top of the Ram-Lak base kernel. Each constant supplies the weight of kernel
 * index {@code i}, where {@code n = i - floor(size/2)} is the signed offset from the center.
 */
public enum FilterFamily {

    RAM_LAK("ram-lak") {
        @Override
        public double window(int i, int n, int size) {
            return 1.0;
        }
    },
    SHEPP_LOGAN("shepp-logan") {
        @Override
        public double window(int i, int n, int size) {
            return sinc(Math.PI * n / size);
        }
    },
    // same sinc taper as Shepp-Logan
    COSINE("cosine") {
        @Override
        public double window(int i, int n, int size) {
            return sinc(Math.PI * n / size);
        }
    },
    HAMMING("hamming") {
        @Override
        public double window(int i, int n, int size) {
            if (size < 2) return 1.0;
            return 0.54 - 0.46 * Math.cos(2 * Math.PI * i / (size - 1));
        }
    },
    HANN("hann") {
        @Override
        public double window(int i, int n, int size) {
            // a two-tap Hann window is zero at the center tap
            if (size < 3) return 1.0;
            return 0.5 * (1 - Math.cos(2 * Math.PI * i / (size - 1)));
        }
    };

    private final String id;

    FilterFamily(String id) {
        this.id = id;
    }

    public abstract double window(int i, int n, int size);

    public String id() {
        return id;
    }

    public static FilterFamily fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Filter family name is empty");
        }
        String key = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if ("ramp".equals(key)) {
            return RAM_LAK;
        }
        for (FilterFamily family : values()) {
            if (family.id.equals(key)) {
                return family;
            }
        }
        throw new InvalidInputException("Unknown filter family: " + name);
    }

    static double sinc(double x) {
        return x == 0.0 ? 1.0 : Math.sin(x) / x;
    }
}
