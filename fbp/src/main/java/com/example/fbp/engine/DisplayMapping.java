package com.example.fbp.engine;

/**
 * Mapping of a reconstruction's floating-point values onto 8-bit gray levels.
 */
public enum DisplayMapping {

    /** Min-max stretch of the full value range. */
    LINEAR,

    /** Clip to the 0.5th/99.5th percentiles, stretch, then apply gamma 0.7 to lift mid-tones. */
    PERCENTILE_GAMMA
}
