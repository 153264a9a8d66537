package com.example.fbp.engine;

/**
 * How a forward-projected ray turns its in-bounds samples into one sinogram value.
 */
public enum RayNormalization {

    /** Plain sum of the sampled pixels: a discrete line integral. */
    SUM,

    /** Mean over the in-bounds samples, rescaled by the number of samples along a full ray. */
    MEAN_RESCALED
}
