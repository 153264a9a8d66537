package com.example.fbp.engine;

/**
 * Receives progress checkpoints of a pipeline run. Percentages are in [0,100] and never decrease
 * within one run.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = (percent, message) -> { };

    void onProgress(int percent, String message);
}
