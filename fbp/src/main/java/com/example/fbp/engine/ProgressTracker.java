package com.example.fbp.engine;

import com.example.fbp.exception.ReconstructionCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checkpoint gate of one run: clamps and orders the reported percentages, forwards them to the
 * caller's listener and aborts the run when the cancellation token has been set.
 */
public class ProgressTracker {

    private static final Logger logger = LoggerFactory.getLogger(ProgressTracker.class);

    private final ProgressListener listener;
    private final CancellationToken token;
    private int lastPercent = 0;

    public ProgressTracker(ProgressListener listener, CancellationToken token) {
        this.listener = listener != null ? listener : ProgressListener.NONE;
        this.token = token != null ? token : CancellationToken.create();
    }

    public static ProgressTracker silent() {
        return new ProgressTracker(ProgressListener.NONE, CancellationToken.create());
    }

    /**
     * Reports {@code percent} and then polls the cancellation token.
     *
     * @throws ReconstructionCancelledException if cancellation was requested
     */
    public void checkpoint(int percent, String message) {
        if (token.isCancelled()) {
            logger.info("Cancellation observed at {}% ({})", lastPercent, message);
            throw new ReconstructionCancelledException(lastPercent, message);
        }
        int clamped = Math.max(0, Math.min(100, percent));
        lastPercent = Math.max(lastPercent, clamped);
        logger.debug("[PROGRESS] {}% {}", lastPercent, message);
        listener.onProgress(lastPercent, message);
    }

    /** Maps {@code fraction} of a stage onto the percentage span {@code [from, to]}. */
    public void checkpoint(int from, int to, double fraction, String message) {
        double f = Math.max(0.0, Math.min(1.0, fraction));
        checkpoint((int) Math.round(from + (to - from) * f), message);
    }

    public int lastPercent() {
        return lastPercent;
    }
}
