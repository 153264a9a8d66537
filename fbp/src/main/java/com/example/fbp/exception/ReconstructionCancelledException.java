package com.example.fbp.exception;

public class ReconstructionCancelledException extends FbpException {

    private final int percentReached;

    public ReconstructionCancelledException(int percentReached, String stageMessage) {
        super("Reconstruction cancelled at " + percentReached + "% (" + stageMessage + ")");
        this.percentReached = percentReached;
    }

    public int getPercentReached() {
        return percentReached;
    }
}
