package com.example.fbp.exception;

/**
 * Base type for every failure raised by the reconstruction engine.
 */
public class FbpException extends RuntimeException {

    public FbpException(String message) {
        super(message);
    }
}
