package com.example.fbp.exception;

/**
 * Raised when a buffer, angle vector or configuration value cannot be processed:
 * zero-size dimensions, length mismatches, non-finite samples, unknown filter names.
 */
public class InvalidInputException extends FbpException {

    public InvalidInputException(String message) {
        super(message);
    }

    public static void require(boolean condition, String message) {
        if (!condition) {
            throw new InvalidInputException(message);
        }
    }
}
