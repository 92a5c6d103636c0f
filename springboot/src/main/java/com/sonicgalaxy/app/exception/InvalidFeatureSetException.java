package com.sonicgalaxy.app.exception;

/**
 * Raised when a rebuild is handed a structurally unusable track set: nothing to embed,
 * vectors of different widths, missing or repeated track ids.
 */
public class InvalidFeatureSetException extends RuntimeException {

    public InvalidFeatureSetException(String message) {
        super(message);
    }
}
