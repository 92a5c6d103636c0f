package com.sonicgalaxy.app.exception;

public class DnaProfileLoadException extends RuntimeException {

    public DnaProfileLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
