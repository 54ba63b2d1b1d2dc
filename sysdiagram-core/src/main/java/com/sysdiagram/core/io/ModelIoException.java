package com.sysdiagram.core.io;

/**
 * Raised when a model source or serialized model cannot be read or written.
 */
public class ModelIoException extends RuntimeException {

    public ModelIoException(String message, Throwable cause) {
        super(message, cause);
    }

    public ModelIoException(String message) {
        super(message);
    }
}
