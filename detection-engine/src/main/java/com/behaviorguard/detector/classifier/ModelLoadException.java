package com.behaviorguard.detector.classifier;

/**
 * The model artifact could not be loaded. Fatal at startup.
 */
public class ModelLoadException extends RuntimeException {

    public ModelLoadException(String message) {
        super(message);
    }

    public ModelLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
