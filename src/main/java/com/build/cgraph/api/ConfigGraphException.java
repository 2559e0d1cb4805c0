package com.build.cgraph.api;

/**
 * Base class of the failures raised while building or evaluating a
 * configuration graph.
 */
public class ConfigGraphException extends RuntimeException {

    public ConfigGraphException(String message) {
        super(message);
    }

    public ConfigGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
