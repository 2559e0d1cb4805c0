package com.build.cgraph.api;

/** Raised when a second key is created with a name already in use. */
public final class DuplicateKeyNameException extends ConfigGraphException {
    private final String keyName;

    public DuplicateKeyNameException(String keyName) {
        super("Duplicate key name: " + keyName);
        this.keyName = keyName;
    }

    public String keyName() {
        return keyName;
    }
}
