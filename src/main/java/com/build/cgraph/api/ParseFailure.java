package com.build.cgraph.api;

/**
 * A raw command-line value that did not parse with its key's descriptor.
 *
 * @param keyName The key being parsed.
 * @param raw     The raw text supplied by the user.
 * @param message The descriptor's error message.
 */
public record ParseFailure(String keyName, String raw, String message) {

    @Override
    public String toString() {
        return "--" + keyName + "=" + raw + ": " + message;
    }
}
