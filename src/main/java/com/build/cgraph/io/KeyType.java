package com.build.cgraph.io;

import com.build.cgraph.api.Descriptor;
import com.build.cgraph.key.Descriptors;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Value types a key may have in a graph definition.
 */
public enum KeyType {
    STRING(Descriptors.string(), ""),
    INT(Descriptors.integer(), "0"),
    BOOL(Descriptors.bool(), "false"),
    STRING_LIST(Descriptors.list(Descriptors.string()), ""),
    INT_LIST(Descriptors.list(Descriptors.integer()), "");

    private final Descriptor<?> descriptor;
    private final String emptyDefault;

    KeyType(Descriptor<?> descriptor, String emptyDefault) {
        this.descriptor = descriptor;
        this.emptyDefault = emptyDefault;
    }

    public Descriptor<?> getDescriptor() {
        return descriptor;
    }

    /**
     * Command-line text for a JSON default, to be read back by the descriptor:
     * arrays are printed as list options are, a missing default is the type's
     * empty value.
     */
    public String rawDefault(Object json) {
        if (json == null)
            return emptyDefault;
        if (json instanceof List<?> list)
            return Descriptors.printList(list.stream().map(String::valueOf).collect(Collectors.toList()));
        return json.toString();
    }

    public static KeyType fromString(String text) {
        if (text == null)
            return STRING;
        for (KeyType t : KeyType.values()) {
            if (t.name().equalsIgnoreCase(text.replace('-', '_'))) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown KeyType: " + text);
    }
}
