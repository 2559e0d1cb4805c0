package com.build.cgraph.key;

import com.build.cgraph.api.Descriptor;
import com.build.cgraph.api.DuplicateKeyNameException;
import com.build.cgraph.api.OptionNameClashException;
import com.build.cgraph.api.Stage;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.extern.log4j.Log4j2;

/**
 * Owner of the key names of one configuration session.
 *
 * Every key is created here, and a name can be used only once per registry.
 * A registry is created when a configuration is loaded and discarded with it,
 * so independent sessions (and tests) never see each other's keys.
 *
 * Usage Pattern:
 * 1. Create a registry: KeyRegistry keys = new KeyRegistry();
 * 2. Define keys: var port = keys.create("port", "HTTP port.", Stage.CONFIGURE, 8080, Descriptors.integer());
 * 3. Reference them from value expressions and configurable nodes.
 */
@Log4j2
public final class KeyRegistry {
    private final Map<String, Key<?>> keys = new LinkedHashMap<>();
    // option name with dashes -> owning key name
    private final Map<String, String> options = new HashMap<>();

    /**
     * Creates a key with a minimal doc: the default help section and value
     * placeholder, and the key name as its only option name.
     *
     * @throws DuplicateKeyNameException if the name is already registered.
     * @throws IllegalArgumentException  if the name yields no Java identifier.
     */
    public <T> Key<T> create(String name, String doc, Stage stage, T defaultValue, Descriptor<T> descriptor) {
        return createRaw(Doc.of(name, doc), stage, defaultValue, name, descriptor);
    }

    /**
     * Creates a key with a fully built doc.
     *
     * @throws DuplicateKeyNameException  if the name is already registered.
     * @throws OptionNameClashException   if one of the doc's option names
     *                                    belongs to another key, or is listed
     *                                    twice.
     */
    public <T> Key<T> createRaw(Doc doc, Stage stage, T defaultValue, String name, Descriptor<T> descriptor) {
        if (keys.containsKey(name)) {
            log.error("Key '{}' is defined twice", name);
            throw new DuplicateKeyNameException(name);
        }
        Map<String, String> claimed = new HashMap<>();
        for (String option : doc.optionNames()) {
            String owner = options.containsKey(option) ? options.get(option) : claimed.get(option);
            if (owner != null) {
                log.error("Option {} of key '{}' is already used by key '{}'", option, name, owner);
                throw new OptionNameClashException(option, owner, name);
            }
            claimed.put(option, name);
        }
        var key = new Key<>(name, stage, defaultValue, doc, descriptor);
        keys.put(name, key);
        options.putAll(claimed);
        log.debug("Registered key {} ({}, {})", name, descriptor.description(), stage);
        return key;
    }

    public Optional<Key<?>> get(String name) {
        return Optional.ofNullable(keys.get(name));
    }

    public boolean contains(String name) {
        return keys.containsKey(name);
    }

    /** Every registered key. */
    public KeySet keys() {
        return KeySet.of(keys.values());
    }

    public int size() {
        return keys.size();
    }
}
