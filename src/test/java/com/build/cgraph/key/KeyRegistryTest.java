package com.build.cgraph.key;

import com.build.cgraph.api.DuplicateKeyNameException;
import com.build.cgraph.api.OptionNameClashException;
import com.build.cgraph.api.Stage;
import com.build.cgraph.value.EvalContext;
import org.junit.Before;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class KeyRegistryTest {
    private KeyRegistry registry;

    @Before
    public void setUp() {
        registry = new KeyRegistry();
    }

    @Test
    public void testCreate() {
        Key<Integer> port = registry.create("port", "HTTP port.", Stage.CONFIGURE, 8080, Descriptors.integer());

        assertEquals("port", port.name());
        assertEquals(Stage.CONFIGURE, port.stage());
        assertEquals(Integer.valueOf(8080), port.defaultValue());
        assertEquals("HTTP port.", port.doc().doc());
        assertEquals(List.of("port"), port.doc().names());
        assertEquals(Doc.DEFAULT_SECTION, port.doc().docs());
        assertTrue(registry.contains("port"));
        assertSame(port, registry.get("port").orElseThrow());
        assertEquals(1, registry.size());
    }

    @Test
    public void testDuplicateNameFails() {
        registry.create("log_level", "", Stage.BOTH, "info", Descriptors.string());
        try {
            registry.create("log_level", "other", Stage.RUN, 3, Descriptors.integer());
            fail("Expected DuplicateKeyNameException");
        } catch (DuplicateKeyNameException e) {
            assertEquals("log_level", e.keyName());
        }
        assertEquals(1, registry.size());
    }

    @Test
    public void testDuplicateNameFailsForRawDoc() {
        registry.create("port", "", Stage.CONFIGURE, 8080, Descriptors.integer());
        Doc doc = Doc.create("NETWORK", "PORT", "Port.", "port", "p");
        assertThrows(DuplicateKeyNameException.class,
                () -> registry.createRaw(doc, Stage.CONFIGURE, 80, "port", Descriptors.integer()));
    }

    @Test
    public void testAliasClashingWithOtherKeyFails() {
        registry.createRaw(Doc.create("LOGGING", "LEVEL", "Log level.", "log_level", "l"),
                Stage.BOTH, "info", "log_level", Descriptors.string());
        try {
            registry.createRaw(Doc.create("LOGGING", "FILE", "Log file.", "log_file", "log_level"),
                    Stage.RUN, "out.log", "log_file", Descriptors.string());
            fail("Expected OptionNameClashException");
        } catch (OptionNameClashException e) {
            assertEquals("--log_level", e.option());
            assertEquals("log_level", e.firstKey());
            assertEquals("log_file", e.secondKey());
        }
        assertFalse(registry.contains("log_file"));
        // The rejected key's own name stays free.
        registry.create("log_file", "", Stage.RUN, "out.log", Descriptors.string());
    }

    @Test
    public void testShortAliasClashFails() {
        registry.createRaw(Doc.create(null, null, "Log level.", "log_level", "l"),
                Stage.BOTH, "info", "log_level", Descriptors.string());
        assertThrows(OptionNameClashException.class, () -> registry.createRaw(
                Doc.create(null, null, "Listen address.", "listen", "l"), Stage.RUN, "", "listen",
                Descriptors.string()));
    }

    @Test(expected = OptionNameClashException.class)
    public void testRepeatedOwnAliasFails() {
        registry.createRaw(Doc.create(null, null, "Port.", "port", "port"),
                Stage.CONFIGURE, 80, "port", Descriptors.integer());
    }

    @Test
    public void testRegistriesAreIndependent() {
        registry.create("port", "", Stage.CONFIGURE, 8080, Descriptors.integer());
        Key<Integer> other = new KeyRegistry().create("port", "", Stage.CONFIGURE, 9090, Descriptors.integer());
        assertEquals(Integer.valueOf(9090), other.defaultValue());
    }

    @Test
    public void testEqualityByName() {
        Key<Integer> a = registry.create("port", "", Stage.CONFIGURE, 8080, Descriptors.integer());
        Key<String> b = new KeyRegistry().create("port", "", Stage.RUN, "x", Descriptors.string());
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(0, a.compareTo(b));
    }

    @Test
    public void testStages() {
        Key<String> both = registry.create("a", "", Stage.BOTH, "", Descriptors.string());
        Key<String> run = registry.create("b", "", Stage.RUN, "", Descriptors.string());
        Key<String> configure = registry.create("c", "", Stage.CONFIGURE, "", Descriptors.string());

        assertTrue(both.isRuntime());
        assertTrue(both.isConfigure());
        assertTrue(run.isRuntime());
        assertFalse(run.isConfigure());
        assertFalse(configure.isRuntime());
        assertTrue(configure.isConfigure());
    }

    @Test
    public void testIdentifier() {
        assertEquals("log_level", registry.create("log-level", "", Stage.BOTH, "", Descriptors.string()).identifier());
        assertEquals("class_", registry.create("class", "", Stage.BOTH, "", Descriptors.string()).identifier());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNameWithoutIdentifierFails() {
        registry.create("9lives", "", Stage.BOTH, "", Descriptors.string());
    }

    @Test
    public void testSerializeUsesResolvedValue() {
        Key<Integer> port = registry.create("port", "", Stage.CONFIGURE, 8080, Descriptors.integer());
        EvalContext ctx = EvalContext.empty().set(port, 9090);
        assertEquals("9090", port.serialize(ctx));
    }

    @Test(expected = com.build.cgraph.api.UnresolvedKeyException.class)
    public void testSerializeUnresolvedFails() {
        Key<Integer> port = registry.create("port", "", Stage.CONFIGURE, 8080, Descriptors.integer());
        port.serialize(EvalContext.empty());
    }

    @Test
    public void testKeySetIsOrderedByName() {
        Key<String> z = registry.create("zeta", "", Stage.BOTH, "", Descriptors.string());
        Key<String> a = registry.create("alpha", "", Stage.RUN, "", Descriptors.string());
        KeySet set = KeySet.of(z, a);
        assertEquals(List.of("alpha", "zeta"), set.names());
        assertEquals(List.of("alpha"), set.filter(Stage.RUN).names());
        assertEquals(set, KeySet.of(a).union(KeySet.of(z)));
        assertEquals(set, registry.keys());
    }
}
