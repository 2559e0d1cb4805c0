package com.build.cgraph.value;

import com.build.cgraph.api.Stage;
import com.build.cgraph.key.Descriptors;
import com.build.cgraph.key.Key;
import com.build.cgraph.key.KeyRegistry;
import com.build.cgraph.key.KeySet;
import com.build.cgraph.key.KeyTerms;
import org.junit.Before;
import org.junit.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.Assert.*;

public class EvalContextTest {
    private Key<String> logLevel;
    private Key<Integer> port;

    @Before
    public void setUp() {
        KeyRegistry registry = new KeyRegistry();
        logLevel = registry.create("log_level", "", Stage.BOTH, "info", Descriptors.string());
        port = registry.create("port", "", Stage.CONFIGURE, 8080, Descriptors.integer());
    }

    @Test
    public void testSetIsExplicit() {
        EvalContext ctx = EvalContext.empty().set(port, 9090);
        assertEquals(Optional.of(9090), ctx.get(port));
        assertTrue(ctx.isSet(port));
        assertTrue(ctx.isExplicit(port));
        assertFalse(ctx.isSet(logLevel));
    }

    @Test
    public void testFillDefaults() {
        EvalContext ctx = EvalContext.empty().set(port, 9090);
        assertEquals(1, ctx.fillDefaults(KeySet.of(logLevel, port)));
        assertEquals(Optional.of("info"), ctx.get(logLevel));
        assertEquals(Optional.of(9090), ctx.get(port));
        assertFalse(ctx.isExplicit(logLevel));
        assertFalse(ctx.fillDefault(logLevel));
    }

    @Test(expected = IllegalStateException.class)
    public void testSecondWriteFails() {
        EvalContext.empty().set(port, 1).set(port, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullValueFails() {
        EvalContext.empty().set(port, null);
    }

    @Test
    public void testBindParsedArguments() {
        var parsed = KeyTerms.term(KeySet.of(logLevel, port)).parse("--log_level=debug", "--port=oops");
        EvalContext ctx = EvalContext.empty().bind(parsed);

        assertEquals(Optional.of("debug"), ctx.get(logLevel));
        assertTrue(ctx.isExplicit(logLevel));
        // Failed values are not bound
        assertFalse(ctx.isSet(port));
        assertEquals(Map.of("log_level", "debug"), ctx.snapshot());
    }
}
