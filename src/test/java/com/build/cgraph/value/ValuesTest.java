package com.build.cgraph.value;

import com.build.cgraph.api.ConfigGraphException;
import com.build.cgraph.api.Stage;
import com.build.cgraph.api.UnresolvedKeyException;
import com.build.cgraph.key.Descriptors;
import com.build.cgraph.key.Key;
import com.build.cgraph.key.KeyRegistry;
import com.build.cgraph.key.KeySet;
import org.junit.Before;
import org.junit.Test;

import java.util.Optional;
import java.util.function.Function;

import static org.junit.Assert.*;

public class ValuesTest {
    private Key<String> host;
    private Key<Integer> port;
    private Key<Boolean> tls;

    @Before
    public void setUp() {
        KeyRegistry registry = new KeyRegistry();
        host = registry.create("host", "", Stage.BOTH, "localhost", Descriptors.string());
        port = registry.create("port", "", Stage.CONFIGURE, 8080, Descriptors.integer());
        tls = registry.create("tls", "", Stage.RUN, false, Descriptors.bool());
    }

    private Value<String> url() {
        return Values.map3((t, h, p) -> (t ? "https" : "http") + "://" + h + ":" + p,
                Values.value(tls), Values.value(host), Values.value(port));
    }

    @Test
    public void testDepsOfConstIsEmpty() {
        assertTrue(Values.deps(Values.pure(42)).isEmpty());
    }

    @Test
    public void testDepsOfKeyIsSingleton() {
        assertEquals(KeySet.of(port), Values.deps(Values.value(port)));
    }

    @Test
    public void testDepsOfApplicationIsUnion() {
        Value<String> hostPort = Values.map2((h, p) -> h + ":" + p, Values.value(host), Values.value(port));
        assertEquals(KeySet.of(host, port), Values.deps(hostPort));
    }

    @Test
    public void testDepsRegardlessOfNesting() {
        Value<Function<String, String>> upper = Values.pure(String::toUpperCase);
        Value<String> nested = Values.map(s -> s + "!", Values.ap(upper, url()));
        assertEquals(KeySet.of(host, port, tls), Values.deps(nested));
    }

    @Test
    public void testDependenciesAreMemoized() {
        Value<String> v = url();
        Dependencies deps = new Dependencies();
        assertSame(deps.deps(v), deps.deps(v));
    }

    @Test
    public void testEval() {
        EvalContext ctx = EvalContext.empty().set(host, "example.org").set(port, 443).set(tls, true);
        assertEquals("https://example.org:443", Evaluator.eval(url(), ctx));
        assertEquals(Integer.valueOf(7), Evaluator.eval(Values.pure(7), ctx));
    }

    @Test
    public void testEvalUnresolvedKeyNamesIt() {
        EvalContext ctx = EvalContext.empty().set(host, "example.org").set(tls, false);
        try {
            Evaluator.eval(url(), ctx);
            fail("Expected UnresolvedKeyException");
        } catch (UnresolvedKeyException e) {
            assertEquals("port", e.keyName());
            assertNull(e.nodeName());
        }
    }

    @Test
    public void testPeekEmptyWhenAnyKeyUnset() {
        EvalContext ctx = EvalContext.empty().set(host, "example.org");
        assertEquals(Optional.empty(), Evaluator.peek(url(), ctx));
        assertEquals(Optional.of("example.org"), Evaluator.peek(Values.value(host), ctx));
        assertEquals(Optional.of(1), Evaluator.peek(Values.pure(1), ctx));
    }

    @Test
    public void testPeekDoesNotFillDefaults() {
        EvalContext ctx = EvalContext.empty();
        Evaluator.peek(url(), ctx);
        assertEquals(0, ctx.size());
    }

    @Test
    public void testPeekMatchesEvalForExplicitKeys() {
        EvalContext ctx = EvalContext.empty().set(host, "a").set(port, 1).set(tls, false);
        assertEquals(Optional.of(Evaluator.eval(url(), ctx)), Evaluator.peek(url(), ctx));
    }

    @Test
    public void testNullResultIsRejected() {
        Value<String> missing = Values.map(h -> h.equals("none") ? null : h, Values.value(host));
        EvalContext ctx = EvalContext.empty().set(host, "none");
        try {
            Evaluator.peek(missing, ctx);
            fail("Expected ConfigGraphException");
        } catch (ConfigGraphException e) {
            assertTrue(e.getMessage().contains("returned null"));
        }
        try {
            Evaluator.eval(missing, ctx);
            fail("Expected ConfigGraphException");
        } catch (ConfigGraphException e) {
            assertTrue(e.getMessage().contains("returned null"));
        }
    }
}
