package com.build.cgraph;

import com.build.cgraph.api.EvaluationListener;
import com.build.cgraph.api.KeyParseException;
import com.build.cgraph.api.Stage;
import com.build.cgraph.codegen.SourceGenerator;
import com.build.cgraph.engine.ConfigGraph;
import com.build.cgraph.engine.EvalMode;
import com.build.cgraph.engine.GraphEvaluation;
import com.build.cgraph.engine.GraphEvaluator;
import com.build.cgraph.io.GraphDefinition;
import com.build.cgraph.io.GraphDefinitionParser;
import com.build.cgraph.io.JsonGraphCompiler;
import com.build.cgraph.key.KeyDocs;
import com.build.cgraph.key.KeyRegistry;
import com.build.cgraph.key.KeyTerms;
import com.build.cgraph.util.CompositeEvaluationListener;
import com.build.cgraph.util.DotRenderer;
import com.build.cgraph.util.GraphExplain;
import com.build.cgraph.util.ResolutionTrackingListener;
import com.build.cgraph.value.EvalContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * A high-level wrapper that loads a JSON graph definition and runs the usual
 * phases against command-line arguments.
 * <p>
 * This class handles:
 * <ul>
 * <li>Parsing and compiling the definition with its own {@link KeyRegistry}</li>
 * <li>Parsing key options for a build phase into a fresh {@link EvalContext}</li>
 * <li>Partial evaluation for descriptions, full evaluation for source
 * generation</li>
 * </ul>
 * Every call that takes arguments starts from a new context, so one session
 * can serve several phases.
 */
public class ConfigSession {
    private static final Logger log = LogManager.getLogger(ConfigSession.class);

    private final KeyRegistry registry = new KeyRegistry();
    private final ConfigGraph graph;
    private final GraphEvaluator evaluator = new GraphEvaluator();
    private final CompositeEvaluationListener compositeListener = new CompositeEvaluationListener();

    /**
     * Creates a new session from a JSON file path.
     *
     * @param jsonPath Path to the JSON graph definition.
     */
    public ConfigSession(Path jsonPath) {
        this(load(jsonPath));
    }

    public ConfigSession(GraphDefinition definition) {
        this.graph = new JsonGraphCompiler().compile(definition, registry);
        this.evaluator.setListener(compositeListener);
        log.info("Session ready for graph {} ({} keys)", graph.name(), registry.size());
    }

    private static GraphDefinition load(Path jsonPath) {
        try {
            return GraphDefinitionParser.read(jsonPath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load graph definition from " + jsonPath, e);
        }
    }

    public ConfigGraph graph() {
        return graph;
    }

    public KeyRegistry registry() {
        return registry;
    }

    /**
     * Registers a listener to monitor evaluation passes. Adds to the existing
     * listeners rather than replacing them.
     */
    public void addListener(EvaluationListener listener) {
        compositeListener.add(listener);
    }

    public ResolutionTrackingListener enableResolutionTracking() {
        var tracking = new ResolutionTrackingListener();
        compositeListener.add(tracking);
        return tracking;
    }

    /**
     * Parses the options of the keys a phase needs into a new context.
     *
     * @param stage Phase filter; null or {@link Stage#BOTH} keeps every key.
     * @throws KeyParseException listing every option that failed to parse.
     */
    public EvalContext context(Stage stage, String... args) {
        var parsed = KeyTerms.term(stage, graph.keys()).parse(args).orThrow();
        return EvalContext.empty().bind(parsed);
    }

    public GraphEvaluation evaluate(EvalMode mode, String... args) {
        return evaluator.evaluate(graph, context(Stage.BOTH, args), mode);
    }

    /** Dot text of the graph, with the values already known from the arguments. */
    public String describe(String... args) {
        return describe(false, args);
    }

    /**
     * Dot text of the graph.
     *
     * @param fullEval Fill defaults before rendering, so every key has a value
     *                 and every choice shows its selected branch.
     */
    public String describe(boolean fullEval, String... args) {
        return DotRenderer.render(graph, evaluate(fullEval ? EvalMode.FULL : EvalMode.PARTIAL, args));
    }

    /** Source instantiating the graph; keys not given in the arguments get their defaults. */
    public String generate(String packageName, String className, String... args) {
        return new SourceGenerator(packageName, className).generate(evaluate(EvalMode.FULL, args));
    }

    /** Source of the class holding every resolved key value. */
    public String generateKeys(String packageName, String className, String... args) {
        GraphEvaluation evaluation = evaluate(EvalMode.FULL, args);
        return new SourceGenerator(packageName, className).generateKeys(graph.keys(), evaluation.context());
    }

    public String manual() {
        return KeyDocs.manual(registry.keys());
    }

    /** Topology dump followed by the state of every node after a partial pass. */
    public String explain(String... args) {
        var explain = new GraphExplain(graph, evaluate(EvalMode.PARTIAL, args));
        StringBuilder sb = new StringBuilder(explain.dumpTopology());
        for (var node : graph.toposort())
            sb.append(explain.explainNode(node.name()));
        return sb.toString();
    }
}
