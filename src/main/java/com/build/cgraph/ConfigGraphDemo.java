package com.build.cgraph;

import com.build.cgraph.io.GraphDefinition;
import com.build.cgraph.io.GraphDefinitionParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import picocli.CommandLine;

/**
 * Loads a graph definition and prints what the phases produce for the given
 * key options. Options not recognised by the demo itself are key options,
 * e.g. {@code --dot --port=9090}.
 */
@CommandLine.Command(
        name = "cgraph-demo",
        description = "Describe, document or generate a configuration graph.",
        mixinStandardHelpOptions = true)
public class ConfigGraphDemo implements Callable<Integer> {
    private static final Logger log = LogManager.getLogger(ConfigGraphDemo.class);
    private static final String DEFAULT_GRAPH = "/graphs/web.json";

    @CommandLine.Option(names = { "-f", "--file" }, description = "Graph definition (JSON). Defaults to the bundled web graph.")
    private Path file;

    @CommandLine.Option(names = "--dot", description = "Print the graph in dot syntax.")
    private boolean dot;

    @CommandLine.Option(names = "--eval", description = "Fully evaluate the graph before printing it in dot syntax.")
    private boolean fullEval;

    @CommandLine.Option(names = "--source", description = "Print the generated source.")
    private boolean source;

    @CommandLine.Option(names = "--keys", description = "Print the generated keys class.")
    private boolean keys;

    @CommandLine.Option(names = "--man", description = "Print the key manual.")
    private boolean manual;

    @CommandLine.Option(names = "--explain", description = "Print the topology and node states.")
    private boolean explain;

    @CommandLine.Option(names = "--package", defaultValue = "", description = "Package of generated classes.")
    private String packageName;

    @CommandLine.Unmatched
    private List<String> keyArgs = new ArrayList<>();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConfigGraphDemo()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws IOException {
        ConfigSession session = new ConfigSession(loadDefinition());
        String[] args = keyArgs.toArray(new String[0]);
        PrintWriter out = spec.commandLine().getOut();

        boolean any = dot || source || keys || manual || explain;
        if (dot || !any)
            out.print(session.describe(fullEval, args));
        if (source)
            out.print(session.generate(packageName, "Main", args));
        if (keys)
            out.print(session.generateKeys(packageName, "Keys", args));
        if (manual)
            out.print(session.manual());
        if (explain)
            out.print(session.explain(args));
        out.flush();
        return 0;
    }

    private GraphDefinition loadDefinition() throws IOException {
        if (file != null) {
            log.info("Loading graph definition from {}", file);
            return GraphDefinitionParser.read(file);
        }
        try (InputStream in = ConfigGraphDemo.class.getResourceAsStream(DEFAULT_GRAPH)) {
            if (in == null)
                throw new IOException("Missing bundled graph " + DEFAULT_GRAPH);
            return GraphDefinitionParser.read(in);
        }
    }
}
