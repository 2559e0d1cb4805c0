package com.build.cgraph.io;

import com.build.cgraph.api.CyclicGraphException;
import com.build.cgraph.api.Descriptor;
import com.build.cgraph.api.Node;
import com.build.cgraph.api.ParseResult;
import com.build.cgraph.api.Stage;
import com.build.cgraph.dsl.GraphBuilder;
import com.build.cgraph.engine.ConfigGraph;
import com.build.cgraph.key.Doc;
import com.build.cgraph.key.Key;
import com.build.cgraph.key.KeyRegistry;
import com.build.cgraph.key.KeySet;
import com.build.cgraph.value.Value;
import com.build.cgraph.value.Values;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a JSON {@link GraphDefinition} into a {@link ConfigGraph}.
 *
 * <p>
 * Keys are registered first, in declaration order, in the given registry.
 * Nodes are then created once everything they take as argument exists, so
 * the JSON may list them in any order. Data dependencies are added last and
 * checked for cycles by the graph itself.
 */
@Log4j2
public final class JsonGraphCompiler {

    /**
     * Compiles the definition into a graph.
     *
     * @param def      The graph definition.
     * @param registry Registry receiving the keys of the definition.
     * @throws IllegalArgumentException                       if a node or key
     *                                                        is malformed or
     *                                                        references an
     *                                                        unknown name.
     * @throws com.build.cgraph.api.DuplicateKeyNameException if a key name is
     *                                                        already taken.
     * @throws CyclicGraphException                           if the nodes form
     *                                                        a cycle.
     */
    public ConfigGraph compile(GraphDefinition def, KeyRegistry registry) {
        GraphDefinition.GraphInfo graphInfo = def.getGraph();

        // 1. Keys
        for (GraphDefinition.KeyDef kd : orEmpty(graphInfo.getKeys()))
            registerKey(kd, registry);

        // 2. Check every reference before creating anything
        List<GraphDefinition.NodeDef> nodeDefs = orEmpty(graphInfo.getNodes());
        Map<String, GraphDefinition.NodeDef> defsByName = new LinkedHashMap<>();
        for (GraphDefinition.NodeDef nd : nodeDefs) {
            if (nd.getName() == null)
                throw new IllegalArgumentException("Node without name in graph " + graphInfo.getName());
            if (defsByName.put(nd.getName(), nd) != null)
                throw new IllegalArgumentException("Duplicate node name: " + nd.getName());
        }
        for (GraphDefinition.NodeDef nd : nodeDefs) {
            for (String ref : references(nd))
                requireDefined(defsByName, nd, ref);
            for (String dep : orEmpty(nd.getDependencies()))
                requireDefined(defsByName, nd, dep);
        }

        // 3. Instantiate nodes via iterative dependency resolution
        GraphBuilder g = GraphBuilder.create(graphInfo.getName());
        Map<String, Node> nodesByName = new HashMap<>(nodeDefs.size() * 2);
        Deque<GraphDefinition.NodeDef> pending = new ArrayDeque<>(nodeDefs);
        int prevPendingSize = -1;

        while (!pending.isEmpty()) {
            if (pending.size() == prevPendingSize) {
                List<String> cycle = findCycle(pending, nodesByName);
                log.error("Graph {}: argument cycle {}", graphInfo.getName(), cycle);
                throw new CyclicGraphException(cycle);
            }
            prevPendingSize = pending.size();

            Iterator<GraphDefinition.NodeDef> iter = pending.iterator();
            while (iter.hasNext()) {
                GraphDefinition.NodeDef nd = iter.next();

                // Skip if any argument hasn't been created yet
                if (!nodesByName.keySet().containsAll(references(nd)))
                    continue;

                nodesByName.put(nd.getName(), createNode(g, nd, nodesByName, registry));
                iter.remove();
            }
        }

        // 4. Data dependencies
        for (GraphDefinition.NodeDef nd : nodeDefs)
            for (String dep : orEmpty(nd.getDependencies()))
                g.dataDependency(nodesByName.get(nd.getName()), nodesByName.get(dep));

        ConfigGraph graph = g.build();
        log.info("Compiled graph {}: {} nodes, {} edges, {} keys", graph.name(), graph.nodeCount(),
                graph.edgeCount(), graph.keys().size());
        return graph;
    }

    private static Key<?> registerKey(GraphDefinition.KeyDef kd, KeyRegistry registry) {
        if (kd.getName() == null)
            throw new IllegalArgumentException("Key without name");
        KeyType type = KeyType.fromString(kd.getType());
        Stage stage = kd.getStage() == null ? Stage.BOTH : Stage.valueOf(kd.getStage().toUpperCase(Locale.ROOT));
        List<String> names = new ArrayList<>();
        names.add(kd.getName());
        names.addAll(orEmpty(kd.getAliases()));
        Doc doc = new Doc(kd.getSection(), kd.getDocv(), kd.getDoc(), names);
        return register(registry, doc, stage, kd.getName(), type.getDescriptor(), type.rawDefault(kd.getDefaultValue()));
    }

    private static <T> Key<T> register(KeyRegistry registry, Doc doc, Stage stage, String name,
            Descriptor<T> descriptor, String rawDefault) {
        ParseResult<T> parsed = descriptor.parse(rawDefault);
        if (!parsed.isOk())
            throw new IllegalArgumentException(
                    "Key " + name + ": invalid default '" + rawDefault + "': " + parsed.error());
        return registry.createRaw(doc, stage, parsed.value(), name, descriptor);
    }

    private static Node createNode(GraphBuilder g, GraphDefinition.NodeDef nd, Map<String, Node> nodesByName,
            KeyRegistry registry) {
        String name = nd.getName();
        return switch (NodeType.fromString(nd.getType())) {
            case VERTEX -> {
                if (nd.getPayload() == null)
                    throw new IllegalArgumentException("Vertex " + name + " needs a 'payload'");
                yield g.vertex(name, nd.getPayload());
            }
            case CONFIGURABLE -> {
                if (nd.getImplementation() == null)
                    throw new IllegalArgumentException("Configurable " + name + " needs an 'implementation'");
                List<Key<?>> keys = new ArrayList<>();
                for (String keyName : orEmpty(nd.getKeys()))
                    keys.add(lookupKey(registry, name, keyName));
                yield g.configurable(name, nd.getImplementation(), KeySet.of(keys), List.of(),
                        nodes(nd.getArgs(), nodesByName), List.of());
            }
            case APP -> {
                if (nd.getBase() == null)
                    throw new IllegalArgumentException("App " + name + " needs a 'base'");
                yield g.app(name, nodesByName.get(nd.getBase()),
                        nodes(nd.getArgs(), nodesByName).toArray(new Node[0]));
            }
            case CHOICE -> {
                if (nd.getBranches() == null || nd.getBranches().isEmpty())
                    throw new IllegalArgumentException("Choice " + name + " needs 'branches'");
                Key<?> key = lookupKey(registry, name, nd.getKey());
                if (!(key.defaultValue() instanceof String))
                    throw new IllegalArgumentException("Choice " + name + ": key " + key.name() + " is not a string");
                @SuppressWarnings("unchecked")
                Value<String> condition = Values.value((Key<String>) key);
                LinkedHashMap<String, Node> branches = new LinkedHashMap<>();
                for (var e : nd.getBranches().entrySet())
                    branches.put(e.getKey(), nodesByName.get(e.getValue()));
                String defaultBranch = nd.getDefaultBranch() != null
                        ? nd.getDefaultBranch()
                        : branches.keySet().iterator().next();
                yield g.choice(name, condition, branches, defaultBranch);
            }
        };
    }

    private static Key<?> lookupKey(KeyRegistry registry, String nodeName, String keyName) {
        if (keyName == null)
            throw new IllegalArgumentException("Node " + nodeName + " needs a 'key'");
        return registry.get(keyName).orElseThrow(
                () -> new IllegalArgumentException("Unknown key '" + keyName + "' in node " + nodeName));
    }

    /** Nodes that must exist before this one is created, in argument order. */
    private static List<String> references(GraphDefinition.NodeDef nd) {
        List<String> refs = new ArrayList<>();
        if (nd.getBase() != null)
            refs.add(nd.getBase());
        refs.addAll(orEmpty(nd.getArgs()));
        if (nd.getBranches() != null)
            refs.addAll(nd.getBranches().values());
        return refs;
    }

    private static List<Node> nodes(List<String> names, Map<String, Node> nodesByName) {
        List<Node> out = new ArrayList<>();
        for (String n : orEmpty(names))
            out.add(nodesByName.get(n));
        return out;
    }

    private static void requireDefined(Map<String, GraphDefinition.NodeDef> defs, GraphDefinition.NodeDef nd,
            String ref) {
        if (!defs.containsKey(ref))
            throw new IllegalArgumentException("Unknown node '" + ref + "' referenced by " + nd.getName());
    }

    /**
     * Every node still pending references another pending node, so following
     * the first such reference from any of them must come back to a node
     * already visited.
     */
    private static List<String> findCycle(Collection<GraphDefinition.NodeDef> pending, Map<String, Node> created) {
        Map<String, GraphDefinition.NodeDef> byName = new HashMap<>();
        for (GraphDefinition.NodeDef nd : pending)
            byName.put(nd.getName(), nd);
        List<String> path = new ArrayList<>();
        String curr = pending.iterator().next().getName();
        while (!path.contains(curr)) {
            path.add(curr);
            for (String ref : references(byName.get(curr))) {
                if (!created.containsKey(ref)) {
                    curr = ref;
                    break;
                }
            }
        }
        return new ArrayList<>(path.subList(path.indexOf(curr), path.size()));
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }
}
