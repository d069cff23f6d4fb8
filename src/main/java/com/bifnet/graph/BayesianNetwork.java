package com.bifnet.graph;

import com.bifnet.error.ModelConstructionException;
import com.bifnet.graph.BayesNetModels.Edge;
import com.bifnet.graph.BayesNetModels.ModelIssue;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Directed acyclic graph of variables with one {@link TabularCpd} per node once complete.
 */
@Slf4j
public class BayesianNetwork {
    private final Set<String> nodes = new LinkedHashSet<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Map<String, List<String>> adj = new HashMap<>();
    private final Map<String, TabularCpd> cpds = new LinkedHashMap<>();

    public BayesianNetwork(Collection<Edge> edges) {
        this(List.of(), edges);
    }

    public BayesianNetwork(Collection<String> nodes, Collection<Edge> edges) {
        nodes.forEach(this::addNode);
        edges.forEach(e -> addEdge(e.parent(), e.child()));
    }

    public void addNode(String node) {
        if (nodes.add(node)) adj.put(node, new ArrayList<>());
    }

    public void addEdge(String parent, String child) {
        if (parent.equals(child)) {
            throw new ModelConstructionException("CYCLE_DETECTED", "Self loop on " + parent);
        }
        addNode(parent);
        addNode(child);
        if (edges.contains(new Edge(parent, child))) return;
        if (reachable(child, parent)) {
            throw new ModelConstructionException("CYCLE_DETECTED",
                    "Adding edge " + parent + "->" + child + " would create a cycle");
        }
        edges.add(new Edge(parent, child));
        adj.get(parent).add(child);
    }

    public void addCpds(TabularCpd... tables) {
        for (TabularCpd cpd : tables) {
            if (!nodes.contains(cpd.variable())) {
                throw new ModelConstructionException("UNKNOWN_NODE",
                        "CPD defined on variable not in the model: " + cpd.variable());
            }
            if (cpds.put(cpd.variable(), cpd) != null) {
                log.warn("Replacing existing CPD for {}", cpd.variable());
            }
        }
    }

    public List<String> nodes() {
        return List.copyOf(nodes);
    }

    public List<Edge> edges() {
        return List.copyOf(edges);
    }

    public List<String> parents(String node) {
        return edges.stream().filter(e -> e.child().equals(node)).map(Edge::parent).toList();
    }

    public List<String> children(String node) {
        return List.copyOf(adj.getOrDefault(node, List.of()));
    }

    public Optional<TabularCpd> cpd(String node) {
        return Optional.ofNullable(cpds.get(node));
    }

    public List<TabularCpd> cpds() {
        return List.copyOf(cpds.values());
    }

    /**
     * Structural consistency between the graph and its CPDs. Empty when every node has a CPD whose
     * evidence is exactly the node's parents, with cardinalities matching the parents' own CPDs.
     */
    public List<ModelIssue> checkModel() {
        List<ModelIssue> issues = new ArrayList<>();
        for (String node : nodes) {
            TabularCpd cpd = cpds.get(node);
            if (cpd == null) {
                issues.add(new ModelIssue("MISSING_CPD", "No CPD associated with " + node, node));
                continue;
            }
            if (!new HashSet<>(cpd.evidence()).equals(new HashSet<>(parents(node)))) {
                issues.add(new ModelIssue("EVIDENCE_MISMATCH",
                        "CPD evidence " + cpd.evidence() + " differs from parents " + parents(node), node));
                continue;
            }
            for (int i = 0; i < cpd.evidence().size(); i++) {
                TabularCpd parentCpd = cpds.get(cpd.evidence().get(i));
                if (parentCpd != null && parentCpd.cardinality() != cpd.evidenceCardinality().get(i)) {
                    issues.add(new ModelIssue("CARDINALITY_MISMATCH",
                            "Evidence " + parentCpd.variable() + " has cardinality " + parentCpd.cardinality()
                                    + " but CPD of " + node + " expects " + cpd.evidenceCardinality().get(i), node));
                }
            }
        }
        return issues;
    }

    private boolean reachable(String from, String to) {
        Deque<String> stack = new ArrayDeque<>(List.of(from));
        Set<String> visited = new HashSet<>();
        while (!stack.isEmpty()) {
            String node = stack.pop();
            if (node.equals(to)) return true;
            if (visited.add(node)) stack.addAll(adj.getOrDefault(node, List.of()));
        }
        return false;
    }
}
