package com.bifnet.graph;

import java.util.List;

public class BayesNetModels {
    public record Edge(String parent, String child) {}

    public record ModelIssue(String code, String message, String node) {}

    public record CpdSummary(String variable, int cardinality, List<String> evidence, List<Integer> evidenceCardinality,
                             List<List<Double>> values) {}

    public record ModelSummary(List<String> nodes, List<Edge> edges, List<CpdSummary> cpds, List<ModelIssue> issues) {}
}
