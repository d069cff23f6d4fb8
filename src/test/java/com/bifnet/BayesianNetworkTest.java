package com.bifnet;

import com.bifnet.error.ModelConstructionException;
import com.bifnet.graph.BayesNetModels.Edge;
import com.bifnet.graph.BayesNetModels.ModelIssue;
import com.bifnet.graph.BayesianNetwork;
import com.bifnet.graph.TabularCpd;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BayesianNetworkTest {

    @Test
    void keepsNodesAndParentsInInsertionOrder() {
        var model = new BayesianNetwork(List.of("lonely"), List.of(new Edge("b", "c"), new Edge("a", "c")));

        assertEquals(List.of("lonely", "b", "c", "a"), model.nodes());
        assertEquals(List.of("b", "a"), model.parents("c"));
        assertEquals(List.of("c"), model.children("a"));
    }

    @Test
    void rejectsEdgesThatCloseACycle() {
        var model = new BayesianNetwork(List.of(new Edge("a", "b"), new Edge("b", "c")));

        var ex = assertThrows(ModelConstructionException.class, () -> model.addEdge("c", "a"));
        assertEquals("CYCLE_DETECTED", ex.getCode());
        assertThrows(ModelConstructionException.class, () -> model.addEdge("a", "a"));
        assertEquals(2, model.edges().size());
    }

    @Test
    void validatesCpdSizeAgainstCardinalities() {
        var ex = assertThrows(ModelConstructionException.class, () -> new TabularCpd("c", 2,
                new double[]{0.5, 0.5, 0.5}, List.of("a"), List.of(2)));
        assertEquals("CPD_SIZE_MISMATCH", ex.getCode());

        assertThrows(ModelConstructionException.class, () -> new TabularCpd("c", 2,
                new double[]{0.5, 0.5}, List.of("a"), List.of()));

        var cpd = new TabularCpd("c", 2, new double[]{0.1, 0.2, 0.9, 0.8}, List.of("a"), List.of(2));
        assertEquals(2, cpd.columns());
        assertEquals(0.9, cpd.value(1, 0));
    }

    @Test
    void rejectsCpdForUnknownNodeAndReplacesDuplicates() {
        var model = new BayesianNetwork(List.of("a"), List.of());

        var ex = assertThrows(ModelConstructionException.class,
                () -> model.addCpds(new TabularCpd("z", 1, new double[]{1}, null, null)));
        assertEquals("UNKNOWN_NODE", ex.getCode());

        model.addCpds(new TabularCpd("a", 2, new double[]{0.5, 0.5}, null, null));
        model.addCpds(new TabularCpd("a", 2, new double[]{0.3, 0.7}, null, null));
        assertEquals(1, model.cpds().size());
        assertEquals(0.3, model.cpd("a").orElseThrow().value(0, 0));
    }

    @Test
    void reportsStructuralIssuesBetweenGraphAndCpds() {
        var model = new BayesianNetwork(List.of("a", "b", "c", "d"), List.of(new Edge("a", "b"), new Edge("a", "c")));
        model.addCpds(
                new TabularCpd("a", 3, new double[]{0.2, 0.3, 0.5}, null, null),
                new TabularCpd("b", 2, new double[]{0.5, 0.5, 0.5, 0.5}, List.of("a"), List.of(2)),
                new TabularCpd("c", 2, new double[]{0.5, 0.5}, null, null));

        List<ModelIssue> issues = model.checkModel();

        assertTrue(issues.contains(new ModelIssue("CARDINALITY_MISMATCH",
                "Evidence a has cardinality 3 but CPD of b expects 2", "b")));
        assertTrue(issues.stream().anyMatch(i -> i.code().equals("EVIDENCE_MISMATCH") && i.node().equals("c")));
        assertTrue(issues.stream().anyMatch(i -> i.code().equals("MISSING_CPD") && i.node().equals("d")));
        assertEquals(3, issues.size());
    }
}
