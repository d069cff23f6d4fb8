package com.bifnet;

import com.bifnet.graph.BayesianNetwork;
import com.bifnet.graph.TabularCpd;
import com.bifnet.parser.ParserDtos.BifNetwork;
import com.bifnet.parser.ParserDtos.CpdTable;
import com.bifnet.parser.XmlBifSource;
import com.bifnet.service.NetworkCodecService;
import com.bifnet.writer.CpdColumns;
import com.bifnet.writer.WriterDtos.NetworkDescription;
import com.bifnet.writer.WriterDtos.WriterOptions;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class NetworkCodecServiceTest {
    @Autowired
    private NetworkCodecService service;

    @Test
    void buildsModelWithRowMajorCpdsAndParentEvidence() throws Exception {
        BayesianNetwork model = service.readModel(XmlBifSource.fromPath(dogProblem()));

        assertEquals(5, model.nodes().size());
        assertEquals(4, model.edges().size());
        assertTrue(model.checkModel().isEmpty());

        TabularCpd dogOut = model.cpd("dog-out").orElseThrow();
        assertEquals(List.of("family-out", "bowel-problem"), dogOut.evidence());
        assertEquals(List.of(2, 2), dogOut.evidenceCardinality());
        assertEquals(0.97, dogOut.value(0, 2));
        assertEquals(0.7, dogOut.value(1, 3));
    }

    @Test
    void reportsVariablesWithoutTablesAsMissingCpds() {
        BayesianNetwork model = service.readModel(XmlBifSource.fromString("""
                <BIF><NETWORK>
                  <VARIABLE TYPE="nature"><NAME>rain</NAME><OUTCOME>yes</OUTCOME><OUTCOME>no</OUTCOME></VARIABLE>
                  <VARIABLE TYPE="nature"><NAME>wet</NAME><OUTCOME>yes</OUTCOME><OUTCOME>no</OUTCOME></VARIABLE>
                  <DEFINITION><FOR>wet</FOR><GIVEN>rain</GIVEN><TABLE>0.9 0.2 0.1 0.8</TABLE></DEFINITION>
                </NETWORK></BIF>
                """));

        var summary = service.summarize(model);
        assertEquals(List.of("rain", "wet"), summary.nodes());
        assertEquals(List.of(List.of(0.9, 0.2), List.of(0.1, 0.8)), summary.cpds().get(0).values());
        assertEquals(summary, service.summarize(model));
        assertEquals(1, summary.issues().size());
        assertEquals("MISSING_CPD", summary.issues().get(0).code());
    }

    @Test
    void roundTripsVariablesStatesAndProperties() throws Exception {
        BifNetwork original = service.read(XmlBifSource.fromPath(dogProblem()));

        String xml = service.write(service.toDescription(original)).toString();
        BifNetwork copy = service.read(XmlBifSource.fromString(xml));

        assertEquals("Dog_Problem", copy.networkName());
        assertEquals(new HashSet<>(original.variables()), new HashSet<>(copy.variables()));
        assertEquals(List.of("bowel-problem", "dog-out", "family-out", "hear-bark", "light-on"), copy.variables());
        original.variables().forEach(v -> {
            assertEquals(original.states().get(v), copy.states().get(v));
            assertEquals(original.properties().get(v), copy.properties().get(v));
            assertEquals(new HashSet<>(original.parentsOf(v)), new HashSet<>(copy.parentsOf(v)));
        });
    }

    @Test
    void roundTripsProbabilitiesWhenGivenOrderIsNotCanonical() {
        BifNetwork original = service.read(XmlBifSource.fromString("""
                <BIF><NETWORK>
                  <VARIABLE TYPE="nature"><NAME>z</NAME><OUTCOME>0</OUTCOME><OUTCOME>1</OUTCOME><OUTCOME>2</OUTCOME></VARIABLE>
                  <VARIABLE TYPE="nature"><NAME>a</NAME><OUTCOME>0</OUTCOME><OUTCOME>1</OUTCOME></VARIABLE>
                  <VARIABLE TYPE="nature"><NAME>child</NAME><OUTCOME>t</OUTCOME><OUTCOME>f</OUTCOME></VARIABLE>
                  <DEFINITION><FOR>z</FOR><TABLE>0.2 0.3 0.5</TABLE></DEFINITION>
                  <DEFINITION><FOR>a</FOR><TABLE>0.4 0.6</TABLE></DEFINITION>
                  <DEFINITION>
                    <FOR>child</FOR><GIVEN>a</GIVEN><GIVEN>z</GIVEN>
                    <TABLE>0.1 0.2 0.3 0.4 0.5 0.6 0.9 0.8 0.7 0.6 0.5 0.4</TABLE>
                  </DEFINITION>
                </NETWORK></BIF>
                """));
        assertEquals(List.of("z", "a"), original.parentsOf("child"));

        String xml = service.write(service.toDescription(original)).toString();
        BifNetwork copy = service.read(XmlBifSource.fromString(xml));
        assertEquals(List.of("z", "a"), copy.parentsOf("child"));

        CpdTable azOrder = CpdColumns.reorder(original.cpds().get("child"),
                List.of("z", "a"), List.of("a", "z"), Map.of("z", 3, "a", 2));
        NetworkDescription reordered = new NetworkDescription(null, original.variables(), original.states(),
                Map.of("child", List.of("a", "z")), null, Map.of("child", azOrder));
        BifNetwork sorted = service.read(XmlBifSource.fromString(service.write(reordered).toString()));
        assertEquals(List.of("z", "a"), sorted.parentsOf("child"));

        for (int z = 0; z < 3; z++) {
            for (int a = 0; a < 2; a++) {
                Map<String, Integer> assignment = new HashMap<>(Map.of("z", z, "a", a));
                for (int state = 0; state < 2; state++) {
                    double expected = probability(original, "child", state, assignment);
                    assertEquals(expected, probability(copy, "child", state, assignment));
                    assertEquals(expected, probability(sorted, "child", state, assignment));
                }
            }
        }
    }

    @Test
    void roundTripsStateNamesWithSurroundingWhitespaceAndCarriageReturns() {
        var description = new NetworkDescription(" spaced ", List.of("a"),
                Map.of("a", List.of(" hi ", "lo\r\nw", "\ttab")), Map.of(),
                Map.of("a", List.of(" position = (1, 2) ")), null);

        for (boolean pretty : List.of(true, false)) {
            var options = new WriterOptions(StandardCharsets.UTF_8, pretty);
            BifNetwork copy = service.read(XmlBifSource.fromString(service.write(description, options).toString()));

            assertEquals(" spaced ", copy.networkName());
            assertEquals(List.of(" hi ", "lo\r\nw", "\ttab"), copy.states().get("a"));
            assertEquals(List.of(" position = (1, 2) "), copy.properties().get("a"));
        }
    }

    @Test
    void writesWithConfiguredDefaults() {
        var description = new NetworkDescription("defaults", List.of("a"), Map.of("a", List.of("t")), Map.of(), null, null);

        var document = service.write(description);

        assertTrue(document.options().prettyPrint());
        assertTrue(document.toString().startsWith("<BIF version=\"0.3\">\n  <NETWORK>\n    <NAME>defaults</NAME>"));
    }

    private static double probability(BifNetwork network, String variable, int state, Map<String, Integer> assignment) {
        int column = 0;
        for (String parent : network.parentsOf(variable)) {
            column = column * network.cardinality(parent) + assignment.get(parent);
        }
        return network.cpds().get(variable).value(state, column);
    }

    private Path dogProblem() throws Exception {
        return Path.of(getClass().getResource("/dog-problem.xml").toURI());
    }
}
