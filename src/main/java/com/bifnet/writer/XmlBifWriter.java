package com.bifnet.writer;

import com.bifnet.parser.ParserDtos.CpdTable;
import com.bifnet.writer.WriterDtos.NetworkDescription;
import com.bifnet.writer.WriterDtos.WriterOptions;
import com.bifnet.writer.WriterDtos.XmlNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Builds canonical XMLBIF 0.3 trees. VARIABLE and DEFINITION elements are sorted by variable name
 * and GIVEN elements by parent name; OUTCOME and PROPERTY keep the order they were given in.
 */
@Slf4j
@Component
public class XmlBifWriter {
    static final String VERSION = "0.3";

    public XmlBifDocument write(NetworkDescription description, WriterOptions options) {
        List<XmlNode> network = new ArrayList<>();
        if (description.networkName() != null) {
            network.add(XmlNode.leaf("NAME", description.networkName()));
        }
        network.addAll(addVariables(description));
        network.addAll(addDefinitions(description));

        XmlNode root = new XmlNode("BIF", Map.of("version", VERSION), null,
                List.of(XmlNode.element("NETWORK", network)));
        log.debug("Built XMLBIF tree for {} with {} variables", description.networkName(), description.variables().size());
        return new XmlBifDocument(root, options);
    }

    List<XmlNode> addVariables(NetworkDescription description) {
        List<XmlNode> result = new ArrayList<>();
        for (String variable : sorted(description.variables())) {
            List<XmlNode> children = new ArrayList<>();
            children.add(XmlNode.leaf("NAME", variable));
            description.states().get(variable).forEach(s -> children.add(XmlNode.leaf("OUTCOME", s)));
            description.propertiesOf(variable).forEach(p -> children.add(XmlNode.leaf("PROPERTY", p)));
            result.add(new XmlNode("VARIABLE", Map.of("TYPE", "nature"), null, children));
        }
        return result;
    }

    List<XmlNode> addDefinitions(NetworkDescription description) {
        List<XmlNode> result = new ArrayList<>();
        for (String variable : sorted(description.variables())) {
            List<XmlNode> children = new ArrayList<>();
            children.add(XmlNode.leaf("FOR", variable));
            List<String> givens = sorted(description.parentsOf(variable));
            givens.forEach(p -> children.add(XmlNode.leaf("GIVEN", p)));
            addTable(description, variable, givens).ifPresent(children::add);
            result.add(XmlNode.element("DEFINITION", children));
        }
        return result;
    }

    private Optional<XmlNode> addTable(NetworkDescription description, String variable, List<String> givens) {
        CpdTable table = description.cpds().get(variable);
        if (table == null) return Optional.empty();

        // A reader restores GIVEN in reverse, so columns must follow that order.
        List<String> readBack = new ArrayList<>(givens);
        Collections.reverse(readBack);
        Map<String, Integer> cardinality = new HashMap<>();
        description.states().forEach((v, s) -> cardinality.put(v, s.size()));
        CpdTable ordered = CpdColumns.reorder(table, description.parentsOf(variable), readBack, cardinality);

        String text = ordered.values().stream().map(XmlBifWriter::formatValue).collect(Collectors.joining(" "));
        return Optional.of(XmlNode.leaf("TABLE", text));
    }

    static String formatValue(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static List<String> sorted(Collection<String> names) {
        return names.stream().sorted().toList();
    }
}
