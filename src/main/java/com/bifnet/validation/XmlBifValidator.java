package com.bifnet.validation;

import com.bifnet.parser.ParserDtos.BifNetwork;
import com.bifnet.parser.ParserDtos.CpdTable;
import com.bifnet.parser.ParserDtos.DefinitionDoc;
import com.bifnet.parser.ParserDtos.NetworkDoc;
import com.bifnet.parser.ParserDtos.ParseError;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

@Component
public class XmlBifValidator {
    public List<ParseError> validate(NetworkDoc doc) {
        List<ParseError> errors = new ArrayList<>();

        if (doc.variables().isEmpty()) {
            errors.add(new ParseError("NO_VARIABLES", "Network declares no VARIABLE", "NETWORK", null));
        }

        duplicate(doc.variables().stream().map(v -> new Row(v.name(), "VARIABLE")).toList(), "DUPLICATE_VARIABLE", errors);
        duplicate(doc.definitions().stream().map(d -> new Row(d.forVariable(), "DEFINITION")).toList(), "DUPLICATE_DEFINITION", errors);

        doc.variables().forEach(v -> {
            if (v.outcomes().isEmpty()) {
                errors.add(new ParseError("NO_OUTCOMES", "Variable has no OUTCOME: " + v.name(), "VARIABLE", v.name()));
            }
        });

        Set<String> names = doc.variables().stream().map(v -> v.name()).collect(Collectors.toSet());
        for (DefinitionDoc d : doc.definitions()) {
            if (!names.contains(d.forVariable())) {
                errors.add(new ParseError("UNKNOWN_VARIABLE", "DEFINITION references unknown variable: " + d.forVariable(), "FOR", d.forVariable()));
            }
            for (String given : d.givens()) {
                if (!names.contains(given)) {
                    errors.add(new ParseError("UNKNOWN_PARENT", "GIVEN references unknown variable: " + given, "GIVEN", d.forVariable()));
                }
            }
        }

        return errors;
    }

    /**
     * Checks that every table has one column per configuration of its parents.
     */
    public List<ParseError> validateShapes(BifNetwork network) {
        List<ParseError> errors = new ArrayList<>();
        network.cpds().forEach((variable, table) -> {
            int expected = network.parentsOf(variable).stream().mapToInt(network::cardinality).reduce(1, (a, b) -> a * b);
            if (table.columns() != expected) {
                errors.add(new ParseError("CPD_SHAPE_MISMATCH", describe(variable, table, expected), "TABLE", variable));
            }
        });
        return errors;
    }

    private String describe(String variable, CpdTable table, int expected) {
        return "TABLE of " + variable + " has " + table.columns() + " columns, parents allow " + expected;
    }

    private void duplicate(List<Row> rows, String code, List<ParseError> errors) {
        Map<String, Long> counts = rows.stream().collect(Collectors.groupingBy(Row::name, Collectors.counting()));
        rows.stream().map(Row::name).distinct().forEach(name -> {
            if (counts.getOrDefault(name, 0L) > 1) {
                String element = rows.get(0).element();
                errors.add(new ParseError(code, "Duplicate " + element + " for " + name, element, name));
            }
        });
    }

    private record Row(String name, String element) {}
}
