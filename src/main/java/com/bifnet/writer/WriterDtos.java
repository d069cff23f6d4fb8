package com.bifnet.writer;

import com.bifnet.parser.ParserDtos.CpdTable;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.*;

public class WriterDtos {
    /**
     * Everything the writer emits. {@code networkName}, {@code properties} and {@code cpds} are optional;
     * a variable missing from {@code parents} has no parents.
     */
    public record NetworkDescription(String networkName,
                                     List<String> variables,
                                     Map<String, List<String>> states,
                                     Map<String, List<String>> parents,
                                     Map<String, List<String>> properties,
                                     Map<String, CpdTable> cpds) {
        public NetworkDescription {
            if (variables == null || states == null || parents == null) {
                throw new IllegalArgumentException("variables, states and parents are required");
            }
            if (variables.stream().anyMatch(Objects::isNull)) throw new IllegalArgumentException("Null variable name");
            List<String> declaredVariables = List.copyOf(variables);
            Map<String, List<String>> stateLists = copyLists(states, "states");
            Map<String, List<String>> parentLists = copyLists(parents, "parents");
            Map<String, List<String>> propertyLists = properties == null ? Map.of() : copyLists(properties, "properties");
            Map<String, CpdTable> tables = cpds == null ? Map.of() : copyTables(cpds);

            if (declaredVariables.isEmpty()) throw new IllegalArgumentException("At least one variable is required");
            Set<String> declared = new HashSet<>(declaredVariables);
            if (declared.size() != declaredVariables.size()) {
                throw new IllegalArgumentException("Duplicate variable in " + declaredVariables);
            }

            for (String variable : declaredVariables) {
                List<String> outcomes = stateLists.get(variable);
                if (outcomes == null || outcomes.isEmpty()) {
                    throw new IllegalArgumentException("No states for variable " + variable);
                }
            }
            requireDeclared(declared, stateLists.keySet(), "states");
            requireDeclared(declared, parentLists.keySet(), "parents");
            requireDeclared(declared, propertyLists.keySet(), "properties");
            requireDeclared(declared, tables.keySet(), "cpds");
            parentLists.values().forEach(ps -> requireDeclared(declared, ps, "parent list"));

            for (Map.Entry<String, CpdTable> e : tables.entrySet()) {
                int rows = stateLists.get(e.getKey()).size();
                int columns = 1;
                for (String parent : parentLists.getOrDefault(e.getKey(), List.of())) {
                    columns *= stateLists.get(parent).size();
                }
                CpdTable table = e.getValue();
                if (table.rows() != rows || table.columns() != columns) {
                    throw new IllegalArgumentException("CPD of " + e.getKey() + " is " + table.rows() + "x" + table.columns()
                            + ", expected " + rows + "x" + columns);
                }
            }

            variables = declaredVariables;
            states = stateLists;
            parents = parentLists;
            properties = propertyLists;
            cpds = tables;
        }

        public List<String> parentsOf(String variable) {
            return parents.getOrDefault(variable, List.of());
        }

        public List<String> propertiesOf(String variable) {
            return properties.getOrDefault(variable, List.of());
        }

        private static Map<String, List<String>> copyLists(Map<String, List<String>> source, String field) {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            source.forEach((key, values) -> {
                if (key == null || values == null || values.stream().anyMatch(Objects::isNull)) {
                    throw new IllegalArgumentException("Null entry in " + field);
                }
                copy.put(key, List.copyOf(values));
            });
            return Collections.unmodifiableMap(copy);
        }

        private static Map<String, CpdTable> copyTables(Map<String, CpdTable> source) {
            Map<String, CpdTable> copy = new LinkedHashMap<>();
            source.forEach((key, table) -> {
                if (key == null || table == null) throw new IllegalArgumentException("Null entry in cpds");
                copy.put(key, table);
            });
            return Collections.unmodifiableMap(copy);
        }

        private static void requireDeclared(Set<String> declared, Collection<String> names, String field) {
            for (String name : names) {
                if (!declared.contains(name)) {
                    throw new IllegalArgumentException("Undeclared variable " + name + " in " + field);
                }
            }
        }
    }

    public record WriterOptions(Charset encoding, boolean prettyPrint) {
        public WriterOptions {
            Objects.requireNonNull(encoding, "encoding");
        }

        public static WriterOptions defaults() {
            return new WriterOptions(StandardCharsets.UTF_8, true);
        }
    }

    /** Immutable element tree. An element carries either text or children, never both. */
    public record XmlNode(String tag, Map<String, String> attributes, String text, List<XmlNode> children) {
        public XmlNode {
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            children = List.copyOf(children);
            if (text != null && !children.isEmpty()) {
                throw new IllegalArgumentException("Element " + tag + " cannot mix text and children");
            }
        }

        public static XmlNode leaf(String tag, String text) {
            return new XmlNode(tag, Map.of(), text, List.of());
        }

        public static XmlNode element(String tag, List<XmlNode> children) {
            return new XmlNode(tag, Map.of(), null, children);
        }

        public List<XmlNode> children(String childTag) {
            return children.stream().filter(c -> c.tag().equals(childTag)).toList();
        }
    }
}
