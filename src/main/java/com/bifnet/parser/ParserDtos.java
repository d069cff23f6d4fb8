package com.bifnet.parser;

import com.bifnet.graph.BayesNetModels.Edge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class ParserDtos {
    /** Raw content of one NETWORK element, before cross-referencing. */
    public record NetworkDoc(String name, List<VariableDoc> variables, List<DefinitionDoc> definitions) {}

    public record VariableDoc(String name, List<String> outcomes, List<String> properties, int index) {}

    /** {@code givens} are kept in document order here; the reversal happens when parents are derived. */
    public record DefinitionDoc(String forVariable, List<String> givens, String table, int index) {}

    public record ParseError(String code, String message, String element, String variable) {}

    /**
     * Intermediate model extracted from one XMLBIF document. Maps iterate in document order:
     * {@code states} and {@code properties} follow VARIABLE order, {@code parents} and {@code cpds}
     * follow DEFINITION order.
     */
    public record BifNetwork(String networkName,
                             List<String> variables,
                             Map<String, List<String>> states,
                             Map<String, List<String>> parents,
                             List<Edge> edges,
                             Map<String, CpdTable> cpds,
                             Map<String, List<String>> properties) {

        public List<String> parentsOf(String variable) {
            return parents.getOrDefault(variable, List.of());
        }

        public int cardinality(String variable) {
            List<String> outcomes = states.get(variable);
            if (outcomes == null) throw new IllegalArgumentException("Unknown variable: " + variable);
            return outcomes.size();
        }
    }

    /**
     * Probability matrix with one row per state of the variable and one column per
     * configuration of its parents, stored row-major.
     */
    public record CpdTable(int rows, int columns, List<Double> values) {
        public CpdTable {
            if (rows <= 0 || columns <= 0) {
                throw new IllegalArgumentException("CPD dimensions must be positive: " + rows + "x" + columns);
            }
            if (values.size() != rows * columns) {
                throw new IllegalArgumentException("CPD of " + rows + "x" + columns + " cannot hold " + values.size() + " values");
            }
            values = List.copyOf(values);
        }

        public static CpdTable of(double[][] matrix) {
            List<Double> flat = new ArrayList<>();
            for (double[] row : matrix) {
                if (row.length != matrix[0].length) throw new IllegalArgumentException("Ragged CPD matrix");
                Arrays.stream(row).forEach(flat::add);
            }
            return new CpdTable(matrix.length, matrix.length == 0 ? 0 : matrix[0].length, flat);
        }

        public double value(int row, int column) {
            if (row < 0 || row >= rows || column < 0 || column >= columns) {
                throw new IndexOutOfBoundsException("(" + row + "," + column + ") outside " + rows + "x" + columns);
            }
            return values.get(row * columns + column);
        }

        public List<Double> row(int row) {
            return values.subList(row * columns, (row + 1) * columns);
        }

        public double[] flatten() {
            return values.stream().mapToDouble(Double::doubleValue).toArray();
        }

        public double[][] toMatrix() {
            double[][] matrix = new double[rows][columns];
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < columns; c++) {
                    matrix[r][c] = value(r, c);
                }
            }
            return matrix;
        }
    }
}
