package com.bifnet.writer;

import com.bifnet.parser.ParserDtos.CpdTable;

import java.util.*;

/**
 * Column permutations of a CPD between two orderings of the same parents. Columns enumerate parent
 * configurations with the first parent varying slowest.
 */
public final class CpdColumns {
    private CpdColumns() {}

    public static CpdTable reorder(CpdTable table, List<String> from, List<String> to, Map<String, Integer> cardinality) {
        if (from.equals(to)) return table;
        if (!new HashSet<>(from).equals(new HashSet<>(to)) || from.size() != to.size()) {
            throw new IllegalArgumentException("Parent orders " + from + " and " + to + " differ in content");
        }

        int[] toCards = to.stream().mapToInt(cardinality::get).toArray();
        int[] fromCards = from.stream().mapToInt(cardinality::get).toArray();
        int[] position = to.stream().mapToInt(from::indexOf).toArray();

        List<Double> values = new ArrayList<>(table.values().size());
        for (int r = 0; r < table.rows(); r++) {
            for (int target = 0; target < table.columns(); target++) {
                int[] assignment = new int[from.size()];
                int rest = target;
                for (int i = to.size() - 1; i >= 0; i--) {
                    assignment[position[i]] = rest % toCards[i];
                    rest /= toCards[i];
                }
                int source = 0;
                for (int i = 0; i < from.size(); i++) {
                    source = source * fromCards[i] + assignment[i];
                }
                values.add(table.value(r, source));
            }
        }
        return new CpdTable(table.rows(), table.columns(), values);
    }
}
