package com.bifnet.graph;

import com.bifnet.error.ModelConstructionException;

import java.util.Arrays;
import java.util.List;

/**
 * Conditional probability table of one variable. {@code values} is row-major: one row per state of
 * the variable, one column per configuration of the evidence, first evidence varying slowest.
 */
public final class TabularCpd {
    private final String variable;
    private final int cardinality;
    private final double[] values;
    private final List<String> evidence;
    private final List<Integer> evidenceCardinality;

    public TabularCpd(String variable, int cardinality, double[] values,
                      List<String> evidence, List<Integer> evidenceCardinality) {
        if (cardinality <= 0) {
            throw new ModelConstructionException("INVALID_CARDINALITY", "Cardinality of " + variable + " must be positive");
        }
        List<String> ev = evidence == null ? List.of() : List.copyOf(evidence);
        List<Integer> evCard = evidenceCardinality == null ? List.of() : List.copyOf(evidenceCardinality);
        if (ev.size() != evCard.size()) {
            throw new ModelConstructionException("EVIDENCE_MISMATCH",
                    "Length of evidence_card doesn't match length of evidence for " + variable);
        }
        int expected = cardinality * evCard.stream().reduce(1, (a, b) -> a * b);
        if (values.length != expected) {
            throw new ModelConstructionException("CPD_SIZE_MISMATCH",
                    "Values of " + variable + " must hold " + expected + " entries, got " + values.length);
        }
        this.variable = variable;
        this.cardinality = cardinality;
        this.values = values.clone();
        this.evidence = ev;
        this.evidenceCardinality = evCard;
    }

    public String variable() {
        return variable;
    }

    public int cardinality() {
        return cardinality;
    }

    public List<String> evidence() {
        return evidence;
    }

    public List<Integer> evidenceCardinality() {
        return evidenceCardinality;
    }

    public int columns() {
        return values.length / cardinality;
    }

    public double value(int state, int column) {
        if (state < 0 || state >= cardinality || column < 0 || column >= columns()) {
            throw new IndexOutOfBoundsException("(" + state + "," + column + ") outside CPD of " + variable);
        }
        return values[state * columns() + column];
    }

    public double[] values() {
        return values.clone();
    }

    public double[][] toMatrix() {
        double[][] matrix = new double[cardinality][];
        for (int r = 0; r < cardinality; r++) {
            matrix[r] = Arrays.copyOfRange(values, r * columns(), (r + 1) * columns());
        }
        return matrix;
    }

    @Override
    public String toString() {
        return "TabularCpd[" + variable + " | " + String.join(", ", evidence) + "]";
    }
}
