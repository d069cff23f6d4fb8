package com.bifnet;

import com.bifnet.parser.ParserDtos.CpdTable;
import com.bifnet.writer.CpdColumns;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CpdColumnsTest {
    private static final Map<String, Integer> CARDS = Map.of("a", 2, "b", 3, "c", 2);

    @Test
    void keepsTableWhenOrderIsUnchanged() {
        CpdTable table = CpdTable.of(new double[][]{{0.2, 0.8}, {0.8, 0.2}});
        assertSame(table, CpdColumns.reorder(table, List.of("a"), List.of("a"), CARDS));
    }

    @Test
    void swapsParentsOfDifferentCardinality() {
        // columns in (a, b) order: a0b0 a0b1 a0b2 a1b0 a1b1 a1b2
        CpdTable table = CpdTable.of(new double[][]{{0, 1, 2, 3, 4, 5}});

        CpdTable swapped = CpdColumns.reorder(table, List.of("a", "b"), List.of("b", "a"), CARDS);

        // columns in (b, a) order: b0a0 b0a1 b1a0 b1a1 b2a0 b2a1
        assertArrayEquals(new double[]{0, 3, 1, 4, 2, 5}, swapped.flatten());
    }

    @Test
    void movesTheSlowestParentToTheEnd() {
        CpdTable table = CpdTable.of(new double[][]{
                {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11}});

        CpdTable moved = CpdColumns.reorder(table, List.of("a", "b", "c"), List.of("b", "c", "a"), CARDS);

        // target b0c0a0 comes from a0b0c0 (0), b0c0a1 from a1b0c0 (6), b0c1a0 from a0b0c1 (1) ...
        assertEquals(List.of(0.0, 6.0, 1.0, 7.0, 2.0, 8.0), moved.values().subList(0, 6));
    }

    @Test
    void rejectsDifferentParentSets() {
        CpdTable table = CpdTable.of(new double[][]{{0.5, 0.5}});
        assertThrows(IllegalArgumentException.class,
                () -> CpdColumns.reorder(table, List.of("a"), List.of("c"), CARDS));
    }
}
