package com.spreadsheet.transpiler.services;

import com.spreadsheet.transpiler.exceptions.CellNotFoundException;
import com.spreadsheet.transpiler.models.CellId;
import com.spreadsheet.transpiler.models.Conversion;
import com.spreadsheet.transpiler.models.DependencyNode;
import com.spreadsheet.transpiler.readers.GridSheetReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the dependency and dependant trees, run through ConversionService
 * so that every node carries a real computed value.
 */
class DependencyReporterTest {

    private ConversionService service;

    @BeforeEach
    void setUp() {
        service = new ConversionService();
    }

    private Conversion convert(Object... referencesAndValues) {
        Map<String, Object> cells = new LinkedHashMap<>();
        for (int i = 0; i < referencesAndValues.length; i += 2) {
            cells.put((String) referencesAndValues[i], referencesAndValues[i + 1]);
        }
        return service.convert(new GridSheetReader(cells));
    }

    @Test
    void testDependencyTreeOfOneCell() {
        Conversion conversion = convert("A1", 5, "B1", 10, "C1", "=A1+B1");

        List<DependencyNode> trees = service.dependencies(conversion, CellId.parse("C1"));

        assertEquals(1, trees.size());
        DependencyNode root = trees.get(0);
        assertEquals(CellId.parse("C1"), root.getCellId());
        assertEquals("A1+B1", root.getExpression());
        assertEquals(15.0, root.getValue());
        assertEquals(2, root.getChildren().size());
        assertEquals(CellId.parse("A1"), root.getChildren().get(0).getCellId());
        assertEquals(10.0, root.getChildren().get(1).getValue());
        assertTrue(root.getChildren().get(0).getChildren().isEmpty());
    }

    /**
     * Without a start cell every cell nothing references is a root.
     */
    @Test
    void testDependencyTreesOfAllRoots() {
        Conversion conversion = convert("A1", 5, "B1", "=A1*2", "C1", "=B1+1", "D1", 7);

        List<DependencyNode> trees = service.dependencies(conversion, null);

        assertEquals(List.of(CellId.parse("C1"), CellId.parse("D1")),
                List.of(trees.get(0).getCellId(), trees.get(1).getCellId()));
        DependencyNode b1 = trees.get(0).getChildren().get(0);
        assertEquals(CellId.parse("B1"), b1.getCellId());
        assertEquals(CellId.parse("A1"), b1.getChildren().get(0).getCellId());
    }

    @Test
    void testDependantTree() {
        Conversion conversion = convert("A1", 5, "B1", "=A1*2", "C1", "=A1+B1");

        DependencyNode a1 = service.dependants(conversion, CellId.parse("A1")).get(0);

        // A1 is used by B1 and C1; B1 is used by C1
        assertEquals(2, a1.getChildren().size());
        DependencyNode b1 = a1.getChildren().get(0);
        assertEquals(CellId.parse("B1"), b1.getCellId());
        assertEquals(CellId.parse("C1"), b1.getChildren().get(0).getCellId());
        assertEquals(15.0, b1.getChildren().get(0).getValue());
        assertEquals(CellId.parse("C1"), a1.getChildren().get(1).getCellId());
    }

    /**
     * Trees follow the graph as extracted, so a cycle shows up once more as a
     * circular leaf even though its edge was removed for sequencing.
     */
    @Test
    void testCycleIsMarkedCircular() {
        Conversion conversion = convert("A1", "=B1", "B1", "=A1+1");
        assertTrue(conversion.hasCircularReferences());

        DependencyNode a1 = service.dependencies(conversion, CellId.parse("A1")).get(0);
        DependencyNode b1 = a1.getChildren().get(0);
        DependencyNode again = b1.getChildren().get(0);

        assertFalse(a1.isCircular());
        assertFalse(b1.isCircular());
        assertEquals(CellId.parse("A1"), again.getCellId());
        assertTrue(again.isCircular());
        assertTrue(again.getChildren().isEmpty());
    }

    @Test
    void testSelfReferenceIsMarkedCircular() {
        Conversion conversion = convert("A1", "=A1+1");

        DependencyNode a1 = service.dependencies(conversion, CellId.parse("A1")).get(0);

        assertEquals(1, a1.getChildren().size());
        assertTrue(a1.getChildren().get(0).isCircular());
    }

    @Test
    void testUndefinedReferenceIsALeafWithValueZero() {
        Conversion conversion = convert("A1", "=Z9+2");

        DependencyNode z9 = service.dependencies(conversion, CellId.parse("A1")).get(0).getChildren().get(0);

        assertEquals(CellId.parse("Z9"), z9.getCellId());
        assertEquals("0", z9.getExpression());
        assertEquals(0.0, z9.getValue());
    }

    @Test
    void testEvaluationErrorIsCarriedOnTheNode() {
        Conversion conversion = convert("A1", "=IF(B1>1,2,3)", "B1", 4);

        DependencyNode a1 = service.dependencies(conversion, CellId.parse("A1")).get(0);

        assertNull(a1.getValue());
        assertNotNull(a1.getError());
    }

    @Test
    void testUnknownStartCell() {
        Conversion conversion = convert("A1", 1);

        assertThrows(CellNotFoundException.class, () -> service.dependencies(conversion, CellId.parse("Q5")));
        assertThrows(CellNotFoundException.class, () -> service.dependants(conversion, CellId.parse("Q5")));
    }

    private static int countNodes(DependencyNode node) {
        int count = 1;
        for (DependencyNode child : node.getChildren()) {
            count += countNodes(child);
        }
        return count;
    }

    /**
     * Each cell uses the two above it. Expanding every path would give over a
     * million nodes; each cell is expanded once and later occurrences are repeated leaves.
     */
    @Test
    void testSharedDependenciesAreExpandedOnce() {
        Map<String, Object> cells = new LinkedHashMap<>();
        cells.put("A1", 1);
        cells.put("A2", 1);
        for (int row = 3; row <= 30; row++) {
            cells.put("A" + row, "=A" + (row - 1) + "+A" + (row - 2));
        }
        Conversion conversion = service.convert(new GridSheetReader(cells));

        DependencyNode a30 = service.dependencies(conversion, CellId.parse("A30")).get(0);

        assertEquals(832040.0, a30.getValue());
        assertEquals(57, countNodes(a30));
        DependencyNode a28 = a30.getChildren().get(1);
        assertEquals(CellId.parse("A28"), a28.getCellId());
        assertTrue(a28.isRepeated());
        assertFalse(a28.isCircular());
        assertTrue(a28.getChildren().isEmpty());
        assertFalse(a30.getChildren().get(0).isRepeated());
    }

    /**
     * Cells without dependencies are never marked repeated.
     */
    @Test
    void testRepeatedLeavesAreShownPlainly() {
        Conversion conversion = convert("A1", 5, "B1", "=A1*2", "C1", "=A1+B1");

        DependencyNode c1 = service.dependencies(conversion, CellId.parse("C1")).get(0);

        assertFalse(c1.getChildren().get(0).isRepeated());
        DependencyNode b1 = c1.getChildren().get(1);
        assertEquals(CellId.parse("A1"), b1.getChildren().get(0).getCellId());
        assertFalse(b1.getChildren().get(0).isRepeated());
    }

    @Test
    void testLongChainDoesNotOverflow() {
        Map<String, Object> cells = new LinkedHashMap<>();
        cells.put("A1", 1);
        for (int row = 2; row <= 3000; row++) {
            cells.put("A" + row, "=A" + (row - 1) + "+1");
        }
        Conversion conversion = service.convert(new GridSheetReader(cells));

        DependencyNode node = service.dependencies(conversion, CellId.parse("A3000")).get(0);
        int depth = 1;
        while (!node.getChildren().isEmpty()) {
            node = node.getChildren().get(0);
            depth++;
        }
        assertEquals(3000, depth);
    }
}
