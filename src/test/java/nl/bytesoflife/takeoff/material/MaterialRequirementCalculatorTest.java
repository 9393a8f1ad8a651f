package nl.bytesoflife.takeoff.material;

import nl.bytesoflife.takeoff.material.InvalidInputException.Reason;
import nl.bytesoflife.takeoff.material.model.FormulaTable;
import nl.bytesoflife.takeoff.material.model.UnitOfMeasure;
import nl.bytesoflife.takeoff.material.model.WasteFactorMode;
import nl.bytesoflife.takeoff.material.model.WorkItem;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class MaterialRequirementCalculatorTest {

    private static final double EPS = 1e-9;

    private final MaterialRequirementCalculator calculator = new MaterialRequirementCalculator();

    private static FormulaTable testTable() {
        return FormulaTable.builder()
                .add("concrete", "cement", 300, 0.03, "kg")
                .add("masonry", "hollow brick", 60, 0.05, "adet")
                .add("masonry", "cement", 8, 0.03, "kg")
                .add("masonry", "sand", 0.03, 0.05, "m³")
                .category("labor-only")
                .build();
    }

    private static WorkItem concrete(double quantity) {
        return new WorkItem("15.150.1005", "concrete", quantity, UnitOfMeasure.VOLUME);
    }

    @Test
    void automaticModeUsesDefaultFactor() {
        List<MaterialRequirement> result = calculator.computeAutomatic(concrete(10), testTable());

        assertEquals(1, result.size());
        MaterialRequirement cement = result.get(0);
        assertEquals("cement", cement.material());
        assertEquals("kg", cement.unit());
        assertEquals("15.150.1005", cement.workItemCode());
        assertEquals(3000, cement.baseQuantity(), EPS);
        assertEquals(0.03, cement.wasteFactor(), EPS);
        assertEquals(3090, cement.adjustedQuantity(), EPS);
    }

    @Test
    void manualModeOverridesDefaultFactor() {
        List<MaterialRequirement> result = calculator.compute(
                concrete(10), testTable(), WasteFactorMode.MANUAL, 0.10);

        assertEquals(1, result.size());
        assertEquals(3000, result.get(0).baseQuantity(), EPS);
        assertEquals(0.10, result.get(0).wasteFactor(), EPS);
        assertEquals(3300, result.get(0).adjustedQuantity(), EPS);
    }

    @Test
    void manualZeroFactorAppliesNoWaste() {
        List<MaterialRequirement> result = calculator.computeManual(concrete(2.5), testTable(), 0.0);
        assertEquals(750, result.get(0).adjustedQuantity(), EPS);
        assertEquals(result.get(0).baseQuantity(), result.get(0).adjustedQuantity());
    }

    @Test
    void automaticModeIgnoresOverrideFactor() {
        List<MaterialRequirement> result = calculator.compute(
                concrete(10), testTable(), WasteFactorMode.AUTOMATIC, -5.0);
        assertEquals(3090, result.get(0).adjustedQuantity(), EPS);
    }

    @Test
    void outputFollowsFormulaTableOrder() {
        WorkItem wall = new WorkItem("19.055.1102", "masonry", 100, UnitOfMeasure.AREA);
        List<MaterialRequirement> result = calculator.computeAutomatic(wall, testTable());

        assertEquals(List.of("hollow brick", "cement", "sand"),
                result.stream().map(MaterialRequirement::material).toList());
        assertEquals(6300, result.get(0).adjustedQuantity(), EPS);
        assertEquals(824, result.get(1).adjustedQuantity(), EPS);
        assertEquals(3.15, result.get(2).adjustedQuantity(), EPS);
    }

    @Test
    void manualFactorAppliesUniformlyToEveryMaterial() {
        WorkItem wall = new WorkItem("19.055.1102", "masonry", 40, UnitOfMeasure.AREA);
        List<MaterialRequirement> result = calculator.computeManual(wall, testTable(), 0.2);

        for (MaterialRequirement r : result) {
            assertEquals(0.2, r.wasteFactor(), EPS);
            assertEquals(r.baseQuantity() * 1.2, r.adjustedQuantity(), EPS);
        }
    }

    @Test
    void categoryWithoutFormulasYieldsEmptyResult() {
        WorkItem labor = new WorkItem("L-01", "labor-only", 12, UnitOfMeasure.COUNT);
        assertTrue(calculator.computeAutomatic(labor, testTable()).isEmpty());
        assertTrue(calculator.computeManual(labor, testTable(), 0.1).isEmpty());
    }

    @Test
    void unknownCategoryYieldsEmptyResult() {
        WorkItem item = new WorkItem("X-01", "demolition", 3, UnitOfMeasure.VOLUME);
        assertTrue(calculator.computeAutomatic(item, testTable()).isEmpty());
    }

    @Test
    void categoryLookupIgnoresCaseAndSurroundingBlanks() {
        WorkItem item = new WorkItem("15.150.1005", "  Concrete ", 1, UnitOfMeasure.VOLUME);
        assertEquals(1, calculator.computeAutomatic(item, testTable()).size());
    }

    @Test
    void identicalInputsGiveIdenticalOutput() {
        WorkItem wall = new WorkItem("19.055.1102", "masonry", 17.35, UnitOfMeasure.AREA);
        FormulaTable table = testTable();

        assertEquals(calculator.computeManual(wall, table, 0.07), calculator.computeManual(wall, table, 0.07));
        assertEquals(calculator.computeAutomatic(wall, table), calculator.computeAutomatic(wall, table));
    }

    @Test
    void resultIsUnmodifiable() {
        List<MaterialRequirement> result = calculator.computeAutomatic(concrete(1), testTable());
        assertThrows(UnsupportedOperationException.class, () -> result.add(result.get(0)));
    }

    @Test
    void sharedCalculatorIsSafeAcrossThreads() throws Exception {
        FormulaTable table = testTable();
        WorkItem wall = new WorkItem("19.055.1102", "masonry", 250, UnitOfMeasure.AREA);
        List<MaterialRequirement> expected = calculator.computeAutomatic(wall, table);

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<MaterialRequirement>>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> calculator.computeAutomatic(wall, table)));
            }
            for (Future<List<MaterialRequirement>> f : futures) {
                assertEquals(expected, f.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    static Stream<Arguments> invalidInputs() {
        return Stream.of(
                Arguments.of(concrete(0), WasteFactorMode.AUTOMATIC, null, Reason.NON_POSITIVE_QUANTITY),
                Arguments.of(concrete(0), WasteFactorMode.MANUAL, 0.1, Reason.NON_POSITIVE_QUANTITY),
                Arguments.of(concrete(-4), WasteFactorMode.AUTOMATIC, null, Reason.NON_POSITIVE_QUANTITY),
                Arguments.of(concrete(Double.NaN), WasteFactorMode.AUTOMATIC, null, Reason.NON_POSITIVE_QUANTITY),
                Arguments.of(concrete(Double.POSITIVE_INFINITY), WasteFactorMode.AUTOMATIC, null,
                        Reason.NON_POSITIVE_QUANTITY),
                Arguments.of(new WorkItem("A", null, 1, UnitOfMeasure.AREA), WasteFactorMode.AUTOMATIC, null,
                        Reason.MISSING_CATEGORY),
                Arguments.of(new WorkItem("A", "  ", 1, UnitOfMeasure.AREA), WasteFactorMode.AUTOMATIC, null,
                        Reason.MISSING_CATEGORY),
                Arguments.of(null, WasteFactorMode.AUTOMATIC, null, Reason.MISSING_WORK_ITEM),
                Arguments.of(concrete(1), null, null, Reason.MISSING_MODE),
                Arguments.of(concrete(1), WasteFactorMode.MANUAL, null, Reason.MISSING_OVERRIDE_FACTOR),
                Arguments.of(concrete(1), WasteFactorMode.MANUAL, -0.05, Reason.NEGATIVE_OVERRIDE_FACTOR),
                Arguments.of(concrete(1), WasteFactorMode.MANUAL, Double.NaN, Reason.INVALID_OVERRIDE_FACTOR),
                Arguments.of(concrete(1), WasteFactorMode.MANUAL, Double.POSITIVE_INFINITY,
                        Reason.INVALID_OVERRIDE_FACTOR),
                Arguments.of(concrete(1), WasteFactorMode.MANUAL, Double.NEGATIVE_INFINITY,
                        Reason.INVALID_OVERRIDE_FACTOR)
        );
    }

    @ParameterizedTest
    @MethodSource("invalidInputs")
    void invalidInputIsRejected(WorkItem item, WasteFactorMode mode, Double factor, Reason expected) {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> calculator.compute(item, testTable(), mode, factor));
        assertEquals(expected, e.getReason());
        assertTrue(e.getMessage().startsWith(expected.getUserMessage()));
    }

    @Test
    void invalidQuantityFailsEvenForCategoryWithoutFormulas() {
        WorkItem labor = new WorkItem("L-01", "labor-only", 0, UnitOfMeasure.COUNT);
        assertThrows(InvalidInputException.class, () -> calculator.computeAutomatic(labor, testTable()));
    }

    @Test
    void negativeOverrideMessageIsActionable() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> calculator.computeManual(concrete(10), testTable(), -0.05));
        assertTrue(e.getMessage().contains("override waste factor required and must be non-negative"));
    }

    @Test
    void missingFormulaTableIsAProgrammingError() {
        assertThrows(NullPointerException.class, () -> calculator.computeAutomatic(concrete(1), null));
    }
}
