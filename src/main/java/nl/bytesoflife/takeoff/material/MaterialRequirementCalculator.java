package nl.bytesoflife.takeoff.material;

import nl.bytesoflife.takeoff.material.InvalidInputException.Reason;
import nl.bytesoflife.takeoff.material.model.FormulaTable;
import nl.bytesoflife.takeoff.material.model.MaterialFormulaEntry;
import nl.bytesoflife.takeoff.material.model.WasteFactorMode;
import nl.bytesoflife.takeoff.material.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Derives the raw materials a single work item needs from a formula table.
 * Stateless; one instance may be shared between threads.
 *
 * <pre>
 * List&lt;MaterialRequirement&gt; materials = new MaterialRequirementCalculator()
 *     .compute(item, BuiltinFormulaTables.literature(), WasteFactorMode.MANUAL, 0.10);
 * </pre>
 */
public class MaterialRequirementCalculator {

    private static final Logger log = LoggerFactory.getLogger(MaterialRequirementCalculator.class);

    /**
     * Compute the material requirements of one work item.
     *
     * @param workItem       item to compute; quantity must be positive and category non-blank
     * @param formulaTable   formula lookup, keyed by the item's category
     * @param mode           waste factor mode
     * @param overrideFactor factor applied to every material in MANUAL mode, ignored in AUTOMATIC mode
     * @return one requirement per formula entry of the item's category, in table order; empty when the
     *         category has no formulas
     * @throws InvalidInputException when the item or the waste factor settings are invalid
     */
    public List<MaterialRequirement> compute(WorkItem workItem, FormulaTable formulaTable,
                                             WasteFactorMode mode, Double overrideFactor) {
        Objects.requireNonNull(formulaTable, "formulaTable");
        validate(workItem, mode, overrideFactor);

        List<MaterialFormulaEntry> entries = formulaTable.entriesFor(workItem.category());
        if (entries.isEmpty()) {
            log.debug("No formulas for category '{}' of item {}", workItem.category(), workItem.code());
            return List.of();
        }

        List<MaterialRequirement> requirements = new ArrayList<>(entries.size());
        for (MaterialFormulaEntry entry : entries) {
            double baseQuantity = workItem.quantity() * entry.coefficient();
            double factor = mode == WasteFactorMode.MANUAL ? overrideFactor : entry.defaultWasteFactor();
            double adjustedQuantity = baseQuantity * (1 + factor);
            requirements.add(new MaterialRequirement(
                    workItem.code(), entry.material(), entry.unit(),
                    baseQuantity, factor, adjustedQuantity));
        }

        log.debug("Computed {} materials for item {} ({} {}) in {} mode",
                requirements.size(), workItem.code(), workItem.quantity(), workItem.category(), mode);
        return Collections.unmodifiableList(requirements);
    }

    public List<MaterialRequirement> computeAutomatic(WorkItem workItem, FormulaTable formulaTable) {
        return compute(workItem, formulaTable, WasteFactorMode.AUTOMATIC, null);
    }

    public List<MaterialRequirement> computeManual(WorkItem workItem, FormulaTable formulaTable,
                                                   double overrideFactor) {
        return compute(workItem, formulaTable, WasteFactorMode.MANUAL, overrideFactor);
    }

    /**
     * Validates the waste factor settings on their own. A failure here applies to every item.
     */
    static void validateWasteFactor(WasteFactorMode mode, Double overrideFactor) {
        if (mode == null) {
            throw new InvalidInputException(Reason.MISSING_MODE);
        }
        if (mode != WasteFactorMode.MANUAL) return;

        if (overrideFactor == null) {
            throw new InvalidInputException(Reason.MISSING_OVERRIDE_FACTOR);
        }
        if (overrideFactor.isNaN() || overrideFactor.isInfinite()) {
            throw new InvalidInputException(Reason.INVALID_OVERRIDE_FACTOR, String.valueOf(overrideFactor));
        }
        if (overrideFactor < 0) {
            throw new InvalidInputException(Reason.NEGATIVE_OVERRIDE_FACTOR, String.valueOf(overrideFactor));
        }
    }

    private static void validate(WorkItem workItem, WasteFactorMode mode, Double overrideFactor) {
        if (workItem == null) {
            throw new InvalidInputException(Reason.MISSING_WORK_ITEM);
        }
        // !(q > 0) also rejects NaN
        if (!(workItem.quantity() > 0) || Double.isInfinite(workItem.quantity())) {
            throw new InvalidInputException(Reason.NON_POSITIVE_QUANTITY,
                    workItem.code() + " has quantity " + workItem.quantity());
        }
        if (workItem.category() == null || workItem.category().isBlank()) {
            throw new InvalidInputException(Reason.MISSING_CATEGORY, workItem.code());
        }
        validateWasteFactor(mode, overrideFactor);
    }
}
