package nl.bytesoflife.takeoff.material;

import nl.bytesoflife.takeoff.material.aggregate.MaterialAggregator;
import nl.bytesoflife.takeoff.material.model.FormulaTable;
import nl.bytesoflife.takeoff.material.model.WasteFactorMode;
import nl.bytesoflife.takeoff.material.model.WorkItem;
import nl.bytesoflife.takeoff.material.report.ProjectMaterialReport;
import nl.bytesoflife.takeoff.material.report.SkippedWorkItem;
import nl.bytesoflife.takeoff.material.report.WorkItemMaterials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the material requirements of a whole takeoff and totals them per material.
 *
 * <pre>
 * ProjectMaterialReport report = new ProjectMaterialCalculator()
 *     .withFormulaTable(BuiltinFormulaTables.literature())
 *     .withWasteFactorMode(WasteFactorMode.MANUAL)
 *     .withOverrideFactor(0.07)
 *     .withInvalidItemPolicy(InvalidItemPolicy.SKIP)
 *     .calculate(items);
 * </pre>
 */
public class ProjectMaterialCalculator {

    private static final Logger log = LoggerFactory.getLogger(ProjectMaterialCalculator.class);

    private final MaterialRequirementCalculator calculator = new MaterialRequirementCalculator();

    private FormulaTable formulaTable;
    private WasteFactorMode mode = WasteFactorMode.AUTOMATIC;
    private Double overrideFactor;
    private InvalidItemPolicy invalidItemPolicy = InvalidItemPolicy.ABORT;

    public ProjectMaterialCalculator withFormulaTable(FormulaTable formulaTable) {
        this.formulaTable = formulaTable;
        return this;
    }

    public ProjectMaterialCalculator withWasteFactorMode(WasteFactorMode mode) {
        this.mode = mode;
        return this;
    }

    public ProjectMaterialCalculator withOverrideFactor(Double overrideFactor) {
        this.overrideFactor = overrideFactor;
        return this;
    }

    public ProjectMaterialCalculator withInvalidItemPolicy(InvalidItemPolicy policy) {
        this.invalidItemPolicy = policy;
        return this;
    }

    /**
     * Compute every work item and aggregate the results.
     *
     * @throws IllegalStateException  when no formula table is configured
     * @throws InvalidInputException  when the waste factor settings are invalid, or under
     *                                {@link InvalidItemPolicy#ABORT} when any item is invalid
     */
    public ProjectMaterialReport calculate(List<WorkItem> workItems) {
        if (formulaTable == null) {
            throw new IllegalStateException("FormulaTable must be set before calculation");
        }
        // Settings errors apply to every item and are never skipped
        MaterialRequirementCalculator.validateWasteFactor(mode, overrideFactor);

        List<WorkItemMaterials> computed = new ArrayList<>();
        List<SkippedWorkItem> skipped = new ArrayList<>();
        MaterialAggregator aggregator = new MaterialAggregator();

        for (WorkItem item : workItems) {
            List<MaterialRequirement> requirements;
            try {
                requirements = calculator.compute(item, formulaTable, mode, overrideFactor);
            } catch (InvalidInputException e) {
                if (invalidItemPolicy == InvalidItemPolicy.ABORT) {
                    throw e;
                }
                log.warn("Skipping work item {}: {}", item != null ? item.code() : null, e.getMessage());
                skipped.add(new SkippedWorkItem(item, e.getReason(), e.getMessage()));
                continue;
            }
            computed.add(new WorkItemMaterials(item, requirements));
            aggregator.addAll(requirements);
        }

        log.debug("Project calculation: {} items computed, {} skipped", computed.size(), skipped.size());
        return new ProjectMaterialReport(mode, overrideFactor, computed, skipped, aggregator.totals());
    }
}
