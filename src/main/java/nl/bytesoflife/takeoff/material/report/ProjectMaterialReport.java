package nl.bytesoflife.takeoff.material.report;

import nl.bytesoflife.takeoff.material.MaterialRequirement;
import nl.bytesoflife.takeoff.material.aggregate.MaterialTotal;
import nl.bytesoflife.takeoff.material.model.WasteFactorMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Material requirements of a whole takeoff: per-item results in input order,
 * cross-item totals and the items that were skipped.
 */
public class ProjectMaterialReport {

    private final WasteFactorMode mode;
    private final Double overrideFactor;
    private final List<WorkItemMaterials> items;
    private final List<SkippedWorkItem> skippedItems;
    private final List<MaterialTotal> totals;

    public ProjectMaterialReport(WasteFactorMode mode,
                                 Double overrideFactor,
                                 List<WorkItemMaterials> items,
                                 List<SkippedWorkItem> skippedItems,
                                 List<MaterialTotal> totals) {
        this.mode = mode;
        this.overrideFactor = mode == WasteFactorMode.MANUAL ? overrideFactor : null;
        this.items = List.copyOf(items);
        this.skippedItems = List.copyOf(skippedItems);
        this.totals = List.copyOf(totals);
    }

    public WasteFactorMode getMode() {
        return mode;
    }

    /** Override factor in MANUAL mode, null in AUTOMATIC mode. */
    public Double getOverrideFactor() {
        return overrideFactor;
    }

    public List<WorkItemMaterials> getItems() {
        return items;
    }

    public List<SkippedWorkItem> getSkippedItems() {
        return skippedItems;
    }

    public boolean hasSkippedItems() {
        return !skippedItems.isEmpty();
    }

    public List<MaterialTotal> getTotals() {
        return totals;
    }

    public int getMaterialKindCount() {
        return totals.size();
    }

    public List<MaterialRequirement> getAllRequirements() {
        List<MaterialRequirement> all = new ArrayList<>();
        for (WorkItemMaterials item : items) {
            all.addAll(item.requirements());
        }
        return Collections.unmodifiableList(all);
    }

    /**
     * Requirements grouped by normalized work item category, categories in order of first appearance.
     */
    public Map<String, List<MaterialRequirement>> getRequirementsByCategory() {
        Map<String, List<MaterialRequirement>> byCategory = new LinkedHashMap<>();
        for (WorkItemMaterials item : items) {
            String category = item.workItem().category().trim().toLowerCase(Locale.ROOT);
            byCategory.computeIfAbsent(category, k -> new ArrayList<>()).addAll(item.requirements());
        }
        return Collections.unmodifiableMap(byCategory);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Material Report:\n");
        sb.append("  Waste factor: ").append(mode);
        if (overrideFactor != null) {
            sb.append(" (").append(QuantityFormat.percent(overrideFactor)).append(")");
        }
        sb.append("\n");
        sb.append("  Work items: ").append(items.size())
          .append(" (").append(skippedItems.size()).append(" skipped)\n");

        for (WorkItemMaterials item : items) {
            sb.append("  - ").append(item.workItem().code())
              .append(" ").append(QuantityFormat.quantity(item.workItem().quantity()));
            if (item.workItem().unit() != null) {
                sb.append(" ").append(item.workItem().unit().getSymbol());
            }
            sb.append(" [").append(item.workItem().category()).append("]\n");
            for (MaterialRequirement r : item.requirements()) {
                sb.append("      ").append(r.material()).append(": ")
                  .append(QuantityFormat.quantity(r.adjustedQuantity())).append(" ").append(r.unit())
                  .append(" (base ").append(QuantityFormat.quantity(r.baseQuantity()))
                  .append(", waste ").append(QuantityFormat.percent(r.wasteFactor())).append(")\n");
            }
        }

        if (!totals.isEmpty()) {
            sb.append("\n  Totals:\n");
            for (MaterialTotal t : totals) {
                sb.append("  - ").append(t.material()).append(": ")
                  .append(QuantityFormat.quantity(t.quantity())).append(" ").append(t.unit()).append("\n");
            }
        }

        if (!skippedItems.isEmpty()) {
            sb.append("\n  Skipped:\n");
            for (SkippedWorkItem s : skippedItems) {
                sb.append("  - ").append(s.workItem() != null ? s.workItem().code() : "(missing item)")
                  .append(": ").append(s.message()).append("\n");
            }
        }
        return sb.toString();
    }
}
