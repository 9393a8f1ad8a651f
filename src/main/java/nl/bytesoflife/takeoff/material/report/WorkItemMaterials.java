package nl.bytesoflife.takeoff.material.report;

import nl.bytesoflife.takeoff.material.MaterialRequirement;
import nl.bytesoflife.takeoff.material.model.WorkItem;

import java.util.List;

/**
 * Materials computed for one work item, in formula table order.
 */
public record WorkItemMaterials(WorkItem workItem, List<MaterialRequirement> requirements) {

    public WorkItemMaterials {
        requirements = List.copyOf(requirements);
    }
}
