package nl.bytesoflife.takeoff.material.report;

import nl.bytesoflife.takeoff.material.InvalidInputException;
import nl.bytesoflife.takeoff.material.model.WorkItem;

/**
 * A work item left out of a project calculation.
 *
 * @param workItem the rejected item
 * @param reason   why it was rejected
 * @param message  detail message of the rejection
 */
public record SkippedWorkItem(
        WorkItem workItem,
        InvalidInputException.Reason reason,
        String message
) {
}
