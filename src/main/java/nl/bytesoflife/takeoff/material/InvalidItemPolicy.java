package nl.bytesoflife.takeoff.material;

/**
 * What a project calculation does with a work item that fails validation.
 */
public enum InvalidItemPolicy {
    /** Fail the whole calculation on the first invalid item. */
    ABORT,
    /** Record the item as skipped, log it, and continue. */
    SKIP
}
