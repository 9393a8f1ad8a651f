package nl.bytesoflife.takeoff.material.model;

/**
 * One line of a quantity takeoff, identified by its unit-price code ("poz").
 * Values are not validated here; the calculator rejects items it cannot compute.
 *
 * @param code        unit-price code, e.g. "15.150.1005"
 * @param description free-text description of the work
 * @param category    construction category used to look up material formulas
 * @param quantity    measured quantity in {@code unit}
 * @param unit        unit of the quantity
 */
public record WorkItem(
        String code,
        String description,
        String category,
        double quantity,
        UnitOfMeasure unit
) {

    public WorkItem(String code, String category, double quantity, UnitOfMeasure unit) {
        this(code, "", category, quantity, unit);
    }

    /**
     * Returns a copy with the quantity replaced, the only edit allowed on a takeoff line.
     */
    public WorkItem withQuantity(double newQuantity) {
        return new WorkItem(code, description, category, newQuantity, unit);
    }
}
