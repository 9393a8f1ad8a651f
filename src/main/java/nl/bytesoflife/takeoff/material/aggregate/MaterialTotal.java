package nl.bytesoflife.takeoff.material.aggregate;

/**
 * Summed adjusted quantity of one material across work items.
 *
 * @param material          material name
 * @param unit              material unit
 * @param quantity          sum of adjusted quantities
 * @param requirementCount  number of requirements folded into this total
 */
public record MaterialTotal(
        String material,
        String unit,
        double quantity,
        int requirementCount
) {

    public MaterialTotal withQuantity(double newQuantity, String newUnit) {
        return new MaterialTotal(material, newUnit, newQuantity, requirementCount);
    }
}
