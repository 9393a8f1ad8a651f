package nl.bytesoflife.takeoff.material.model;

/**
 * Amount of one material needed per unit of work in a category.
 *
 * @param category           category this entry belongs to
 * @param material           material name
 * @param coefficient        material quantity per one unit of the work item
 * @param defaultWasteFactor literature waste factor as a fraction, 0.05 = 5%
 * @param unit               unit of the material quantity
 */
public record MaterialFormulaEntry(
        String category,
        String material,
        double coefficient,
        double defaultWasteFactor,
        String unit
) {
    public MaterialFormulaEntry {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("Formula category must not be blank");
        }
        if (material == null || material.isBlank()) {
            throw new IllegalArgumentException("Material name must not be blank");
        }
        if (unit == null || unit.isBlank()) {
            throw new IllegalArgumentException("Material unit must not be blank for " + material);
        }
        if (!Double.isFinite(coefficient) || coefficient < 0) {
            throw new IllegalArgumentException("Coefficient must be >= 0 for " + material + ": " + coefficient);
        }
        if (!Double.isFinite(defaultWasteFactor) || defaultWasteFactor < 0) {
            throw new IllegalArgumentException(
                    "Default waste factor must be >= 0 for " + material + ": " + defaultWasteFactor);
        }
    }
}
