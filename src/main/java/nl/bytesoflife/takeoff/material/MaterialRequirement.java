package nl.bytesoflife.takeoff.material;

import java.util.Locale;

/**
 * Material needed for one work item and one formula entry. Values are unrounded.
 *
 * @param workItemCode       unit-price code of the work item
 * @param material           material name
 * @param unit               material unit
 * @param baseQuantity       work quantity times the formula coefficient
 * @param wasteFactor        waste factor that was applied
 * @param adjustedQuantity   base quantity including waste
 */
public record MaterialRequirement(
        String workItemCode,
        String material,
        String unit,
        double baseQuantity,
        double wasteFactor,
        double adjustedQuantity
) {

    @Override
    public String toString() {
        return String.format(Locale.US, "%s: %s %.4f %s (base %.4f, waste %.2f%%)",
                workItemCode, material, adjustedQuantity, unit, baseQuantity, wasteFactor * 100);
    }
}
