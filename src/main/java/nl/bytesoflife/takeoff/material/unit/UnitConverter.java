package nl.bytesoflife.takeoff.material.unit;

import nl.bytesoflife.takeoff.material.aggregate.MaterialTotal;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts material quantities between units. Material-specific conversions (for example cement
 * from kg to bags) take precedence over the standard, material-independent ones.
 */
public class UnitConverter {

    private record Conversion(String from, String to) {
    }

    private record MaterialConversion(String material, String from, String to) {
    }

    private static final Map<Conversion, Double> STANDARD = Map.ofEntries(
            // mass
            Map.entry(new Conversion("kg", "ton"), 0.001),
            Map.entry(new Conversion("ton", "kg"), 1000.0),
            Map.entry(new Conversion("kg", "g"), 1000.0),
            Map.entry(new Conversion("g", "kg"), 0.001),
            // volume
            Map.entry(new Conversion("m³", "lt"), 1000.0),
            Map.entry(new Conversion("lt", "m³"), 0.001),
            Map.entry(new Conversion("m³", "dm³"), 1000.0),
            Map.entry(new Conversion("dm³", "m³"), 0.001),
            // area
            Map.entry(new Conversion("m²", "cm²"), 10000.0),
            Map.entry(new Conversion("cm²", "m²"), 0.0001),
            // length
            Map.entry(new Conversion("m", "cm"), 100.0),
            Map.entry(new Conversion("cm", "m"), 0.01),
            Map.entry(new Conversion("m", "mm"), 1000.0),
            Map.entry(new Conversion("mm", "m"), 0.001)
    );

    private final Map<MaterialConversion, Double> materialConversions = new HashMap<>();

    /**
     * Registers a conversion that applies to one material only, e.g. cement kg to 50 kg bags (0.02).
     */
    public UnitConverter withConversion(String material, String from, String to, double factor) {
        if (!Double.isFinite(factor) || factor <= 0) {
            throw new IllegalArgumentException("Conversion factor must be positive: " + factor);
        }
        materialConversions.put(new MaterialConversion(material, from, to), factor);
        return this;
    }

    /**
     * Converts a value between units.
     *
     * @param material material name for material-specific conversions, or null
     * @return the converted value, or null when no conversion between the units is known
     */
    public Double convert(double value, String from, String to, String material) {
        if (from.equals(to)) {
            return value;
        }

        Double factor = material != null ? materialConversions.get(new MaterialConversion(material, from, to)) : null;
        if (factor == null) {
            factor = STANDARD.get(new Conversion(from, to));
        }
        if (factor == null) {
            return null;
        }
        if (!Double.isFinite(value)) {
            return value * factor;
        }
        return BigDecimal.valueOf(value).multiply(BigDecimal.valueOf(factor)).doubleValue();
    }

    public Double convert(double value, String from, String to) {
        return convert(value, from, to, null);
    }

    /**
     * Converts totals to {@code targetUnit} where possible; totals without a known conversion are kept as they are.
     */
    public List<MaterialTotal> convertTotals(List<MaterialTotal> totals, String targetUnit) {
        List<MaterialTotal> converted = new ArrayList<>(totals.size());
        for (MaterialTotal total : totals) {
            Double value = convert(total.quantity(), total.unit(), targetUnit, total.material());
            converted.add(value == null ? total : total.withQuantity(value, targetUnit));
        }
        return converted;
    }
}
