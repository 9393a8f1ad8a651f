package nl.bytesoflife.takeoff.material.aggregate;

import nl.bytesoflife.takeoff.material.MaterialRequirement;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sums adjusted quantities per (material, unit). Results do not depend on the order in which
 * requirements were added, so partial aggregators built on different threads can be merged.
 * Not thread-safe itself.
 */
public class MaterialAggregator {

    private static final Comparator<MaterialTotal> BY_NAME_THEN_UNIT =
            Comparator.comparing(MaterialTotal::material).thenComparing(MaterialTotal::unit);

    private record Key(String material, String unit) {
    }

    private static final class Sum {
        double quantity;
        int count;
    }

    private final Map<Key, Sum> sums = new HashMap<>();

    public static List<MaterialTotal> aggregate(Collection<MaterialRequirement> requirements) {
        return new MaterialAggregator().addAll(requirements).totals();
    }

    public MaterialAggregator add(MaterialRequirement requirement) {
        Sum sum = sums.computeIfAbsent(new Key(requirement.material(), requirement.unit()), k -> new Sum());
        sum.quantity += requirement.adjustedQuantity();
        sum.count++;
        return this;
    }

    public MaterialAggregator addAll(Collection<MaterialRequirement> requirements) {
        for (MaterialRequirement requirement : requirements) {
            add(requirement);
        }
        return this;
    }

    /**
     * Folds another aggregator into this one. {@code other} is left unchanged.
     */
    public MaterialAggregator merge(MaterialAggregator other) {
        for (Map.Entry<Key, Sum> e : other.sums.entrySet()) {
            Sum sum = sums.computeIfAbsent(e.getKey(), k -> new Sum());
            sum.quantity += e.getValue().quantity;
            sum.count += e.getValue().count;
        }
        return this;
    }

    /** Totals sorted by material name, then unit. */
    public List<MaterialTotal> totals() {
        return sums.entrySet().stream()
                .map(e -> new MaterialTotal(e.getKey().material(), e.getKey().unit(),
                        e.getValue().quantity, e.getValue().count))
                .sorted(BY_NAME_THEN_UNIT)
                .toList();
    }

    public boolean isEmpty() {
        return sums.isEmpty();
    }
}
