package nl.bytesoflife.takeoff.material.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup from construction category to the ordered material formulas of that category.
 * Category keys are matched case-insensitively and ignoring surrounding whitespace.
 */
public final class FormulaTable {

    private final int version;
    private final Map<String, List<MaterialFormulaEntry>> entriesByCategory;

    private FormulaTable(int version, Map<String, List<MaterialFormulaEntry>> entriesByCategory) {
        this.version = version;
        this.entriesByCategory = entriesByCategory;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static FormulaTable empty() {
        return builder().build();
    }

    public int getVersion() {
        return version;
    }

    /**
     * Entries for a category in table order; empty when the category is unknown or declared without materials.
     */
    public List<MaterialFormulaEntry> entriesFor(String category) {
        if (category == null) return List.of();
        return entriesByCategory.getOrDefault(normalize(category), List.of());
    }

    public boolean hasCategory(String category) {
        return category != null && entriesByCategory.containsKey(normalize(category));
    }

    /** Normalized category keys in declaration order. */
    public Set<String> getCategories() {
        return entriesByCategory.keySet();
    }

    public int size() {
        return entriesByCategory.values().stream().mapToInt(List::size).sum();
    }

    static String normalize(String category) {
        return category.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "FormulaTable{version=" + version + ", categories=" + entriesByCategory.size()
                + ", entries=" + size() + "}";
    }

    public static final class Builder {

        private int version = 1;
        private final Map<String, List<MaterialFormulaEntry>> entries = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder version(int version) {
            this.version = version;
            return this;
        }

        /**
         * Declares a category, possibly without materials (labor-only work).
         */
        public Builder category(String category) {
            if (category == null || category.isBlank()) {
                throw new IllegalArgumentException("Category name must not be blank");
            }
            entries.computeIfAbsent(normalize(category), k -> new ArrayList<>());
            return this;
        }

        public Builder add(MaterialFormulaEntry entry) {
            entries.computeIfAbsent(normalize(entry.category()), k -> new ArrayList<>()).add(entry);
            return this;
        }

        public Builder add(String category, String material, double coefficient,
                           double defaultWasteFactor, String unit) {
            return add(new MaterialFormulaEntry(category, material, coefficient, defaultWasteFactor, unit));
        }

        public FormulaTable build() {
            Map<String, List<MaterialFormulaEntry>> copy = new LinkedHashMap<>();
            for (Map.Entry<String, List<MaterialFormulaEntry>> e : entries.entrySet()) {
                copy.put(e.getKey(), List.copyOf(e.getValue()));
            }
            return new FormulaTable(version, Collections.unmodifiableMap(copy));
        }
    }
}
