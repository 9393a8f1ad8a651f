package nl.bytesoflife.takeoff.material.parser;

import nl.bytesoflife.takeoff.material.model.FormulaTable;
import nl.bytesoflife.takeoff.material.model.MaterialFormulaEntry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses formula table files:
 * <pre>
 * (version 1)
 * (category "concrete"
 *     (material "cement" (coefficient 300) (waste 3%) (unit kg)))
 * (category "labor-only")
 * </pre>
 * A waste value ending in {@code %} is a percentage, otherwise a fraction.
 */
public class FormulaTableParser {

    static final double DEFAULT_WASTE_FACTOR = 0.05;

    public FormulaTable parse(String content) {
        List<SNode> nodes;
        try {
            nodes = new SExpressionParser().parse(content);
        } catch (SExpressionParser.ParseException e) {
            throw new FormulaFormatException("Invalid formula syntax: " + e.getMessage(), e.getLine(), e);
        }
        return buildTable(nodes);
    }

    public FormulaTable parse(InputStream is) throws IOException {
        return parse(new String(is.readAllBytes(), StandardCharsets.UTF_8));
    }

    private FormulaTable buildTable(List<SNode> nodes) {
        FormulaTable.Builder builder = FormulaTable.builder();

        for (SNode node : nodes) {
            if (!(node instanceof SNode.SList list)) continue;
            switch (list.tag()) {
                case "version" -> builder.version(parseVersion(list.atom(1), list.line()));
                case "category" -> parseCategory(list, builder);
                default -> throw new FormulaFormatException("Unknown top-level element '" + list.tag() + "'",
                        list.line());
            }
        }

        return builder.build();
    }

    private void parseCategory(SNode.SList list, FormulaTable.Builder builder) {
        String category = list.atom(1);
        if (category == null || category.isBlank()) {
            throw new FormulaFormatException("Category without a name", list.line());
        }
        builder.category(category);

        for (SNode.SList child : list.lists(2)) {
            if (!"material".equals(child.tag())) {
                throw new FormulaFormatException("Unexpected '" + child.tag() + "' in category " + category,
                        child.line());
            }
            builder.add(parseMaterial(category, child));
        }
    }

    private MaterialFormulaEntry parseMaterial(String category, SNode.SList list) {
        String material = list.atom(1);
        if (material == null || material.isBlank()) {
            throw new FormulaFormatException("Material without a name in category " + category, list.line());
        }

        Double coefficient = null;
        double waste = DEFAULT_WASTE_FACTOR;
        String unit = null;
        Set<String> seen = new HashSet<>();

        for (SNode.SList attribute : list.lists(2)) {
            String value = attribute.atom(1);
            if (!seen.add(attribute.tag())) {
                throw new FormulaFormatException(
                        "Duplicate '" + attribute.tag() + "' for material " + material, attribute.line());
            }
            switch (attribute.tag()) {
                case "coefficient" -> coefficient = parseNumber(value, "coefficient", attribute.line());
                case "waste" -> waste = parseFactor(value, attribute.line());
                case "unit" -> unit = value;
                default -> throw new FormulaFormatException(
                        "Unknown material attribute '" + attribute.tag() + "' for " + material, attribute.line());
            }
        }

        if (coefficient == null) {
            throw new FormulaFormatException("Material " + material + " has no coefficient", list.line());
        }
        if (unit == null || unit.isBlank()) {
            throw new FormulaFormatException("Material " + material + " has no unit", list.line());
        }

        try {
            return new MaterialFormulaEntry(category, material, coefficient, waste, unit);
        } catch (IllegalArgumentException e) {
            throw new FormulaFormatException(e.getMessage(), list.line(), e);
        }
    }

    static double parseFactor(String value, int line) {
        if (value != null && value.endsWith("%")) {
            return parseNumber(value.substring(0, value.length() - 1), "waste", line) / 100.0;
        }
        return parseNumber(value, "waste", line);
    }

    private static int parseVersion(String value, int line) {
        if (value == null) {
            throw new FormulaFormatException("Missing value for version", line);
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new FormulaFormatException("Version must be a whole number: '" + value + "'", line, e);
        }
    }

    private static double parseNumber(String value, String name, int line) {
        if (value == null) {
            throw new FormulaFormatException("Missing value for " + name, line);
        }
        double number;
        try {
            number = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new FormulaFormatException("Invalid number for " + name + ": '" + value + "'", line, e);
        }
        if (!Double.isFinite(number)) {
            throw new FormulaFormatException("Number for " + name + " must be finite: '" + value + "'", line);
        }
        return number;
    }
}
