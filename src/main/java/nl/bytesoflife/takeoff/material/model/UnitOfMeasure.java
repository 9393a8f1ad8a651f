package nl.bytesoflife.takeoff.material.model;

import java.util.Locale;
import java.util.Map;

public enum UnitOfMeasure {
    LENGTH("m"),
    AREA("m²"),
    VOLUME("m³"),
    MASS("kg"),
    COUNT("adet"),
    LIQUID_VOLUME("lt");

    private static final Map<String, UnitOfMeasure> SYMBOLS = Map.ofEntries(
            Map.entry("m", LENGTH),
            Map.entry("mt", LENGTH),
            Map.entry("m²", AREA),
            Map.entry("m2", AREA),
            Map.entry("m³", VOLUME),
            Map.entry("m3", VOLUME),
            Map.entry("kg", MASS),
            Map.entry("adet", COUNT),
            Map.entry("pcs", COUNT),
            Map.entry("lt", LIQUID_VOLUME),
            Map.entry("l", LIQUID_VOLUME)
    );

    private final String symbol;

    UnitOfMeasure(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public static UnitOfMeasure fromSymbol(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Unit symbol must not be null");
        }
        UnitOfMeasure unit = SYMBOLS.get(symbol.trim().toLowerCase(Locale.ROOT));
        if (unit == null) {
            throw new IllegalArgumentException("Unknown unit of measure: " + symbol);
        }
        return unit;
    }
}
