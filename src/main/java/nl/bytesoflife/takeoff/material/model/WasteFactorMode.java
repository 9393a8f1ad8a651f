package nl.bytesoflife.takeoff.material.model;

import java.util.Locale;

public enum WasteFactorMode {
    /** Each material uses its literature default from the formula table. */
    AUTOMATIC,
    /** One override factor replaces every default. */
    MANUAL;

    public static WasteFactorMode fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Waste factor mode name must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "automatic", "auto" -> AUTOMATIC;
            case "manual" -> MANUAL;
            default -> throw new IllegalArgumentException("Unknown waste factor mode: " + name);
        };
    }
}
