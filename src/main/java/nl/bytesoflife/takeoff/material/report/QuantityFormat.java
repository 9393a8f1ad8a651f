package nl.bytesoflife.takeoff.material.report;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Display rounding for report output. Computations keep full precision; only rendering rounds.
 */
public final class QuantityFormat {

    public static final int DEFAULT_SCALE = 2;

    private QuantityFormat() {
    }

    /**
     * @throws IllegalArgumentException when {@code value} is NaN or infinite
     */
    public static BigDecimal round(double value, int scale) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot round non-finite quantity: " + value);
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP);
    }

    public static BigDecimal round(double value) {
        return round(value, DEFAULT_SCALE);
    }

    /** Rounded quantity; non-finite values are rendered as they are. */
    public static String quantity(double value) {
        if (!Double.isFinite(value)) return String.valueOf(value);
        return round(value).toPlainString();
    }

    /** Fraction rendered as a percentage, 0.035 -> "3.50%". */
    public static String percent(double fraction) {
        if (!Double.isFinite(fraction)) return fraction + "%";
        return round(fraction * 100).toPlainString() + "%";
    }
}
