package nl.bytesoflife.takeoff.material.parser;

/**
 * Malformed formula table text.
 */
public class FormulaFormatException extends RuntimeException {

    private final int line;

    public FormulaFormatException(String message, int line) {
        super(message + " (line " + line + ")");
        this.line = line;
    }

    public FormulaFormatException(String message, int line, Throwable cause) {
        super(message + " (line " + line + ")", cause);
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
