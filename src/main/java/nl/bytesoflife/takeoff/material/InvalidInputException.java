package nl.bytesoflife.takeoff.material;

/**
 * Thrown when a material computation is requested with input it cannot accept.
 * The {@link Reason} lets a UI show a specific message instead of a generic failure.
 */
public class InvalidInputException extends RuntimeException {

    public enum Reason {
        MISSING_WORK_ITEM("work item is required"),
        NON_POSITIVE_QUANTITY("quantity must be positive"),
        MISSING_CATEGORY("work item category is required"),
        MISSING_MODE("waste factor mode is required"),
        MISSING_OVERRIDE_FACTOR("override waste factor required and must be non-negative"),
        NEGATIVE_OVERRIDE_FACTOR("override waste factor required and must be non-negative"),
        INVALID_OVERRIDE_FACTOR("override waste factor must be a finite number");

        private final String userMessage;

        Reason(String userMessage) {
            this.userMessage = userMessage;
        }

        public String getUserMessage() {
            return userMessage;
        }
    }

    private final Reason reason;

    public InvalidInputException(Reason reason, String detail) {
        super(detail == null ? reason.getUserMessage() : reason.getUserMessage() + ": " + detail);
        this.reason = reason;
    }

    public InvalidInputException(Reason reason) {
        this(reason, null);
    }

    public Reason getReason() {
        return reason;
    }
}
