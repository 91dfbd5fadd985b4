package quarry.engine.util;

/**
 * Error string helpers.
 */
public final class Errors {

    public static final int MAX_ERROR_LENGTH = 2000;

    private Errors() {
    }

    /**
     * Non-empty error text of at most {@link #MAX_ERROR_LENGTH} characters.
     */
    public static String truncate(String message) {
        if (message == null || message.isBlank()) {
            return "unknown error";
        }
        if (message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }

    /** Message of the throwable, falling back to its class name */
    public static String describe(Throwable t) {
        String msg = t.getMessage();
        return truncate(msg != null && !msg.isBlank() ? msg : t.getClass().getSimpleName());
    }
}
