package drimble;

// Fatal means the output location itself is unusable and the run must stop.
public class PersistException extends Exception {

    private final boolean fatal;

    public PersistException(String message, Throwable cause, boolean fatal) {
        super(message, cause);
        this.fatal = fatal;
    }

    public static PersistException article(String message, Throwable cause) {
        return new PersistException(message, cause, false);
    }

    public static PersistException fatal(String message, Throwable cause) {
        return new PersistException(message, cause, true);
    }

    public boolean isFatal() {
        return fatal;
    }
}
