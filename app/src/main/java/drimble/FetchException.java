package drimble;

// A single page could not be retrieved. The caller drops the task.
public class FetchException extends Exception {

    public enum Kind {
        HTTP_STATUS,
        TIMEOUT,
        TRANSPORT
    }

    private final String url;
    private final Kind kind;
    private final int statusCode;

    public FetchException(String url, Kind kind, int statusCode, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static FetchException httpStatus(String url, int statusCode) {
        return new FetchException(url, Kind.HTTP_STATUS, statusCode,
                "HTTP status " + statusCode + " from " + url, null);
    }

    public static FetchException timeout(String url, Throwable cause) {
        return new FetchException(url, Kind.TIMEOUT, 0, "Request timed out while fetching " + url, cause);
    }

    public static FetchException transport(String url, Throwable cause) {
        String detail = cause == null || cause.getMessage() == null
                ? (cause == null ? "unknown error" : cause.getClass().getSimpleName())
                : cause.getMessage();
        return new FetchException(url, Kind.TRANSPORT, 0, "Fetch failure for " + url + ": " + detail, cause);
    }

    public String url() {
        return url;
    }

    public Kind kind() {
        return kind;
    }

    // 0 unless kind is HTTP_STATUS
    public int statusCode() {
        return statusCode;
    }
}
