package drimble;

// Why a task or record did not end up in the output.
public enum SkipReason {
    ALREADY_VISITED,
    DEPTH_EXCEEDED,
    SEARCH_EXHAUSTED,
    HTTP_STATUS,
    TIMEOUT,
    TRANSPORT,
    NO_KEYWORD,
    PERSIST_FAILED;

    public static SkipReason of(FetchException.Kind kind) {
        return switch (kind) {
            case HTTP_STATUS -> HTTP_STATUS;
            case TIMEOUT -> TIMEOUT;
            case TRANSPORT -> TRANSPORT;
        };
    }
}
