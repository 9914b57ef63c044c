package drimble;

// One dropped URL for failures.csv: where in the BFS it was, and why it failed.
public record FailureRecord(int depth, String url, SkipReason reason, String message) {

    public static FailureRecord fetch(CrawlTask task, FetchException e) {
        return new FailureRecord(task.depth(), task.url(), SkipReason.of(e.kind()), e.getMessage());
    }

    public static FailureRecord persist(CrawlTask task, PersistException e) {
        return new FailureRecord(task.depth(), task.url(), SkipReason.PERSIST_FAILED, e.getMessage());
    }
}
