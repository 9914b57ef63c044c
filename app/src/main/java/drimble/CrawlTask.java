package drimble;

// One unit of work in the frontier. Immutable, consumed exactly once.
public record CrawlTask(String url, int depth, Origin origin) {

    public enum Origin {
        // search-result page enumerated from the pagination rule
        SEED,
        // article link found on a search page or inside another article
        DISCOVERED
    }

    public CrawlTask {
        if (url == null || url.isBlank()) throw new IllegalArgumentException("url is required");
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
        if (origin == null) throw new IllegalArgumentException("origin is required");
    }

    public static CrawlTask seed(String url) {
        return new CrawlTask(url, 0, Origin.SEED);
    }

    public CrawlTask child(String childUrl) {
        return new CrawlTask(childUrl, depth + 1, Origin.DISCOVERED);
    }
}
