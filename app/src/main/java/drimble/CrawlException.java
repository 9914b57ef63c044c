package drimble;

// Run-level failure: the crawl could not start or had to stop early.
public class CrawlException extends Exception {

    public CrawlException(String message, Throwable cause) {
        super(message, cause);
    }
}
