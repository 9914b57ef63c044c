package drimble;

@FunctionalInterface
public interface Fetcher {

    // Raw HTML of the page, or FetchException on non-2xx, timeout or transport error.
    String fetch(String url) throws FetchException;
}
