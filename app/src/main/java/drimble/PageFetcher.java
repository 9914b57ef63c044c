package drimble;

import org.jsoup.Connection;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

// jsoup-backed fetcher. One GET per call, no retries; the politeness delay is the crawler's job.
public class PageFetcher implements Fetcher {

    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final String userAgent;
    private final Duration timeout;

    public PageFetcher(String userAgent, Duration timeout) {
        this.userAgent = userAgent;
        this.timeout = timeout;
    }

    public static PageFetcher from(ScraperConfig config) {
        return new PageFetcher(config.userAgent(), config.timeout());
    }

    @Override
    public String fetch(String url) throws FetchException {
        log.debug("GET {}", url);
        try {
            Connection.Response response = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", "nl-NL,nl;q=0.9,en;q=0.8")
                    .timeout((int) timeout.toMillis())
                    .followRedirects(true)
                    .execute();

            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw FetchException.httpStatus(url, status);
            }
            return normalize(response.body());

        } catch (HttpStatusException e) {
            throw FetchException.httpStatus(url, e.getStatusCode());
        } catch (SocketTimeoutException e) {
            throw FetchException.timeout(url, e);
        } catch (IOException | IllegalArgumentException e) {
            // IllegalArgumentException: jsoup rejects malformed URLs this way
            throw FetchException.transport(url, e);
        }
    }

    // Strip a leading BOM and unify line endings.
    static String normalize(String body) {
        if (body == null) return "";
        String text = body;
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
