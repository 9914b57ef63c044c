package drimble;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Immutable settings for one scraper run. */
public record ScraperConfig(
        String keyword,
        String baseUrl,
        String searchPath,
        int maxPages,
        boolean followLinks,
        int maxLinkDepth,
        int maxLinksPerArticle,
        int maxTotalArticles,
        boolean saveJsonAll,
        double delaySeconds,
        int contextRadius,
        int signalWindow,
        int timeoutSeconds,
        String userAgent,
        String outputDir,
        String runId,      // unique id for each run, used for the output folder
        List<String> nerModels
) {
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (compatible; DrimbleVuurwerkScraper/1.0; +https://example.com)";

    public ScraperConfig {
        if (keyword == null || keyword.isBlank()) throw new IllegalArgumentException("keyword must not be blank");
        if (baseUrl == null || !UrlUtil.isHttpLike(baseUrl)) throw new IllegalArgumentException("base_url must be http(s): " + baseUrl);
        if (searchPath == null) throw new IllegalArgumentException("search_path is required");
        requireNonNegative("max_pages", maxPages);
        requireNonNegative("max_link_depth", maxLinkDepth);
        requireNonNegative("max_links_per_article", maxLinksPerArticle);
        requireNonNegative("max_total_articles", maxTotalArticles);
        requireNonNegative("context_radius", contextRadius);
        requireNonNegative("signal_window", signalWindow);
        if (timeoutSeconds <= 0) throw new IllegalArgumentException("timeout_seconds must be > 0");
        if (delaySeconds < 0 || Double.isNaN(delaySeconds)) throw new IllegalArgumentException("delay_seconds must be >= 0");
        if (userAgent == null || userAgent.isBlank()) userAgent = DEFAULT_USER_AGENT;
        if (outputDir == null || outputDir.isBlank()) outputDir = "output";
        if (runId == null || runId.isBlank()) runId = newRunId();
        nerModels = nerModels == null ? List.of() : List.copyOf(nerModels);
    }

    public static ScraperConfig defaults() {
        return new ScraperConfig(
                "vuurwerk",
                "https://drimble.nl",
                "/zoeken.html",
                1,
                false,
                2,
                5,
                200,
                false,
                1.0,
                80,
                120,
                15,
                DEFAULT_USER_AGENT,
                "output",
                null,
                List.of()
        );
    }

    // Example: 2025-12-25_15-30-12
    public static String newRunId() {
        return DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss").format(LocalDateTime.now());
    }

    public Duration delay() {
        return Duration.ofMillis(Math.round(delaySeconds * 1000));
    }

    public Duration timeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    // output/<runId>
    public Path runOutputDir() {
        return Path.of(outputDir, runId);
    }

    public String csvFileName() {
        return "drimble_" + UrlUtil.slug(keyword.toLowerCase(Locale.ROOT)).replace('-', '_') + ".csv";
    }

    // Search pages 1..maxPages, in order.
    public List<String> searchPageUrls() {
        List<String> urls = new ArrayList<>();
        for (int page = 1; page <= maxPages; page++) {
            urls.add(UrlUtil.searchPageUrl(baseUrl, searchPath, keyword, page));
        }
        return urls;
    }

    public ScraperConfig withBudgets(int maxPages, boolean followLinks, int maxLinkDepth,
                                     int maxLinksPerArticle, int maxTotalArticles) {
        return new ScraperConfig(keyword, baseUrl, searchPath, maxPages, followLinks, maxLinkDepth,
                maxLinksPerArticle, maxTotalArticles, saveJsonAll, delaySeconds, contextRadius, signalWindow,
                timeoutSeconds, userAgent, outputDir, runId, nerModels);
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) throw new IllegalArgumentException(name + " must be >= 0");
    }
}
