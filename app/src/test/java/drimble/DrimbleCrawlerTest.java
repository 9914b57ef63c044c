package drimble;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import static drimble.FakeSite.articleUrl;
import static drimble.FakeSite.searchUrl;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DrimbleCrawlerTest {

    private final List<String> events = new ArrayList<>();
    private final FailureLogger failures = new FailureLogger();
    private final RecordingSink sink = new RecordingSink();

    @Test
    void zeroArticleBudgetMeansNoFetchesAndNoSinkCalls() throws Exception {
        FakeSite site = new FakeSite().searchPage(1, "a", "b").article("a", "Vuurwerk.").article("b", "Vuurwerk.");

        int persisted = crawler(config(5, true, 3, 5, 0, false), site).run();

        assertEquals(0, persisted);
        assertTrue(site.calls().isEmpty());
        assertEquals(0, sink.openCalls);
        assertEquals(0, sink.persistCalls);
    }

    @Test
    void linkCyclesNeverCauseASecondFetch() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a", "b")
                .article("a", "Vuurwerk in A.", "b", "c", "a")
                .article("b", "Vuurwerk in B.", "a", "c")
                .article("c", "Vuurwerk in C.", "a", "b");

        int persisted = crawler(config(1, true, 5, 10, 100, false), site).run();

        assertEquals(3, persisted);
        assertEquals(new HashSet<>(site.calls()).size(), site.calls().size());
        assertEquals(List.of(searchUrl(1), articleUrl("a"), articleUrl("b"), articleUrl("c")), site.calls());
    }

    @Test
    void articlesArePersistedInBreadthFirstOrder() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a", "b")
                .article("a", "Vuurwerk in A.", "a1")
                .article("b", "Vuurwerk in B.", "b1")
                .article("a1", "Vuurwerk in A1.", "a2")
                .article("b1", "Vuurwerk in B1.")
                .article("a2", "Vuurwerk in A2.");

        CrawlSummary summary = crawler(config(1, true, 3, 5, 100, false), site).crawl();

        assertEquals(List.of(articleUrl("a"), articleUrl("b"), articleUrl("a1"), articleUrl("b1"), articleUrl("a2")),
                sink.urls());
        assertEquals(List.of(1, 2, 3, 4, 5), sink.persisted.stream().map(OutputArtifact::index).toList());
        assertEquals(5, summary.persisted());
        assertEquals(6, summary.attempted());
        assertTrue(sink.closed);
    }

    @Test
    void withoutFollowLinksOnlySearchResultsAreVisited() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a")
                .article("a", "Vuurwerk in A.", "b")
                .article("b", "Vuurwerk in B.");

        crawler(config(1, false, 5, 5, 100, false), site).run();

        assertEquals(List.of(searchUrl(1), articleUrl("a")), site.calls());
    }

    @Test
    void fanOutIsCappedPerArticle() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a")
                .article("a", "Vuurwerk in A.", "b", "c", "d")
                .article("b", "Vuurwerk in B.")
                .article("c", "Vuurwerk in C.")
                .article("d", "Vuurwerk in D.");

        crawler(config(1, true, 5, 2, 100, false), site).run();

        assertEquals(List.of(searchUrl(1), articleUrl("a"), articleUrl("b"), articleUrl("c")), site.calls());
    }

    @Test
    void searchPageFanOutIsCappedToo() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a", "b", "c")
                .article("a", "Vuurwerk in A.")
                .article("b", "Vuurwerk in B.")
                .article("c", "Vuurwerk in C.");

        CrawlSummary summary = crawler(config(1, true, 3, 1, 100, false), site).crawl();

        assertEquals(List.of(searchUrl(1), articleUrl("a")), site.calls());
        assertEquals(1, summary.persisted());
    }

    @Test
    void linksBeyondMaxDepthAreNotFollowed() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a")
                .article("a", "Vuurwerk in A.", "b")
                .article("b", "Vuurwerk in B.");

        crawler(config(1, true, 1, 5, 100, false), site).run();

        assertEquals(List.of(searchUrl(1), articleUrl("a")), site.calls());
    }

    @Test
    void totalArticleBudgetStopsTheRun() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a", "b", "c")
                .article("a", "Vuurwerk in A.")
                .article("b", "Vuurwerk in B.")
                .article("c", "Vuurwerk in C.");

        CrawlSummary summary = crawler(config(1, true, 3, 5, 2, false), site).crawl();

        assertEquals(2, summary.persisted());
        assertFalse(site.calls().contains(articleUrl("c")));
        assertEquals(1, summary.leftInFrontier());
    }

    @Test
    void failedArticleIsDroppedAndTheRunContinues() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a", "b", "c")
                .article("a", "Vuurwerk in A.")
                .failing(articleUrl("b"), FetchException.timeout(articleUrl("b"), null))
                .article("c", "Vuurwerk in C.");

        CrawlSummary summary = crawler(config(1, false, 3, 5, 100, false), site).crawl();

        assertEquals(List.of(articleUrl("a"), articleUrl("c")), sink.urls());
        assertEquals(1, summary.skipped(SkipReason.TIMEOUT));
        assertEquals(1, failures.size());
        assertEquals(articleUrl("b"), failures.snapshot().iterator().next().url());
        assertEquals(1, site.calls().stream().filter(articleUrl("b")::equals).count());
    }

    @Test
    void unreachableFirstSearchPageFailsTheRun() {
        FakeSite site = new FakeSite()
                .failing(searchUrl(1), FetchException.transport(searchUrl(1), new java.net.UnknownHostException("drimble.nl")));

        assertThrows(CrawlException.class, () -> crawler(config(2, false, 3, 5, 100, false), site).run());
        assertEquals(List.of(searchUrl(1)), site.calls());
        assertTrue(sink.closed);
    }

    @Test
    void laterSearchPageFailureIsOnlyLogged() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a")
                .article("a", "Vuurwerk in A.");

        // page 2 is not in the fake site and answers 404
        CrawlSummary summary = crawler(config(2, false, 3, 5, 100, false), site).crawl();

        assertEquals(1, summary.persisted());
        assertEquals(1, summary.skipped(SkipReason.HTTP_STATUS));
    }

    @Test
    void emptySearchPageStopsPagination() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a")
                .searchPage(2)
                .searchPage(3, "b")
                .article("a", "Vuurwerk in A.")
                .article("b", "Vuurwerk in B.");

        CrawlSummary summary = crawler(config(3, false, 3, 5, 100, false), site).crawl();

        assertEquals(List.of(searchUrl(1), searchUrl(2), articleUrl("a")), site.calls());
        assertEquals(1, summary.skipped(SkipReason.SEARCH_EXHAUSTED));
    }

    @Test
    void pagesWithoutKeywordAreDroppedOrDumped() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a", "b")
                .article("a", "Alleen over het weer.")
                .article("b", "Vuurwerk in B.");

        CrawlSummary plain = crawler(config(1, false, 3, 5, 100, false), site).crawl();
        assertEquals(List.of(articleUrl("b")), sink.urls());
        assertEquals(1, plain.skipped(SkipReason.NO_KEYWORD));
        assertEquals(2, plain.matched() + plain.skipped(SkipReason.NO_KEYWORD));
        assertTrue(sink.unmatched.isEmpty());

        RecordingSink debugSink = new RecordingSink();
        crawler(config(1, false, 3, 5, 100, true), new FakeSite()
                .searchPage(1, "a")
                .article("a", "Alleen over het weer."), debugSink).run();
        assertEquals(1, debugSink.unmatched.size());
        assertTrue(debugSink.persisted.isEmpty());
    }

    @Test
    void politenessDelayPrecedesEveryFetch() throws Exception {
        FakeSite site = new FakeSite(events)
                .searchPage(1, "a")
                .article("a", "Vuurwerk in A.");

        crawler(config(1, false, 3, 5, 100, false), site).run();

        assertEquals(List.of(
                "sleep PT1S", "fetch " + searchUrl(1),
                "sleep PT1S", "fetch " + articleUrl("a")
        ), events);
    }

    @Test
    void persistFailureForOneArticleIsSkipped() throws Exception {
        sink.failingFor(url -> url.equals(articleUrl("a")), false);
        FakeSite site = new FakeSite()
                .searchPage(1, "a", "b")
                .article("a", "Vuurwerk in A.")
                .article("b", "Vuurwerk in B.");

        CrawlSummary summary = crawler(config(1, false, 3, 5, 100, false), site).crawl();

        assertEquals(List.of(articleUrl("b")), sink.urls());
        assertEquals(1, summary.skipped(SkipReason.PERSIST_FAILED));
        assertEquals(SkipReason.PERSIST_FAILED, failures.snapshot().iterator().next().reason());
    }

    @Test
    void fatalPersistFailureStopsTheRun() {
        sink.failingFor(url -> true, true);
        FakeSite site = new FakeSite()
                .searchPage(1, "a", "b")
                .article("a", "Vuurwerk in A.")
                .article("b", "Vuurwerk in B.");

        assertThrows(CrawlException.class, () -> crawler(config(1, false, 3, 5, 100, false), site).run());
        assertFalse(site.calls().contains(articleUrl("b")));
    }

    @Test
    void artifactCarriesMatchesSignalsAndEntities() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a")
                .article("a", "Volgens de politie: 12 vuurwerkbommen explodeerden op 31 december 2024 in Zwolle.");
        EntityEnricher enricher = EntityEnricher.available(text -> {
            int start = text.indexOf("Zwolle");
            return List.of(new Entity("Zwolle", "location", start, start + 6));
        });

        crawler(config(1, false, 3, 5, 100, false), site, sink, enricher).run();

        OutputArtifact artifact = sink.persisted.get(0);
        assertEquals("Artikel a", artifact.article().title());
        assertEquals("vuurwerk", artifact.keyword());
        assertEquals(1, artifact.occurrenceCount());
        assertTrue(artifact.signals().nearbyNumbers().contains("12"));
        assertTrue(artifact.signals().nearbyDates().contains("31 december 2024"));
        assertEquals("Zwolle", artifact.entities().get(0).text());
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), artifact.scrapedAt());
    }

    @Test
    void unavailableEnricherDoesNotBlockPersistence() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a", "b")
                .article("a", "Vuurwerk in A.")
                .article("b", "Vuurwerk in B.");

        crawler(config(1, false, 3, 5, 100, false), site, sink, EntityEnricher.unavailable("no model")).run();

        assertEquals(2, sink.persisted.size());
        assertTrue(sink.persisted.stream().allMatch(a -> a.entities().isEmpty()));
    }

    @Test
    void eachRunStartsWithFreshState() throws Exception {
        FakeSite site = new FakeSite()
                .searchPage(1, "a")
                .article("a", "Vuurwerk in A.");
        DrimbleCrawler crawler = crawler(config(1, false, 3, 5, 100, false), site);

        assertEquals(1, crawler.run());
        assertEquals(1, crawler.run());
        assertEquals(4, site.calls().size());
    }

    private DrimbleCrawler crawler(ScraperConfig config, FakeSite site) {
        return crawler(config, site, sink);
    }

    private DrimbleCrawler crawler(ScraperConfig config, FakeSite site, RecordingSink target) {
        return crawler(config, site, target, EntityEnricher.unavailable("not needed in this test"));
    }

    private DrimbleCrawler crawler(ScraperConfig config, FakeSite site, RecordingSink target, EntityEnricher enricher) {
        return new DrimbleCrawler(
                config,
                site,
                new ArticleExtractor(),
                KeywordAnalyzer.from(config),
                enricher,
                target,
                duration -> events.add("sleep " + duration),
                failures,
                Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC)
        );
    }

    private static ScraperConfig config(int maxPages, boolean followLinks, int maxLinkDepth,
                                        int maxLinksPerArticle, int maxTotalArticles, boolean saveJsonAll) {
        ScraperConfig d = ScraperConfig.defaults();
        return new ScraperConfig(d.keyword(), FakeSite.BASE, d.searchPath(), maxPages, followLinks, maxLinkDepth,
                maxLinksPerArticle, maxTotalArticles, saveJsonAll, 1.0, 40, 60, d.timeoutSeconds(),
                d.userAgent(), d.outputDir(), "test", List.of());
    }
}
