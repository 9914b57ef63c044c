package drimble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

// BFS over Drimble search results and the articles they lead to.
// One failing URL is dropped; only the first search page or the output directory can end the run.
public class DrimbleCrawler {

    private static final Logger log = LoggerFactory.getLogger(DrimbleCrawler.class);

    private final ScraperConfig config;
    private final Fetcher fetcher;
    private final ArticleExtractor extractor;
    private final KeywordAnalyzer analyzer;
    private final EntityEnricher enricher;
    private final ArticleSink sink;
    private final Sleeper sleeper;
    private final FailureLogger failureLogger;
    private final Clock clock;

    public DrimbleCrawler(ScraperConfig config,
                          Fetcher fetcher,
                          ArticleExtractor extractor,
                          KeywordAnalyzer analyzer,
                          EntityEnricher enricher,
                          ArticleSink sink,
                          Sleeper sleeper,
                          FailureLogger failureLogger,
                          Clock clock) {
        this.config = config;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.analyzer = analyzer;
        this.enricher = enricher;
        this.sink = sink;
        this.sleeper = sleeper;
        this.failureLogger = failureLogger;
        this.clock = clock;
    }

    // Production wiring. The NER backend is resolved here, once.
    public static DrimbleCrawler create(ScraperConfig config) {
        FailureLogger failureLogger = new FailureLogger();
        return new DrimbleCrawler(
                config,
                PageFetcher.from(config),
                new ArticleExtractor(),
                KeywordAnalyzer.from(config),
                EntityEnricher.fromModels(config.nerModels()),
                OutputManager.from(config, failureLogger),
                Sleeper.SYSTEM,
                failureLogger,
                Clock.systemUTC()
        );
    }

    // Number of persisted articles.
    public int run() throws CrawlException {
        return crawl().persisted();
    }

    public CrawlSummary crawl() throws CrawlException {
        Run run = new Run();
        log.info("Crawling for '{}': {} search page(s), follow_links={}, max_link_depth={}, "
                        + "max_links_per_article={}, max_total_articles={}",
                config.keyword(), config.maxPages(), config.followLinks(), config.maxLinkDepth(),
                config.maxLinksPerArticle(), config.maxTotalArticles());

        if (config.maxTotalArticles() == 0) {
            log.info("max_total_articles is 0, nothing to do");
            return run.summary();
        }

        try {
            sink.open();
        } catch (PersistException e) {
            throw new CrawlException("Cannot use output location: " + e.getMessage(), e);
        }

        try {
            for (String url : config.searchPageUrls()) {
                run.frontier.offer(CrawlTask.seed(url));
            }
            drain(run);
        } finally {
            sink.close();
            CrawlSummary summary = run.summary();
            log.info("==== Run summary ==== {}", summary.describe());
            if (!failureLogger.isEmpty()) {
                log.info("Failures by reason: {}", failureLogger.countsByReason());
            }
        }
        return run.summary();
    }

    private void drain(Run run) throws CrawlException {
        while (!run.frontier.isEmpty() && run.persisted < config.maxTotalArticles()) {
            CrawlTask task = run.frontier.poll();

            if (run.frontier.isVisited(task.url())) {
                run.skip(SkipReason.ALREADY_VISITED);
                continue;
            }
            if (task.depth() > config.maxLinkDepth()) {
                run.skip(SkipReason.DEPTH_EXCEEDED);
                continue;
            }
            if (task.origin() == CrawlTask.Origin.SEED && run.searchExhausted) {
                run.skip(SkipReason.SEARCH_EXHAUSTED);
                continue;
            }
            // before the fetch, so a cycle can never cause a second request
            run.frontier.markVisited(task.url());

            try {
                sleeper.sleep(config.delay());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted during politeness delay, stopping crawl");
                return;
            }

            Optional<String> html = fetch(task, run);
            if (html.isEmpty()) continue;

            if (task.origin() == CrawlTask.Origin.SEED) {
                processSearchPage(task, html.get(), run);
            } else {
                processArticle(task, html.get(), run);
            }
        }
    }

    private Optional<String> fetch(CrawlTask task, Run run) throws CrawlException {
        run.attempted++;
        boolean firstSearchPage = task.origin() == CrawlTask.Origin.SEED && !run.searchPageSeen;
        if (task.origin() == CrawlTask.Origin.SEED) run.searchPageSeen = true;
        try {
            String html = fetcher.fetch(task.url());
            run.fetched++;
            return Optional.of(html);
        } catch (FetchException e) {
            if (firstSearchPage) {
                failureLogger.add(FailureRecord.fetch(task, e));
                throw new CrawlException("Search endpoint unreachable: " + e.getMessage(), e);
            }
            log.warn("Dropping {} (depth {}): {}", task.url(), task.depth(), e.getMessage());
            failureLogger.add(FailureRecord.fetch(task, e));
            run.skip(SkipReason.of(e.kind()));
            return Optional.empty();
        }
    }

    private void processSearchPage(CrawlTask task, String html, Run run) {
        List<String> results = SearchResults.articleLinks(html, task.url(), config.keyword());
        if (results.isEmpty()) {
            // most likely past the last page of results
            log.info("No results on {}, stopping pagination", task.url());
            run.searchExhausted = true;
            return;
        }
        int added = enqueueLinks(task, results, run);
        log.info("Found {} potential articles on {} ({} queued)", results.size(), task.url(), added);
    }

    private void processArticle(CrawlTask task, String html, Run run) throws CrawlException {
        ArticleRecord record = extractor.extract(html, task.url());
        Optional<KeywordAnalysis> analysis = analyzer.analyze(record, config.keyword());

        if (analysis.isEmpty()) {
            log.info("'{}' not in text of {}, skipping", config.keyword(), task.url());
            run.skip(SkipReason.NO_KEYWORD);
            if (config.saveJsonAll()) {
                dumpUnmatched(task, record, run);
            }
            return;
        }

        run.matched++;
        KeywordAnalysis found = analysis.get();
        List<Entity> entities = enricher.enrich(record.fullText());
        OutputArtifact artifact = new OutputArtifact(
                run.matched,
                clock.instant(),
                config.keyword(),
                record,
                found.matches(),
                found.signals(),
                entities
        );

        try {
            sink.persist(artifact);
            run.persisted++;
            log.info("({}) Saved {} [{} occurrence(s), depth {}]",
                    run.persisted, task.url(), found.occurrenceCount(), task.depth());
        } catch (PersistException e) {
            failureLogger.add(FailureRecord.persist(task, e));
            if (e.isFatal()) {
                throw new CrawlException("Output no longer writable: " + e.getMessage(), e);
            }
            log.error("Could not save {}: {}", task.url(), e.getMessage());
            run.skip(SkipReason.PERSIST_FAILED);
            return;
        }

        if (config.followLinks() && run.persisted < config.maxTotalArticles()) {
            enqueueLinks(task, record.outboundLinks(), run);
        }
    }

    // Up to max_links_per_article links this run has not seen yet, one level deeper.
    private int enqueueLinks(CrawlTask parent, Collection<String> links, Run run) {
        if (parent.depth() + 1 > config.maxLinkDepth()) return 0;
        int added = 0;
        for (String link : links) {
            if (added >= config.maxLinksPerArticle()) break;
            if (run.frontier.isKnown(link)) continue;
            if (run.frontier.offer(parent.child(link))) added++;
        }
        if (added > 0) {
            log.debug("Queued {} link(s) from {} at depth {}", added, parent.url(), parent.depth() + 1);
        }
        return added;
    }

    private void dumpUnmatched(CrawlTask task, ArticleRecord record, Run run) throws CrawlException {
        try {
            sink.dumpUnmatched(run.skipped(SkipReason.NO_KEYWORD), record);
        } catch (PersistException e) {
            if (e.isFatal()) {
                throw new CrawlException("Output no longer writable: " + e.getMessage(), e);
            }
            log.warn("Could not dump unmatched page {}: {}", task.url(), e.getMessage());
        }
    }

    // Mutable state of one crawl() call.
    private static final class Run {
        final CrawlFrontier frontier = new CrawlFrontier();
        final Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);
        int attempted;
        int fetched;
        int matched;
        int persisted;
        boolean searchPageSeen;
        boolean searchExhausted;

        void skip(SkipReason reason) {
            skipped.merge(reason, 1, Integer::sum);
        }

        int skipped(SkipReason reason) {
            return skipped.getOrDefault(reason, 0);
        }

        CrawlSummary summary() {
            return new CrawlSummary(attempted, fetched, matched, persisted, skipped, frontier.size());
        }
    }
}
