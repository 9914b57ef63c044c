package drimble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

// Entry point: loads scraper.json (or the defaults) and runs one crawl.
public class Main {

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length > 1) {
            System.err.println("""
                    Usage: [config.json]
                    Example: scraper.json
                    """);
            System.exit(1);
        }

        ScraperConfig config;
        try {
            config = loadConfig(args.length == 1 ? Path.of(args[0]) : null);
        } catch (RuntimeException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return; // unreachable, but required by compiler
        }

        try {
            int persisted = DrimbleCrawler.create(config).run();
            log.info("Done: {} article(s) with '{}' saved under {}", persisted, config.keyword(), config.runOutputDir());
        } catch (CrawlException e) {
            log.error("Crawl aborted: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    static ScraperConfig loadConfig(Path path) {
        if (path == null) {
            Path local = Path.of("scraper.json");
            return Files.isRegularFile(local) ? ConfigLoader.load(local) : ScraperConfig.defaults();
        }
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Config file not found: " + path);
        }
        return ConfigLoader.load(path);
    }
}
