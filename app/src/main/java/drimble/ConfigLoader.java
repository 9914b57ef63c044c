package drimble;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

// Reads a scraper.json file. Every key is optional; missing keys keep their defaults.
public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static ScraperConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(JsonUtils.objectMapper().readTree(in));
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }

    public static ScraperConfig fromJson(JsonNode node) {
        ScraperConfig d = ScraperConfig.defaults();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return d;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("config root must be a JSON object");
        }
        return new ScraperConfig(
                text(node, "keyword", d.keyword()),
                text(node, "base_url", d.baseUrl()),
                text(node, "search_path", d.searchPath()),
                integer(node, "max_pages", d.maxPages()),
                bool(node, "follow_links", d.followLinks()),
                integer(node, "max_link_depth", d.maxLinkDepth()),
                integer(node, "max_links_per_article", d.maxLinksPerArticle()),
                integer(node, "max_total_articles", d.maxTotalArticles()),
                bool(node, "save_json_all", d.saveJsonAll()),
                number(node, "delay_seconds", d.delaySeconds()),
                integer(node, "context_radius", d.contextRadius()),
                integer(node, "signal_window", d.signalWindow()),
                integer(node, "timeout_seconds", d.timeoutSeconds()),
                text(node, "user_agent", d.userAgent()),
                text(node, "output_dir", d.outputDir()),
                text(node, "run_id", null),
                strings(node, "ner_models", d.nerModels())
        );
    }

    private static String text(JsonNode node, String field, String fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        if (!value.isTextual()) throw invalid(field, "a string");
        return value.asText();
    }

    private static int integer(JsonNode node, String field, int fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        if (!value.isIntegralNumber() || !value.canConvertToInt()) throw invalid(field, "an integer");
        return value.intValue();
    }

    private static double number(JsonNode node, String field, double fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        if (!value.isNumber()) throw invalid(field, "a number");
        return value.doubleValue();
    }

    private static boolean bool(JsonNode node, String field, boolean fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        if (!value.isBoolean()) throw invalid(field, "true or false");
        return value.booleanValue();
    }

    private static List<String> strings(JsonNode node, String field, List<String> fallback) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return fallback;
        if (!value.isArray()) throw invalid(field, "an array of strings");
        List<String> out = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) throw invalid(field, "an array of strings");
            out.add(item.asText());
        }
        return out;
    }

    private static IllegalArgumentException invalid(String field, String expected) {
        return new IllegalArgumentException("Invalid value for " + field + " (expected " + expected + ")");
    }
}
