package drimble;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

// End-of-run counts. "attempted" counts fetches, "matched" qualifying articles.
public record CrawlSummary(
        int attempted,
        int fetched,
        int matched,
        int persisted,
        Map<SkipReason, Integer> skipped,
        int leftInFrontier
) {
    public CrawlSummary {
        skipped = skipped == null || skipped.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(skipped));
    }

    public int skipped(SkipReason reason) {
        return skipped.getOrDefault(reason, 0);
    }

    public String describe() {
        String reasons = skipped.isEmpty()
                ? "none"
                : skipped.entrySet().stream()
                        .map(e -> e.getKey().name().toLowerCase(Locale.ROOT) + "=" + e.getValue())
                        .collect(Collectors.joining(", "));
        return "attempted=" + attempted
                + " fetched=" + fetched
                + " matched=" + matched
                + " persisted=" + persisted
                + " skipped[" + reasons + "]"
                + " leftInFrontier=" + leftInFrontier;
    }
}
