package drimble;

import java.time.Instant;
import java.util.List;

// Everything persisted for one qualifying article.
public record OutputArtifact(
        int index,
        Instant scrapedAt,
        String keyword,
        ArticleRecord article,
        List<KeywordMatch> matches,
        ContextualSignals signals,
        List<Entity> entities
) {
    public OutputArtifact {
        matches = matches == null ? List.of() : List.copyOf(matches);
        entities = entities == null ? List.of() : List.copyOf(entities);
        signals = signals == null ? ContextualSignals.empty() : signals;
    }

    public int occurrenceCount() {
        return matches.size();
    }
}
