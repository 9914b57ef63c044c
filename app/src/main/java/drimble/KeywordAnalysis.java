package drimble;

import java.util.List;

// Result of a successful keyword scan: at least one match.
public record KeywordAnalysis(List<KeywordMatch> matches, ContextualSignals signals) {

    public KeywordAnalysis {
        if (matches == null || matches.isEmpty()) {
            throw new IllegalArgumentException("analysis requires at least one match");
        }
        matches = List.copyOf(matches);
        signals = signals == null ? ContextualSignals.empty() : signals;
    }

    public int occurrenceCount() {
        return matches.size();
    }
}
