package drimble;

import java.util.List;

// Numbers and dates found near any keyword occurrence, deduplicated in first-seen order.
public record ContextualSignals(List<String> nearbyNumbers, List<String> nearbyDates) {

    public ContextualSignals {
        nearbyNumbers = nearbyNumbers == null ? List.of() : List.copyOf(nearbyNumbers);
        nearbyDates = nearbyDates == null ? List.of() : List.copyOf(nearbyDates);
    }

    public static ContextualSignals empty() {
        return new ContextualSignals(List.of(), List.of());
    }
}
