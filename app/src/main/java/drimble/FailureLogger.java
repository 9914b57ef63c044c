package drimble;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class FailureLogger {

    // Keep failures in memory and write them once at the end.
    private final List<FailureRecord> failures = new ArrayList<>();

    public void add(FailureRecord record) {
        if (record != null) failures.add(record);
    }

    public boolean isEmpty() {
        return failures.isEmpty();
    }

    public int size() {
        return failures.size();
    }

    public Collection<FailureRecord> snapshot() {
        return List.copyOf(failures);
    }

    public Map<SkipReason, Integer> countsByReason() {
        Map<SkipReason, Integer> counts = new EnumMap<>(SkipReason.class);
        for (FailureRecord f : failures) {
            counts.merge(f.reason(), 1, Integer::sum);
        }
        return counts;
    }
}
