package drimble;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

// FIFO queue of pending tasks. A URL is queued at most once per run and fetched at most once.
public class CrawlFrontier {

    private final Deque<CrawlTask> queue = new ArrayDeque<>();
    private final Set<String> enqueued = new HashSet<>();
    private final Set<String> visited = new LinkedHashSet<>();

    // false when the URL was already enqueued in this run
    public boolean offer(CrawlTask task) {
        String normalized = UrlUtil.normalize(task.url());
        if (!enqueued.add(normalized)) return false;
        queue.addLast(new CrawlTask(normalized, task.depth(), task.origin()));
        return true;
    }

    public CrawlTask poll() {
        return queue.pollFirst();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public boolean isKnown(String url) {
        String normalized = UrlUtil.normalize(url);
        return enqueued.contains(normalized) || visited.contains(normalized);
    }

    public boolean isVisited(String url) {
        return visited.contains(UrlUtil.normalize(url));
    }

    // false when the URL was visited before
    public boolean markVisited(String url) {
        return visited.add(UrlUtil.normalize(url));
    }

    public Set<String> visited() {
        return Collections.unmodifiableSet(visited);
    }
}
