package org.smileyface.sitecrawler.crawler;

import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Queue;
import java.util.Set;

/**
 * Breadth-first frontier plus the visited set of a crawl run.
 *
 * <p>Only the crawl loop touches this object, so plain {@link ArrayDeque}/{@link HashSet} are used.
 * A URL is queued at most once (the {@code queued} set is never cleared during a run) and, because
 * traversal is FIFO, always at its shallowest discovery depth. The visited set holds URLs that were
 * dequeued and resolved to a terminal outcome; entries are never removed.</p>
 */
public class Frontier {

    private final Queue<FrontierEntry> queue = new ArrayDeque<>();
    private final Set<String> queued = new HashSet<>();
    private final Set<String> visited = new HashSet<>();

    /**
     * Enqueue an entry unless its URL was queued or visited before.
     *
     * @return true if the entry was added
     */
    public boolean enqueue(FrontierEntry entry) {
        if (entry == null) return false;
        if (visited.contains(entry.url())) return false;
        if (queued.add(entry.url())) {
            queue.add(entry);
            return true;
        }
        return false;
    }

    /**
     * Dequeue the next entry in FIFO order.
     *
     * @return next entry or null if the frontier is empty
     */
    public FrontierEntry poll() {
        return queue.poll();
    }

    public void markVisited(String url) {
        visited.add(url);
    }

    public boolean isVisited(String url) {
        return visited.contains(url);
    }

    /**
     * @return true if the URL is queued, or was queued earlier in this run
     */
    public boolean isKnown(String url) {
        return queued.contains(url) || visited.contains(url);
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public int visitedCount() {
        return visited.size();
    }
}
