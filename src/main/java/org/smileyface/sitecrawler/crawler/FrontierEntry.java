package org.smileyface.sitecrawler.crawler;

/**
 * A canonical URL waiting in the frontier, with its distance in links from the seed (seed = 0).
 */
public record FrontierEntry(String url, int depth) {

    public FrontierEntry {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null/blank");
        }
        if (depth < 0) {
            throw new IllegalArgumentException("depth must be >= 0: " + depth);
        }
    }

    /**
     * @return an entry one link further from the seed than this one
     */
    public FrontierEntry child(String childUrl) {
        return new FrontierEntry(childUrl, depth + 1);
    }
}
