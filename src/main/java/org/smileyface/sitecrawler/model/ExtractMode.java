package org.smileyface.sitecrawler.model;

/**
 * What to write next to the raw body of an HTML page.
 */
public enum ExtractMode {
    /** Raw body only. */
    NONE,
    /** Readable paragraph text as {@code text/<name>.txt}. */
    TEXT,
    /** The decoded HTML re-saved as {@code text/<name>.html}. */
    HTML
}
