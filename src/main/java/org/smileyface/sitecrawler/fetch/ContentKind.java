package org.smileyface.sitecrawler.fetch;

import java.util.Locale;

/**
 * Coarse classification of a response by its {@code Content-Type}, driving persistence and link
 * extraction.
 */
public enum ContentKind {
    HTML,
    PDF,
    TEXT,
    IMAGE,
    BINARY;

    /**
     * Classifies a raw {@code Content-Type} header value; parameters such as charset are ignored.
     * A missing header is {@link #BINARY}.
     */
    public static ContentKind of(String contentType) {
        String mime = mimeType(contentType);
        if (mime == null) return BINARY;
        if (mime.equals("text/html") || mime.equals("application/xhtml+xml")) return HTML;
        if (mime.equals("application/pdf")) return PDF;
        if (mime.startsWith("text/")) return TEXT;
        if (mime.startsWith("image/")) return IMAGE;
        return BINARY;
    }

    /**
     * File extension for a body of this content type, without the dot.
     * Images keep their subtype ({@code image/svg+xml} becomes {@code svg}).
     */
    public static String extensionFor(String contentType) {
        ContentKind kind = of(contentType);
        switch (kind) {
            case HTML:
                return "html";
            case PDF:
                return "pdf";
            case TEXT:
                return "txt";
            case IMAGE:
                String sub = mimeType(contentType).substring("image/".length());
                int plus = sub.indexOf('+');
                if (plus >= 0) sub = sub.substring(0, plus);
                sub = sub.replaceAll("[^a-z0-9]", "");
                return sub.isEmpty() ? "img" : sub;
            default:
                return "bin";
        }
    }

    /**
     * @return lower-cased {@code type/subtype} without parameters, or null if absent
     */
    static String mimeType(String contentType) {
        if (contentType == null) return null;
        int semi = contentType.indexOf(';');
        String mime = (semi >= 0 ? contentType.substring(0, semi) : contentType).trim().toLowerCase(Locale.ROOT);
        return mime.isEmpty() ? null : mime;
    }
}
