package org.smileyface.sitecrawler.persist;

import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecrawler.crawler.CrawlerProperties;
import org.smileyface.sitecrawler.extractor.ContentExtractor;
import org.smileyface.sitecrawler.fetch.ContentKind;
import org.smileyface.sitecrawler.model.ExtractMode;
import org.smileyface.sitecrawler.util.CrawlerUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes fetched bodies to {@code <outputDir>/raw} and companion artifacts to {@code <outputDir>/text}.
 *
 * <p>File names are {@code <segment>_<hash>.<ext>}: the sanitized last path segment of the URL
 * ({@code root} for {@code /}), the first {@value #HASH_LENGTH} hex characters of SHA-1 over the full
 * URL, and an extension inferred from the content type. Names longer than {@value #MAX_NAME_LENGTH}
 * characters drop the segment.</p>
 */
public class ContentPersister {

    private static final Logger log = LoggerFactory.getLogger(ContentPersister.class);

    static final int HASH_LENGTH = 10;
    static final int MAX_NAME_LENGTH = 200;

    private final Path rawDir;
    private final Path textDir;
    private final ContentExtractor extractor;

    public ContentPersister(CrawlerProperties properties, ContentExtractor extractor) {
        Objects.requireNonNull(properties, "properties");
        Path root = Paths.get(properties.getOutputDir());
        this.rawDir = root.resolve("raw");
        this.textDir = root.resolve("text");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /**
     * Creates the {@code raw/} and {@code text/} directories.
     */
    public void init() throws IOException {
        Files.createDirectories(rawDir);
        Files.createDirectories(textDir);
    }

    public Path getRawDir() {
        return rawDir;
    }

    public Path getTextDir() {
        return textDir;
    }

    /**
     * Writes the raw body, replacing an older file of the same name.
     *
     * @return the written file
     */
    public Path saveRaw(String url, String contentType, byte[] body) throws IOException {
        Path target = rawDir.resolve(fileName(url, contentType));
        Files.write(target, body == null ? new byte[0] : body);
        log.debug("Saved raw {} -> {}", url, target);
        return target;
    }

    /**
     * Writes the companion artifact of an HTML page according to {@code mode}: readable text
     * ({@code .txt}) or the decoded HTML ({@code .html}). Nothing is written for
     * {@link ExtractMode#NONE}, for non-HTML content, or when no text could be extracted.
     *
     * @param html parsed page; its {@code outerHtml()} is what {@link ExtractMode#HTML} writes
     * @return the written file, if any
     */
    public Optional<Path> extractAndSaveText(String url, String contentType, Document html, ExtractMode mode)
            throws IOException {
        if (mode == null || mode == ExtractMode.NONE || html == null) {
            return Optional.empty();
        }
        if (ContentKind.of(contentType) != ContentKind.HTML) {
            return Optional.empty();
        }
        String stem = stemOf(fileName(url, contentType));
        Path target;
        String content;
        if (mode == ExtractMode.TEXT) {
            content = extractor.extractReadableText(html);
            target = textDir.resolve(stem + ".txt");
        } else {
            content = html.outerHtml();
            target = textDir.resolve(stem + ".html");
        }
        if (content == null || content.isBlank()) {
            log.debug("No text extracted from {}", url);
            return Optional.empty();
        }
        Files.writeString(target, content, StandardCharsets.UTF_8);
        return Optional.of(target);
    }

    /**
     * Deterministic file name for a URL and content type. Distinct URLs get distinct names as long
     * as their short hashes differ.
     */
    public static String fileName(String url, String contentType) {
        String ext = ContentKind.extensionFor(contentType);
        String hash = CrawlerUtils.shortHash(url, HASH_LENGTH);
        String name = lastSegment(url) + "_" + hash + "." + ext;
        if (name.length() > MAX_NAME_LENGTH) {
            name = hash + "." + ext;
        }
        return name;
    }

    static String lastSegment(String url) {
        String path;
        try {
            path = URI.create(url).getRawPath();
        } catch (IllegalArgumentException e) {
            path = null;
        }
        if (path == null) return "root";
        String segment = "";
        for (String part : path.split("/")) {
            if (!part.isEmpty()) segment = part;
        }
        if (segment.isEmpty()) return "root";
        return segment.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static String stemOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
