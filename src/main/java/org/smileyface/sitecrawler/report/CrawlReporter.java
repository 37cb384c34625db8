package org.smileyface.sitecrawler.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.sitecrawler.model.CrawlRecord;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Append-only JSON Lines report: one {@link CrawlRecord} per line, flushed after every record so an
 * interrupted run leaves a complete, replayable file.
 */
public class CrawlReporter implements Closeable {

    private static final Logger log = LogManager.getLogger();

    private final Path path;
    private final ObjectMapper mapper;
    private final BufferedWriter writer;
    private long written;
    private boolean closed;

    /**
     * Opens (and truncates) the report file, creating parent directories as needed.
     */
    public CrawlReporter(Path path, ObjectMapper mapper) throws IOException {
        this.path = Objects.requireNonNull(path, "path");
        this.mapper = Objects.requireNonNull(mapper, "mapper").copy()
                .disable(SerializationFeature.INDENT_OUTPUT);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
    }

    /**
     * Serializes and appends one record, then flushes. A record that fails to serialize is not
     * written at all, so the file never contains a partial line from this method.
     */
    public synchronized void append(CrawlRecord record) throws IOException {
        if (closed) {
            throw new IOException("Report already closed: " + path);
        }
        String line;
        try {
            line = mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IOException("Could not serialize record for " + record.getUrl(), e);
        }
        writer.write(line);
        writer.newLine();
        writer.flush();
        written++;
    }

    public synchronized long getWrittenCount() {
        return written;
    }

    public Path getPath() {
        return path;
    }

    @Override
    public synchronized void close() throws IOException {
        if (closed) return;
        closed = true;
        writer.close();
        log.info("Report closed: {} ({} records)", path, written);
    }
}
