package com.eainde.extraction.load;

import com.eainde.extraction.exception.ContentLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads pre-rendered UTF-8 text from a local path or {@code file:} URI.
 *
 * <p>Text longer than {@code extraction.content.max-length} characters is cut at that
 * length and {@value #TRUNCATION_MARKER} is appended. Remote URLs are rejected:
 * rendering pages is left to whatever produced the file.</p>
 */
@Slf4j
@Component
public class FileContentLoader implements ContentLoader {

    static final String TRUNCATION_MARKER = "\n\n[content truncated]";

    private final int maxLength;

    public FileContentLoader(@Value("${extraction.content.max-length:50000}") int maxLength) {
        if (maxLength < 1) throw new IllegalArgumentException("maxLength must be >= 1");
        this.maxLength = maxLength;
    }

    @Override
    public String load(String source) {
        if (source == null || source.isBlank()) {
            throw new ContentLoadException("No source given");
        }

        Path path = resolve(source.strip());
        log.info("Loading content from {}", path);

        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ContentLoadException("Failed to read " + path + ": " + e.getMessage(), e);
        }

        if (text.length() > maxLength) {
            log.warn("Content of {} chars exceeds limit of {}; truncating", text.length(), maxLength);
            text = text.substring(0, maxLength) + TRUNCATION_MARKER;
        }

        log.info("Content loaded: {} chars", text.length());
        return text;
    }

    private Path resolve(String source) {
        try {
            if (source.startsWith("file:")) {
                return Path.of(URI.create(source));
            }
            if (source.startsWith("http://") || source.startsWith("https://")) {
                throw new ContentLoadException(
                        "Remote source " + source + " is not supported; supply the rendered text as a file");
            }
            return Path.of(source);
        } catch (IllegalArgumentException e) {
            throw new ContentLoadException("Invalid source '" + source + "': " + e.getMessage(), e);
        }
    }
}
