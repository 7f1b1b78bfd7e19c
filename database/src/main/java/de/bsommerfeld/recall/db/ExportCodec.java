package de.bsommerfeld.recall.db;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import de.bsommerfeld.recall.core.domain.ExportData;
import de.bsommerfeld.recall.core.error.MemoryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link ExportData} as pretty-printed JSON with snake_case
 * field names.
 */
public class ExportCodec {

    private static final Logger LOG = LoggerFactory.getLogger(ExportCodec.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public String toJson(ExportData data) {
        try {
            return mapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize export", e);
        }
    }

    /**
     * @throws MemoryException {@code INVALID_ARGUMENT} if the text is not a
     *                         valid export document
     */
    public ExportData fromJson(String json) {
        try {
            return mapper.readValue(json, ExportData.class);
        } catch (JsonProcessingException e) {
            throw MemoryException.invalidArgument("malformed export document: " + e.getOriginalMessage());
        }
    }

    public void write(Path file, ExportData data) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, toJson(data));
            LOG.info("Wrote export to {}", file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write export to " + file, e);
        }
    }

    public ExportData read(Path file) {
        try {
            return fromJson(Files.readString(file));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read export from " + file, e);
        }
    }
}
