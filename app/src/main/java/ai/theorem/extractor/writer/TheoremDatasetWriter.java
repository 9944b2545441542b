package ai.theorem.extractor.writer;

import ai.theorem.extractor.pipeline.TheoremRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;

/**
 * Writes theorem records as JSON Lines, one record per line.
 */
public class TheoremDatasetWriter {

    private final ObjectMapper objectMapper;

    public TheoremDatasetWriter() {
        this(new ObjectMapper());
    }

    public TheoremDatasetWriter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public void write(Path target, List<TheoremRecord> records) {
        if (target == null || records == null) {
            throw new IllegalArgumentException("target and records must be provided");
        }
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                for (TheoremRecord record : records) {
                    writer.write(objectMapper.writeValueAsString(record));
                    writer.newLine();
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write theorem dataset: " + target, ex);
        }
    }
}
