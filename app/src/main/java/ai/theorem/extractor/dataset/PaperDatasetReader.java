package ai.theorem.extractor.dataset;

import ai.theorem.extractor.pipeline.Paper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads papers either from a JSON dataset file or from a directory of {@code .tex} sources.
 * <p>
 * A dataset file holds one JSON object per line (or a single JSON array of objects) with a required
 * {@code full_text} field and an optional {@code paper_link} field.
 */
public class PaperDatasetReader {

    static final String FULL_TEXT_FIELD = "full_text";
    static final String PAPER_LINK_FIELD = "paper_link";

    private static final Logger LOGGER = LoggerFactory.getLogger(PaperDatasetReader.class);

    private final ObjectMapper objectMapper;

    public PaperDatasetReader() {
        this(new ObjectMapper());
    }

    public PaperDatasetReader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public List<Paper> read(Path source) {
        Objects.requireNonNull(source, "source");
        if (!Files.exists(source)) {
            throw new DatasetReadException("Dataset not found: " + source, null);
        }
        List<Paper> papers = Files.isDirectory(source) ? readTexDirectory(source) : readDatasetFile(source);
        LOGGER.info("Loaded {} papers from {}", papers.size(), source);
        return papers;
    }

    private List<Paper> readTexDirectory(Path directory) {
        List<Path> sources;
        try (Stream<Path> files = Files.list(directory)) {
            sources = files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".tex"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new DatasetReadException("Failed to list LaTeX sources in " + directory, ex);
        }
        List<Paper> papers = new ArrayList<>(sources.size());
        for (Path path : sources) {
            try {
                papers.add(Paper.of(path.getFileName().toString(), Files.readString(path, StandardCharsets.UTF_8)));
            } catch (IOException ex) {
                throw new DatasetReadException("Failed to read LaTeX source " + path, ex);
            }
        }
        return papers;
    }

    private List<Paper> readDatasetFile(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new DatasetReadException("Failed to read dataset " + file, ex);
        }
        if (content.stripLeading().startsWith("[")) {
            return readJsonArray(file, content);
        }
        List<Paper> papers = new ArrayList<>();
        String[] lines = content.split("\\R");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            int lineNumber = i + 1;
            JsonNode node = parse(file, lineNumber, line);
            toPaper(node).ifPresentOrElse(papers::add,
                    () -> LOGGER.warn("Skipping line {} of {}: missing '{}'", lineNumber, file, FULL_TEXT_FIELD));
        }
        return papers;
    }

    private List<Paper> readJsonArray(Path file, String content) {
        JsonNode root = parse(file, 1, content);
        List<Paper> papers = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            int position = index++;
            toPaper(node).ifPresentOrElse(papers::add,
                    () -> LOGGER.warn("Skipping entry {} of {}: missing '{}'", position, file, FULL_TEXT_FIELD));
        }
        return papers;
    }

    private JsonNode parse(Path file, int lineNumber, String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new DatasetReadException("Invalid JSON at line " + lineNumber + " of " + file, ex);
        }
    }

    private Optional<Paper> toPaper(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        JsonNode fullText = node.get(FULL_TEXT_FIELD);
        if (fullText == null || !fullText.isTextual()) {
            return Optional.empty();
        }
        JsonNode link = node.get(PAPER_LINK_FIELD);
        String paperLink = link != null && link.isTextual() ? link.asText() : null;
        return Optional.of(Paper.of(paperLink, fullText.asText()));
    }
}
