package drimble;

import com.fasterxml.jackson.databind.ObjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

// One CSV row plus one JSON file (articles/) per artifact, and failures.csv at the end of a run.
public class OutputManager implements ArticleSink {

    private static final Logger log = LoggerFactory.getLogger(OutputManager.class);

    public static final List<String> CSV_COLUMNS = List.of(
            "index", "url", "title", "date", "author", "tags", "main_image", "word_count",
            "occurrence_count", "contexts", "nearby_numbers", "nearby_dates", "entities",
            "json_file", "full_text"
    );

    // Base directory for this run: output/<runId>
    private final Path runOutputDir;
    private final Path csvFile;
    private final Path articlesDir;

    // Keep failures in memory and write them once at the end
    private final FailureLogger failureLogger;

    private final ObjectWriter jsonWriter = JsonUtils.objectMapper().writerWithDefaultPrettyPrinter();
    private boolean opened;

    public OutputManager(Path runOutputDir, String csvFileName, FailureLogger failureLogger) {
        this.runOutputDir = runOutputDir;
        this.csvFile = runOutputDir.resolve(csvFileName);
        this.articlesDir = runOutputDir.resolve("articles");
        this.failureLogger = failureLogger;
    }

    public static OutputManager from(ScraperConfig config, FailureLogger failureLogger) {
        return new OutputManager(config.runOutputDir(), config.csvFileName(), failureLogger);
    }

    public Path csvFile() {
        return csvFile;
    }

    public Path articlesDir() {
        return articlesDir;
    }

    @Override
    public void open() throws PersistException {
        try {
            Files.createDirectories(articlesDir);
            if (!Files.isWritable(runOutputDir) || !Files.isWritable(articlesDir)) {
                throw PersistException.fatal("Output directory is not writable: " + runOutputDir, null);
            }
            // Header only once per file, also when a run id is reused
            if (!Files.exists(csvFile) || Files.size(csvFile) == 0) {
                Files.writeString(csvFile, csvLine(CSV_COLUMNS), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            }
            opened = true;
        } catch (IOException e) {
            throw PersistException.fatal("Could not prepare output directory " + runOutputDir + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void persist(OutputArtifact artifact) throws PersistException {
        if (!opened) open();
        requireDirectory(articlesDir);

        ArticleRecord article = artifact.article();
        String fileName = UrlUtil.toArticleFilename(artifact.index(), article.title(), article.url());
        Path jsonFile = articlesDir.resolve(fileName);
        try {
            jsonWriter.writeValue(jsonFile.toFile(), artifact);
        } catch (IOException e) {
            if (e instanceof AccessDeniedException || !Files.isWritable(articlesDir)) {
                throw PersistException.fatal("Output directory is not writable: " + articlesDir, e);
            }
            throw PersistException.article("Could not write " + jsonFile + ": " + e.getMessage(), e);
        }

        try {
            Files.writeString(csvFile, csvLine(csvRow(artifact, fileName)), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            // no JSON file without its CSV row
            deleteQuietly(jsonFile);
            throw PersistException.article("Could not append to " + csvFile + ": " + e.getMessage(), e);
        }
        log.debug("Saved {} -> {}", article.url(), fileName);
    }

    @Override
    public void dumpUnmatched(int index, ArticleRecord record) throws PersistException {
        if (!opened) open();
        Path dir = articlesDir.resolve("unmatched");
        Path out = dir.resolve(UrlUtil.toArticleFilename(index, record.title(), record.url()));
        try {
            Files.createDirectories(dir);
            jsonWriter.writeValue(out.toFile(), record);
        } catch (IOException e) {
            throw PersistException.article("Could not write " + out + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        writeFailuresFile();
    }

    public void writeFailuresFile() {
        if (failureLogger.isEmpty()) return;

        Path out = runOutputDir.resolve("failures.csv");
        try {
            // depth,url,reason,message
            List<String> lines = new ArrayList<>();
            lines.add("depth,url,reason,message");

            for (FailureRecord f : failureLogger.snapshot()) {
                lines.add(csv(f.depth()) + "," + csv(f.url()) + "," + csv(f.reason()) + "," + csv(f.message()));
            }

            Files.createDirectories(runOutputDir);
            Files.write(out, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);

            log.info("Wrote failures file: {}", out);
        } catch (IOException e) {
            log.error("Could not write failures file {}: {}", out, e.getMessage());
        }
    }

    static List<String> csvRow(OutputArtifact artifact, String jsonFileName) {
        ArticleRecord a = artifact.article();
        List<String> row = new ArrayList<>(CSV_COLUMNS.size());
        row.add(String.valueOf(artifact.index()));
        row.add(a.url());
        row.add(a.title());
        row.add(a.publishedDate());
        row.add(a.author());
        row.add(String.join(";", a.tags()));
        row.add(a.mainImageUrl());
        row.add(String.valueOf(a.wordCount()));
        row.add(String.valueOf(artifact.occurrenceCount()));
        row.add(artifact.matches().stream()
                .map(m -> m.contextWindow().replace("|", "/"))
                .collect(Collectors.joining(" | ")));
        row.add(String.join(";", artifact.signals().nearbyNumbers()));
        row.add(String.join(";", artifact.signals().nearbyDates()));
        row.add(artifact.entities().stream()
                .map(e -> e.text() + "/" + e.label())
                .collect(Collectors.joining(";")));
        row.add(jsonFileName);
        row.add(a.fullText());
        return row;
    }

    private static void requireDirectory(Path dir) throws PersistException {
        if (!Files.isDirectory(dir)) {
            throw PersistException.fatal("Output directory disappeared: " + dir, null);
        }
        if (!Files.isWritable(dir)) {
            throw PersistException.fatal("Output directory is not writable: " + dir, null);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove {} after a failed CSV append: {}", file, e.getMessage());
        }
    }

    private static String csvLine(List<String> fields) {
        return fields.stream().map(OutputManager::csv).collect(Collectors.joining(",")) + "\n";
    }

    // Quote CSV fields safely (minimal)
    static String csv(Object v) {
        String s = v == null ? "" : String.valueOf(v);
        s = s.replace("\"", "\"\"");
        return "\"" + s + "\"";
    }
}
