package drimble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

// Optional NER pass. Without a backend it warns once and returns no entities.
public class EntityEnricher {

    private static final Logger log = LoggerFactory.getLogger(EntityEnricher.class);

    private final EntityRecognizer recognizer;
    private final String unavailableReason;
    private final AtomicBoolean warned = new AtomicBoolean(false);

    private EntityEnricher(EntityRecognizer recognizer, String unavailableReason) {
        this.recognizer = recognizer;
        this.unavailableReason = unavailableReason;
    }

    public static EntityEnricher available(EntityRecognizer recognizer) {
        if (recognizer == null) throw new IllegalArgumentException("recognizer is required");
        return new EntityEnricher(recognizer, null);
    }

    public static EntityEnricher unavailable(String reason) {
        return new EntityEnricher(null, reason);
    }

    // Loads the OpenNLP models; any problem makes the enricher a no-op.
    public static EntityEnricher fromModels(List<String> modelPaths) {
        if (modelPaths == null || modelPaths.isEmpty()) {
            return unavailable("no NER models configured (ner_models)");
        }
        try {
            List<Path> paths = modelPaths.stream().map(Path::of).toList();
            return available(OpenNlpEntityRecognizer.load(paths));
        } catch (IOException | RuntimeException e) {
            return unavailable("could not load NER models " + modelPaths + ": " + e.getMessage());
        }
    }

    public boolean isAvailable() {
        return recognizer != null;
    }

    public List<Entity> enrich(String text) {
        if (recognizer == null) {
            if (warned.compareAndSet(false, true)) {
                log.warn("Entity extraction disabled, continuing without entities: {}", unavailableReason);
            }
            return List.of();
        }
        if (text == null || text.isBlank()) return List.of();
        try {
            List<Entity> entities = recognizer.recognize(text);
            return entities == null ? List.of() : List.copyOf(entities);
        } catch (RuntimeException e) {
            log.warn("Entity extraction failed for one article, persisting without entities: {}", e.toString());
            return List.of();
        }
    }
}
