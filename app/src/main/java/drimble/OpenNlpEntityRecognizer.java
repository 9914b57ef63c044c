package drimble;

import opennlp.tools.namefind.NameFinderME;
import opennlp.tools.namefind.TokenNameFinderModel;
import opennlp.tools.tokenize.SimpleTokenizer;
import opennlp.tools.util.Span;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

// NER with OpenNLP name finder models. NameFinderME is not thread-safe; the crawl is sequential.
public class OpenNlpEntityRecognizer implements EntityRecognizer {

    private final List<NameFinderME> finders;

    OpenNlpEntityRecognizer(List<NameFinderME> finders) {
        this.finders = List.copyOf(finders);
    }

    public static OpenNlpEntityRecognizer load(List<Path> modelPaths) throws IOException {
        if (modelPaths.isEmpty()) {
            throw new IOException("no name finder models configured");
        }
        List<NameFinderME> finders = new ArrayList<>();
        for (Path path : modelPaths) {
            try (InputStream in = Files.newInputStream(path)) {
                finders.add(new NameFinderME(new TokenNameFinderModel(in)));
            }
        }
        return new OpenNlpEntityRecognizer(finders);
    }

    @Override
    public List<Entity> recognize(String text) {
        if (text == null || text.isBlank()) return List.of();

        Span[] tokenSpans = SimpleTokenizer.INSTANCE.tokenizePos(text);
        String[] tokens = Span.spansToStrings(tokenSpans, text);

        List<Entity> entities = new ArrayList<>();
        for (NameFinderME finder : finders) {
            for (Span name : finder.find(tokens)) {
                int start = tokenSpans[name.getStart()].getStart();
                int end = tokenSpans[name.getEnd() - 1].getEnd();
                entities.add(new Entity(text.substring(start, end), name.getType(), start, end));
            }
            // each article is its own document
            finder.clearAdaptiveData();
        }
        entities.sort(Comparator.comparingInt(Entity::start).thenComparing(Entity::label));
        return entities;
    }
}
