package drimble;

import java.util.List;

// NLP backend behind the entity enricher. Implementations may throw on bad input.
@FunctionalInterface
public interface EntityRecognizer {

    List<Entity> recognize(String text);
}
